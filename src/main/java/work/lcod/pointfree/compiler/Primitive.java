package work.lcod.pointfree.compiler;

/**
 * Closed set of operators the downstream engine understands. Nothing else is ever emitted.
 */
public enum Primitive {
    OP_BY_NAME("op_by_name"),
    APPLY("apply"),
    APPLY0("apply0"),
    APPLY2("apply2"),
    APPLY3("apply3"),
    FLIP("flip"),
    PIPE("pipe"),
    PIPE2("pipe2"),
    STRING("String"),
    INTEGER("Integer"),
    DOUBLE("Double"),
    BOOLEAN("Boolean");

    public static final int MAX_APPLY_ARITY = 3;

    private final String wireName;

    Primitive(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Primitive applyFor(int arity) {
        return switch (arity) {
            case 0 -> APPLY0;
            case 1 -> APPLY;
            case 2 -> APPLY2;
            case 3 -> APPLY3;
            default -> throw new IllegalArgumentException("No apply primitive for arity " + arity);
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
