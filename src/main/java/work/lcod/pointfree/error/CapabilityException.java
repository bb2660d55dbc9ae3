package work.lcod.pointfree.error;

/**
 * The request is well formed but the fixed combinator vocabulary cannot express it.
 */
public final class CapabilityException extends CompileException {
    private final String operator;
    private final String limit;

    public CapabilityException(String operator, String limit, String message) {
        super(Kind.CAPABILITY, message, operator);
        this.operator = operator;
        this.limit = limit;
    }

    public String operator() {
        return operator;
    }

    /** Short description of the violated limit, e.g. {@code dynamic-arguments<=2}. */
    public String limit() {
        return limit;
    }
}
