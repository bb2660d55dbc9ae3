package work.lcod.pointfree.compiler;

import java.util.Objects;

/**
 * Stands for the not-yet-named result of one step. Equality is identity: two placeholders
 * never unify, even when their base names and signatures match.
 */
public final class Placeholder implements Operand {
    private final String baseName;
    private final int id;

    Placeholder(String baseName, int id) {
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        this.id = id;
    }

    public String baseName() {
        return baseName;
    }

    public int id() {
        return id;
    }

    @Override
    public String toString() {
        return "<" + baseName + "#" + id + ">";
    }
}
