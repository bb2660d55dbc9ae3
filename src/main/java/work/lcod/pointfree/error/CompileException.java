package work.lcod.pointfree.error;

/**
 * Base type for every failure raised while compiling a program. Failures are deterministic:
 * compiling the same text again reproduces the same exception.
 */
public abstract class CompileException extends RuntimeException {
    private final Kind kind;
    private final String snippet;

    protected CompileException(Kind kind, String message, String snippet) {
        super(message);
        this.kind = kind;
        this.snippet = snippet;
    }

    public Kind kind() {
        return kind;
    }

    /** Offending source text or operator name, or {@code null} when there is none. */
    public String snippet() {
        return snippet;
    }

    public enum Kind {
        FORMAT,
        CAPABILITY,
        INTERNAL
    }
}
