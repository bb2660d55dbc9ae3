package work.lcod.pointfree.error;

/**
 * Input text does not have the {@code name(in) := expression} shape, or a token inside it
 * cannot be recognized.
 */
public final class FormatException extends CompileException {
    public FormatException(String message, String snippet) {
        super(Kind.FORMAT, message + ": " + snippet, snippet);
    }
}
