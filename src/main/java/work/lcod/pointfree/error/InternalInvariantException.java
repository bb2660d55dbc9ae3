package work.lcod.pointfree.error;

/**
 * A compiler pass was handed a node it must never see. Unreachable from valid input.
 */
public final class InternalInvariantException extends CompileException {
    public InternalInvariantException(String message, String snippet) {
        super(Kind.INTERNAL, message, snippet);
    }
}
