package work.lcod.pointfree.compiler;

import java.util.Objects;

/**
 * Input of a {@link Step}: either a {@link Placeholder} produced by an earlier step or literal text.
 */
public sealed interface Operand permits Placeholder, Operand.Literal {
    record Literal(String text) implements Operand {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }
}
