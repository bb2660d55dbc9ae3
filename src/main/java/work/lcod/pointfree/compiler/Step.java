package work.lcod.pointfree.compiler;

import java.util.List;
import java.util.Objects;

/**
 * One emitted instruction: {@code output := operator(inputs)}.
 */
public record Step(Placeholder output, Primitive operator, List<Operand> inputs, String comment) {
    public Step {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(operator, "operator");
        inputs = List.copyOf(inputs);
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
