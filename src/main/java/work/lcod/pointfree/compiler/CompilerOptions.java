package work.lcod.pointfree.compiler;

import java.util.Objects;
import work.lcod.pointfree.ast.ExpressionParser;

/**
 * Immutable knobs for {@link PointFreeCompiler}.
 */
public record CompilerOptions(
    boolean emitComments,
    int maxNestingDepth,
    String identityCard,
    String constantCard
) {
    public static final String DEFAULT_IDENTITY_CARD = "identity";
    public static final String DEFAULT_CONSTANT_CARD = "constant";

    public CompilerOptions {
        Objects.requireNonNull(identityCard, "identityCard");
        Objects.requireNonNull(constantCard, "constantCard");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (identityCard.isBlank() || constantCard.isBlank()) {
            throw new IllegalArgumentException("Operator card names must not be blank");
        }
    }

    public static CompilerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .emitComments(emitComments)
            .maxNestingDepth(maxNestingDepth)
            .identityCard(identityCard)
            .constantCard(constantCard);
    }

    public static final class Builder {
        private boolean emitComments = true;
        private int maxNestingDepth = ExpressionParser.DEFAULT_MAX_DEPTH;
        private String identityCard = DEFAULT_IDENTITY_CARD;
        private String constantCard = DEFAULT_CONSTANT_CARD;

        public Builder emitComments(boolean emitComments) {
            this.emitComments = emitComments;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder identityCard(String identityCard) {
            this.identityCard = identityCard;
            return this;
        }

        public Builder constantCard(String constantCard) {
            this.constantCard = constantCard;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(emitComments, maxNestingDepth, identityCard, constantCard);
        }
    }
}
