package work.lcod.pointfree.ast;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree produced by {@link ExpressionParser}.
 *
 * <p>{@link #signature()} is a canonical text form used only as a memo key; two nodes with the
 * same signature compile to the same result.
 */
public sealed interface AstNode {
    String signature();

    /** Source-like rendering, used in comments and error messages. */
    String source();

    record Call(String name, List<AstNode> children) implements AstNode {
        public Call {
            Objects.requireNonNull(name, "name");
            children = List.copyOf(children);
        }

        @Override
        public String signature() {
            var builder = new StringBuilder(name).append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(children.get(i).signature());
            }
            return builder.append(')').toString();
        }

        @Override
        public String source() {
            var builder = new StringBuilder(name).append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(children.get(i).source());
            }
            return builder.append(')').toString();
        }
    }

    record Variable(String name) implements AstNode {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String signature() {
            return name;
        }

        @Override
        public String source() {
            return name;
        }
    }

    record StringLiteral(String value) implements AstNode {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        // length prefix keeps signatures unambiguous without escaping
        @Override
        public String signature() {
            return "s" + value.length() + ":" + value;
        }

        @Override
        public String source() {
            return quote(value);
        }

        /** Double quotes unless the value itself holds one. */
        public static String quote(String value) {
            char quote = value.indexOf('"') >= 0 ? '\'' : '"';
            return quote + value + quote;
        }
    }

    /** {@code text} is the literal exactly as written; it is what the output prints. */
    record NumberLiteral(Number value, String text) implements AstNode {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(text, "text");
            if (!(value instanceof Long) && !(value instanceof Double)) {
                throw new IllegalArgumentException("Number literal must be Long or Double: " + value.getClass());
            }
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        @Override
        public String signature() {
            return (isIntegral() ? "i:" : "d:") + text;
        }

        @Override
        public String source() {
            return text;
        }
    }

    record BooleanLiteral(boolean value) implements AstNode {
        @Override
        public String signature() {
            return "b:" + value;
        }

        @Override
        public String source() {
            return Boolean.toString(value);
        }
    }
}
