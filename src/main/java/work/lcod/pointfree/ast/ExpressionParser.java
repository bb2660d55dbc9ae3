package work.lcod.pointfree.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import work.lcod.pointfree.error.CapabilityException;
import work.lcod.pointfree.error.FormatException;

/**
 * Turns expression text into an {@link AstNode} tree.
 *
 * <p>Shapes are tried in order: quoted string, boolean, float, integer, identifier, call.
 * Anything else is a {@link FormatException}.
 */
public final class ExpressionParser {
    public static final int DEFAULT_MAX_DEPTH = 200;

    private static final Pattern FLOAT = Pattern.compile("\\d+\\.\\d+");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CALL = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\((.*)\\)", Pattern.DOTALL);

    private final int maxDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ExpressionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public AstNode parse(String text) {
        if (text == null) {
            throw new FormatException("Missing expression", "");
        }
        return parse(text, 1);
    }

    private AstNode parse(String raw, int depth) {
        if (depth > maxDepth) {
            throw new CapabilityException(
                "<expression>",
                "nesting-depth<=" + maxDepth,
                "Expression nesting exceeds the configured depth of " + maxDepth
            );
        }
        String code = raw.strip();
        if (code.isEmpty()) {
            throw new FormatException("Empty expression", raw);
        }

        char first = code.charAt(0);
        if (first == '"' || first == '\'') {
            return parseString(code);
        }
        String lower = code.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return new AstNode.BooleanLiteral(Boolean.parseBoolean(lower));
        }
        if (FLOAT.matcher(code).matches()) {
            return new AstNode.NumberLiteral(Double.parseDouble(code), code);
        }
        if (INTEGER.matcher(code).matches()) {
            try {
                return new AstNode.NumberLiteral(Long.parseLong(code), code);
            } catch (NumberFormatException ex) {
                throw new FormatException("Integer literal out of range", code);
            }
        }
        if (IDENTIFIER.matcher(code).matches()) {
            return new AstNode.Variable(code);
        }

        var match = CALL.matcher(code);
        if (!match.matches()) {
            throw new FormatException("Unrecognized expression", code);
        }
        String name = match.group(1);
        String args = match.group(2);
        var children = new ArrayList<AstNode>();
        if (!args.isBlank()) {
            for (String arg : splitArguments(args, code)) {
                children.add(parse(arg, depth + 1));
            }
        }
        return new AstNode.Call(name, children);
    }

    private static AstNode parseString(String code) {
        char quote = code.charAt(0);
        if (code.length() < 2 || code.charAt(code.length() - 1) != quote) {
            throw new FormatException("Unterminated string literal", code);
        }
        String value = code.substring(1, code.length() - 1);
        if (value.indexOf(quote) >= 0) {
            throw new FormatException("String literal may not contain its own quote", code);
        }
        return new AstNode.StringLiteral(value);
    }

    /**
     * Splits on top-level commas. Parentheses and commas inside quoted strings are ignored.
     */
    static List<String> splitArguments(String args, String context) {
        var parts = new ArrayList<String>();
        int balance = 0;
        int start = 0;
        char quote = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(' -> balance++;
                case ')' -> {
                    balance--;
                    if (balance < 0) {
                        throw new FormatException("Unbalanced parentheses", context);
                    }
                }
                case ',' -> {
                    if (balance == 0) {
                        parts.add(args.substring(start, i));
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        if (quote != 0) {
            throw new FormatException("Unterminated string literal", context);
        }
        if (balance != 0) {
            throw new FormatException("Unbalanced parentheses", context);
        }
        parts.add(args.substring(start));
        return parts;
    }
}
