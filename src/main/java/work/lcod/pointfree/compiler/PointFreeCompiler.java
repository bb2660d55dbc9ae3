package work.lcod.pointfree.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import work.lcod.pointfree.ast.AstNode;
import work.lcod.pointfree.ast.ExpressionParser;
import work.lcod.pointfree.ast.InputDependence;
import work.lcod.pointfree.error.CapabilityException;
import work.lcod.pointfree.error.FormatException;
import work.lcod.pointfree.error.InternalInvariantException;
import work.lcod.pointfree.shared.Diagnostics;

/**
 * Compiles {@code name(in) := expression} into a linear sequence of operator card steps.
 *
 * <p>Input-dependent subtrees are compiled to operators: static arguments are curried into the
 * callee's card (with at most one {@code flip} per argument) and dynamic arguments are wired in
 * through {@code pipe}/{@code pipe2}. Input-independent subtrees are compiled to values through
 * literal materialization and {@code apply*} steps. Both passes memoize by structural signature.
 *
 * <p>An instance may be reused for consecutive programs but must not be shared between threads.
 */
public final class PointFreeCompiler {
    public static final int MAX_DYNAMIC_ARGUMENTS = 2;
    public static final String FINAL_COMMENT = "final composite operator";

    private static final Pattern PROGRAM = Pattern.compile(
        "\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\(([^()]*)\\)\\s*:=(.*)",
        Pattern.DOTALL
    );

    private final CompilerOptions options;
    private final Diagnostics diagnostics;
    private final StepLedger ledger;
    private String functionName;

    public PointFreeCompiler() {
        this(CompilerOptions.defaults(), Diagnostics.silent());
    }

    public PointFreeCompiler(CompilerOptions options) {
        this(options, Diagnostics.silent());
    }

    public PointFreeCompiler(CompilerOptions options, Diagnostics diagnostics) {
        this.options = Objects.requireNonNull(options, "options");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.ledger = new StepLedger(diagnostics);
    }

    public CompilerOptions options() {
        return options;
    }

    public CompiledProgram compile(String text) {
        ledger.reset();
        functionName = null;
        if (text == null) {
            throw new FormatException("Program must have the form 'name(in) := expression'", "");
        }
        var header = PROGRAM.matcher(text);
        if (!header.matches()) {
            throw new FormatException("Program must have the form 'name(in) := expression'", text.strip());
        }
        functionName = header.group(1);
        String parameter = header.group(2).strip();
        if (!InputDependence.INPUT.equals(parameter)) {
            throw new FormatException("Parameter must be named '" + InputDependence.INPUT + "'", parameter);
        }

        AstNode body = new ExpressionParser(options.maxNestingDepth()).parse(header.group(3));
        Placeholder result = InputDependence.dependsOnInput(body)
            ? compileOperator(body)
            : constantOperator(body);

        var program = new StepRenderer(options.emitComments()).render(functionName, ledger.steps(), result);
        diagnostics.debug(
            "compiled %s: %d steps emitted, %d kept",
            functionName,
            ledger.steps().size(),
            program.steps().size()
        );
        return program;
    }

    /** Steps emitted by the last compile, before dead-code elimination. */
    public List<Step> emittedSteps() {
        return ledger.steps();
    }

    private Placeholder compileOperator(AstNode node) {
        String key = node.signature();
        if (ledger.recall(StepLedger.Namespace.OPERATOR, key) instanceof Placeholder cached) {
            return cached;
        }

        Placeholder result;
        if (InputDependence.isInput(node)) {
            result = card(options.identityCard());
        } else if (node instanceof AstNode.Call call && InputDependence.dependsOnInput(call)) {
            result = compileCall(call);
        } else {
            throw new InternalInvariantException("Operator compilation reached a static node", node.source());
        }

        ledger.remember(StepLedger.Namespace.OPERATOR, key, result);
        return result;
    }

    private Placeholder compileCall(AstNode.Call call) {
        var children = call.children();
        var staticIndexes = new ArrayList<Integer>();
        var dynamicIndexes = new ArrayList<Integer>();
        for (int i = 0; i < children.size(); i++) {
            if (InputDependence.dependsOnInput(children.get(i))) {
                dynamicIndexes.add(i);
            } else {
                staticIndexes.add(i);
            }
        }

        Placeholder curried = card(call.name());
        List<Integer> pending = IntStream.range(0, children.size()).boxed().collect(Collectors.toList());
        for (int index : staticIndexes) {
            AstNode argument = children.get(index);
            Operand value = compileValue(argument);
            int position = pending.indexOf(index);
            if (position > 1) {
                throw new CapabilityException(
                    call.name(),
                    "static-argument-shift<=1",
                    "Cannot curry '" + call.name() + "': static argument " + index
                        + " would have to move " + position + " slots (flip moves one)"
                );
            }
            Placeholder target = curried;
            if (position == 1) {
                target = ledger.emit("flipped", Primitive.FLIP, null, curried);
            }
            String comment = "curry '" + call.name() + "': bind argument " + index + " = " + argument.source();
            curried = ledger.emit("curried", Primitive.APPLY, comment, target, value);
            pending.remove(position);
        }

        if (dynamicIndexes.size() == 1) {
            Placeholder inner = compileOperator(children.get(dynamicIndexes.get(0)));
            if (inner == ledger.recall(StepLedger.Namespace.CARD, options.identityCard())) {
                return curried;
            }
            return ledger.emit("piped", Primitive.PIPE, null, inner, curried);
        }
        if (dynamicIndexes.size() == MAX_DYNAMIC_ARGUMENTS) {
            // dynamicIndexes is ascending, so the pipe2 inputs follow the original argument order
            Placeholder first = compileOperator(children.get(dynamicIndexes.get(0)));
            Placeholder second = compileOperator(children.get(dynamicIndexes.get(1)));
            return ledger.emit("pipe2", Primitive.PIPE2, null, first, second, curried);
        }
        throw new CapabilityException(
            call.name(),
            "dynamic-arguments<=" + MAX_DYNAMIC_ARGUMENTS,
            "Function '" + call.name() + "' has " + dynamicIndexes.size()
                + " input-dependent arguments; pipe2 supports at most " + MAX_DYNAMIC_ARGUMENTS
        );
    }

    private Operand compileValue(AstNode node) {
        String key = node.signature();
        var cached = ledger.recall(StepLedger.Namespace.VALUE, key);
        if (cached != null) {
            return cached;
        }
        if (InputDependence.dependsOnInput(node)) {
            throw new InternalInvariantException("Value compilation reached an input-dependent node", node.source());
        }

        Operand result;
        if (node instanceof AstNode.Variable variable) {
            if (variable.name().equals(functionName)) {
                throw new FormatException("Free variable may not reuse the function name", variable.name());
            }
            result = new Operand.Literal(variable.name());
        } else if (node instanceof AstNode.StringLiteral string) {
            result = ledger.emit("str_lit", Primitive.STRING, "static string card", literal(string.source()));
        } else if (node instanceof AstNode.NumberLiteral number && number.isIntegral()) {
            result = ledger.emit("int_lit", Primitive.INTEGER, "static integer card", literal(number.text()));
        } else if (node instanceof AstNode.NumberLiteral number) {
            result = ledger.emit("float_lit", Primitive.DOUBLE, "static float card", literal(number.text()));
        } else if (node instanceof AstNode.BooleanLiteral bool) {
            result = ledger.emit("bool_lit", Primitive.BOOLEAN, "static boolean card", literal(bool.source()));
        } else if (node instanceof AstNode.Call call) {
            result = applyStatic(call);
        } else {
            throw new InternalInvariantException("Unknown node type", node.getClass().getName());
        }

        ledger.remember(StepLedger.Namespace.VALUE, key, result);
        return result;
    }

    private Placeholder applyStatic(AstNode.Call call) {
        var inputs = new ArrayList<Operand>();
        for (var child : call.children()) {
            inputs.add(compileValue(child));
        }
        Placeholder opCard = card(call.name());
        if (inputs.size() > Primitive.MAX_APPLY_ARITY) {
            throw new CapabilityException(
                call.name(),
                "static-arguments<=" + Primitive.MAX_APPLY_ARITY,
                "Function '" + call.name() + "' is applied to " + inputs.size()
                    + " static arguments; apply supports at most " + Primitive.MAX_APPLY_ARITY
            );
        }
        inputs.add(0, opCard);
        return ledger.emit(call.name() + "_val", Primitive.applyFor(call.children().size()), null, inputs.toArray(Operand[]::new));
    }

    private Placeholder constantOperator(AstNode node) {
        Operand value = compileValue(node);
        Placeholder constant = card(options.constantCard());
        return ledger.emit(
            "op_const",
            Primitive.APPLY,
            "operator always returning " + node.source(),
            constant,
            value
        );
    }

    private Placeholder card(String name) {
        if (ledger.recall(StepLedger.Namespace.CARD, name) instanceof Placeholder cached) {
            return cached;
        }
        Placeholder card = ledger.emit("op_" + name, Primitive.OP_BY_NAME, null, literal(AstNode.StringLiteral.quote(name)));
        ledger.remember(StepLedger.Namespace.CARD, name, card);
        return card;
    }

    private static Operand.Literal literal(String text) {
        return new Operand.Literal(text);
    }
}
