package work.lcod.pointfree.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops steps the result does not depend on, then names and renders the survivors.
 *
 * <p>Survivors are named {@code base_1}, {@code base_2}, ... per base name in emission order. The
 * result step takes the function name instead, but still uses up its counter slot. A counter value
 * whose name is already taken, by the function name or by a free variable, is skipped.
 */
public final class StepRenderer {
    private final boolean emitComments;

    public StepRenderer(boolean emitComments) {
        this.emitComments = emitComments;
    }

    public CompiledProgram render(String functionName, List<Step> steps, Placeholder result) {
        var live = liveSteps(steps, result);
        if (live.isEmpty()) {
            throw new IllegalStateException("Result " + result + " is not produced by any step");
        }

        Set<String> taken = takenNames(functionName, live);
        Map<String, Integer> counters = new HashMap<>();
        Map<Placeholder, RenderedArgument.Reference> references = new IdentityHashMap<>();
        var rendered = new ArrayList<RenderedStep>();
        for (var step : live) {
            int index = rendered.size() + 1;
            var output = step.output();
            boolean isResult = output == result;
            String name;
            if (isResult) {
                counters.merge(output.baseName(), 1, Integer::sum);
                name = functionName;
            } else {
                name = nextName(output.baseName(), counters, taken);
            }

            var arguments = new ArrayList<RenderedArgument>();
            for (var input : step.inputs()) {
                if (input instanceof Placeholder placeholder) {
                    var reference = references.get(placeholder);
                    if (reference == null) {
                        throw new IllegalStateException("Step " + output + " reads " + placeholder + " before it is defined");
                    }
                    arguments.add(reference);
                } else if (input instanceof Operand.Literal literal) {
                    arguments.add(new RenderedArgument.Literal(literal.text()));
                }
            }

            references.put(output, new RenderedArgument.Reference(index, name));
            rendered.add(new RenderedStep(index, name, step.operator(), arguments, comment(step, isResult), isResult));
        }
        return new CompiledProgram(functionName, rendered);
    }

    private static Set<String> takenNames(String functionName, List<Step> live) {
        Set<String> taken = new HashSet<>();
        taken.add(functionName);
        for (var step : live) {
            for (var input : step.inputs()) {
                if (input instanceof Operand.Literal literal) {
                    taken.add(literal.text());
                }
            }
        }
        return taken;
    }

    private static String nextName(String baseName, Map<String, Integer> counters, Set<String> taken) {
        String name;
        do {
            name = baseName + "_" + counters.merge(baseName, 1, Integer::sum);
        } while (taken.contains(name));
        return name;
    }

    /**
     * Walks backwards from the result, keeping a step when its output is the result or feeds an
     * already kept step.
     */
    static List<Step> liveSteps(List<Step> steps, Placeholder result) {
        Set<Placeholder> used = new HashSet<>();
        used.add(result);
        for (int i = steps.size() - 1; i >= 0; i--) {
            var step = steps.get(i);
            if (!used.contains(step.output())) {
                continue;
            }
            for (var input : step.inputs()) {
                if (input instanceof Placeholder placeholder) {
                    used.add(placeholder);
                }
            }
        }
        var live = new ArrayList<Step>();
        for (var step : steps) {
            if (used.contains(step.output())) {
                live.add(step);
            }
        }
        return live;
    }

    private String comment(Step step, boolean isResult) {
        if (!emitComments) {
            return null;
        }
        if (!isResult) {
            return step.comment();
        }
        return step.hasComment() ? step.comment() + "; " + PointFreeCompiler.FINAL_COMMENT : PointFreeCompiler.FINAL_COMMENT;
    }
}
