package work.lcod.pointfree.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered steps for one compiled function. The last step defining {@code functionName} is the
 * composite operator.
 */
public record CompiledProgram(String functionName, List<RenderedStep> steps) {
    public CompiledProgram {
        Objects.requireNonNull(functionName, "functionName");
        steps = List.copyOf(steps);
    }

    public RenderedStep resultStep() {
        return steps.stream()
            .filter(RenderedStep::result)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Program has no result step: " + functionName));
    }

    public List<String> lines() {
        return steps.stream().map(RenderedStep::render).collect(Collectors.toList());
    }

    /** Lines prefixed with their two-digit position, as printed by the CLI. */
    public List<String> numberedLines() {
        var lines = new ArrayList<String>();
        for (var step : steps) {
            lines.add(String.format("%02d. %s", step.index(), step.render()));
        }
        return lines;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("function", functionName);
        var serialized = new ArrayList<Map<String, Object>>();
        for (var step : steps) {
            serialized.add(step.toSerializableMap());
        }
        map.put("steps", serialized);
        return map;
    }
}
