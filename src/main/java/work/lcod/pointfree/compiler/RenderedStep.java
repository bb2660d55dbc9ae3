package work.lcod.pointfree.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Final, named form of a surviving step: {@code name := operator(args)  # comment}.
 */
public record RenderedStep(
    int index,
    String name,
    Primitive operator,
    List<RenderedArgument> arguments,
    String comment,
    boolean result
) {
    public RenderedStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operator, "operator");
        arguments = List.copyOf(arguments);
    }

    public String render() {
        String args = arguments.stream().map(RenderedArgument::text).collect(Collectors.joining(", "));
        String line = name + " := " + operator.wireName() + "(" + args + ")";
        if (comment != null && !comment.isBlank()) {
            line += "  # " + comment;
        }
        return line;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("index", index);
        map.put("name", name);
        map.put("operator", operator.wireName());
        var inputs = new ArrayList<Map<String, Object>>();
        for (var argument : arguments) {
            inputs.add(argument.toSerializableMap());
        }
        map.put("inputs", inputs);
        if (comment != null && !comment.isBlank()) {
            map.put("comment", comment);
        }
        if (result) {
            map.put("result", true);
        }
        return map;
    }

    @Override
    public String toString() {
        return render();
    }
}
