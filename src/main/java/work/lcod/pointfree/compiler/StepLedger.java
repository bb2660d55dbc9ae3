package work.lcod.pointfree.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.pointfree.shared.Diagnostics;

/**
 * Records emitted steps in order and owns the memo tables of a single compile. Not thread-safe;
 * {@link #reset()} must run before every compile.
 */
public final class StepLedger {
    private final Diagnostics diagnostics;
    private final List<Step> steps = new ArrayList<>();
    private final Map<Namespace, Map<String, Operand>> memo = new EnumMap<>(Namespace.class);
    private int nextId;

    public StepLedger(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        reset();
    }

    public void reset() {
        steps.clear();
        nextId = 0;
        for (var namespace : Namespace.values()) {
            memo.put(namespace, new HashMap<>());
        }
    }

    public Placeholder newPlaceholder(String baseName) {
        nextId++;
        return new Placeholder(cleanBaseName(baseName), nextId);
    }

    public Placeholder emit(String baseName, Primitive operator, String comment, Operand... inputs) {
        var output = newPlaceholder(baseName);
        var step = new Step(output, operator, Arrays.asList(inputs), comment);
        steps.add(step);
        diagnostics.trace("emit %s := %s%s", output, operator.wireName(), step.inputs());
        return output;
    }

    public Operand recall(Namespace namespace, String key) {
        return memo.get(namespace).get(key);
    }

    public void remember(Namespace namespace, String key, Operand value) {
        memo.get(namespace).put(key, value);
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(steps);
    }

    static String cleanBaseName(String baseName) {
        String cleaned = baseName == null ? "" : baseName.replaceAll("[^A-Za-z0-9_]", "");
        return cleaned.isEmpty() ? "temp" : cleaned;
    }

    /**
     * Independent memo key spaces: the same subtree may be compiled both as an operator and as a
     * value in one program.
     */
    public enum Namespace {
        OPERATOR,
        VALUE,
        CARD
    }
}
