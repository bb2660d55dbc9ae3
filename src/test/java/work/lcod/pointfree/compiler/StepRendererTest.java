package work.lcod.pointfree.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pointfree.shared.Diagnostics;

class StepRendererTest {
    private final StepLedger ledger = new StepLedger(Diagnostics.silent());

    @Test
    void dropsStepsTheResultDoesNotReach() {
        var used = ledger.emit("op_g", Primitive.OP_BY_NAME, null, new Operand.Literal("\"g\""));
        ledger.emit("op_unused", Primitive.OP_BY_NAME, null, new Operand.Literal("\"unused\""));
        var value = ledger.emit("int_lit", Primitive.INTEGER, null, new Operand.Literal("7"));
        var result = ledger.emit("curried", Primitive.APPLY, null, used, value);
        ledger.emit("piped", Primitive.PIPE, null, result, used);

        var live = StepRenderer.liveSteps(ledger.steps(), result);
        assertEquals(3, live.size());
        assertEquals(List.of(used, value, result), live.stream().map(Step::output).toList());
    }

    @Test
    void numbersNamesPerBaseNameInEmissionOrder() {
        var g = ledger.emit("op_g", Primitive.OP_BY_NAME, null, new Operand.Literal("\"g\""));
        var one = ledger.emit("int_lit", Primitive.INTEGER, null, new Operand.Literal("1"));
        var first = ledger.emit("curried", Primitive.APPLY, "first", g, one);
        var two = ledger.emit("int_lit", Primitive.INTEGER, null, new Operand.Literal("2"));
        var second = ledger.emit("curried", Primitive.APPLY, null, first, two);
        var result = ledger.emit("curried", Primitive.APPLY, null, second, one);

        var program = new StepRenderer(true).render("main", ledger.steps(), result);
        assertEquals(List.of(
            "op_g_1 := op_by_name(\"g\")",
            "int_lit_1 := Integer(1)",
            "curried_1 := apply(op_g_1, int_lit_1)  # first",
            "int_lit_2 := Integer(2)",
            "curried_2 := apply(curried_1, int_lit_2)",
            "main := apply(curried_2, int_lit_1)  # final composite operator"
        ), program.lines());
        assertEquals(new RenderedArgument.Reference(2, "int_lit_1"), program.resultStep().arguments().get(1));
    }

    @Test
    void commentsCanBeSuppressed() {
        var g = ledger.emit("op_g", Primitive.OP_BY_NAME, "lookup", new Operand.Literal("\"g\""));
        var step = new StepRenderer(false).render("f", ledger.steps(), g).resultStep();
        assertNull(step.comment());
        assertTrue(step.result());
    }

    @Test
    void placeholdersWithSameNameStayDistinct() {
        var a = ledger.newPlaceholder("temp");
        var b = ledger.newPlaceholder("temp");
        assertNotSame(a, b);
        assertTrue(!a.equals(b));
        assertEquals("<temp#1>", a.toString());
    }

    @Test
    void baseNamesAreCleaned() {
        assertEquals("op_mod", StepLedger.cleanBaseName("op_m.o-d"));
        assertEquals("temp", StepLedger.cleanBaseName("..."));
    }

    @Test
    void resetClearsStepsCountersAndMemos() {
        ledger.emit("op_g", Primitive.OP_BY_NAME, null, new Operand.Literal("\"g\""));
        ledger.remember(StepLedger.Namespace.CARD, "g", ledger.steps().get(0).output());
        ledger.reset();
        assertTrue(ledger.steps().isEmpty());
        assertNull(ledger.recall(StepLedger.Namespace.CARD, "g"));
        assertEquals(1, ledger.newPlaceholder("x").id());
    }

    @Test
    void memoNamespacesAreIndependent() {
        var operand = new Operand.Literal("x");
        ledger.remember(StepLedger.Namespace.VALUE, "g(in)", operand);
        assertNull(ledger.recall(StepLedger.Namespace.OPERATOR, "g(in)"));
        assertEquals(operand, ledger.recall(StepLedger.Namespace.VALUE, "g(in)"));
    }

    @Test
    void unknownResultIsRejected() {
        var stray = ledger.newPlaceholder("stray");
        assertThrows(IllegalStateException.class, () -> new StepRenderer(true).render("f", ledger.steps(), stray));
    }

    @Test
    void serializesStructuredSteps() {
        var g = ledger.emit("op_g", Primitive.OP_BY_NAME, null, new Operand.Literal("\"g\""));
        var map = new StepRenderer(false).render("f", ledger.steps(), g).toSerializableMap();
        assertEquals("f", map.get("function"));
        @SuppressWarnings("unchecked")
        var steps = (List<Map<String, Object>>) map.get("steps");
        assertEquals("op_by_name", steps.get(0).get("operator"));
        assertEquals(List.of(Map.of("literal", "\"g\"")), steps.get(0).get("inputs"));
        assertEquals(true, steps.get(0).get("result"));
    }
}
