package work.lcod.pointfree.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.pointfree.error.CapabilityException;
import work.lcod.pointfree.error.CompileException;
import work.lcod.pointfree.error.FormatException;

class CompilerLimitsTest {
    private final PointFreeCompiler compiler = new PointFreeCompiler();

    @Test
    void staticArgumentTwoSlotsAwayCannotBeCurried() {
        var ex = assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, in, \"x\")"));
        assertEquals("g", ex.operator());
        assertEquals("static-argument-shift<=1", ex.limit());
        assertEquals(CompileException.Kind.CAPABILITY, ex.kind());
    }

    @Test
    void staticArgumentAfterTwoDynamicCallsCannotBeCurried() {
        assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(h(in), k(in), 1)"));
    }

    @Test
    void threeDynamicArgumentsAreRejected() {
        var ex = assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, h(in), k(in))"));
        assertEquals("dynamic-arguments<=2", ex.limit());
        assertTrue(ex.getMessage().contains("3 input-dependent arguments"));
    }

    @Test
    void fourStaticArgumentsCannotBeApplied() {
        var ex = assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, h(1, 2, 3, 4))"));
        assertEquals("h", ex.operator());
        assertEquals("static-arguments<=3", ex.limit());
    }

    @Test
    void fourStaticArgumentsAreFineWhenCurried() {
        var program = compiler.compile("f(in) := g(1, 2, 3, 4, in)");
        assertEquals(Primitive.APPLY, program.resultStep().operator());
    }

    @Test
    void headerMustDeclareInParameter() {
        var ex = assertThrows(FormatException.class, () -> compiler.compile("f(x) := g(x)"));
        assertEquals("x", ex.snippet());
        assertThrows(FormatException.class, () -> compiler.compile("f() := g(in)"));
    }

    @Test
    void headerShapeIsRequired() {
        assertThrows(FormatException.class, () -> compiler.compile("g(in)"));
        assertThrows(FormatException.class, () -> compiler.compile("f(in) = g(in)"));
        assertThrows(FormatException.class, () -> compiler.compile("f(in) :="));
        assertThrows(FormatException.class, () -> compiler.compile(null));
    }

    @Test
    void malformedBodyIsFormatError() {
        var ex = assertThrows(FormatException.class, () -> compiler.compile("f(in) := g(in"));
        assertEquals(CompileException.Kind.FORMAT, ex.kind());
    }

    @Test
    void nestingDepthIsConfigurable() {
        var shallow = new PointFreeCompiler(CompilerOptions.builder().maxNestingDepth(3).build());
        assertEquals(3, shallow.compile("f(in) := a(b(in))").steps().size());
        var ex = assertThrows(CapabilityException.class, () -> shallow.compile("f(in) := a(b(c(in)))"));
        assertEquals("nesting-depth<=3", ex.limit());
    }

    @Test
    void sameErrorIsReproduced() {
        var first = assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, in, 1)"));
        var second = assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, in, 1)"));
        assertEquals(first.getMessage(), second.getMessage());
    }

    @Test
    void compilerIsReusableAfterFailure() {
        assertThrows(CapabilityException.class, () -> compiler.compile("f(in) := g(in, h(in), k(in))"));
        assertEquals(1, compiler.compile("f(in) := g(in)").steps().size());
    }
}
