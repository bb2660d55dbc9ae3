package work.lcod.pointfree.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pointfree.compiler.CompilerOptions;

class PointFreeRunnerTest {
    private final PointFreeRunner runner = new PointFreeRunner();

    @Test
    void compilesInlineProgram() {
        var result = runner.run(CompileConfiguration.builder().source("f(in) := pair(in, \"x\")").build());
        assertEquals(CompileResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertEquals("f", result.metadata().get("function"));
        assertEquals(4, result.metadata().get("stepCount"));
        assertEquals(5, result.metadata().get("emittedSteps"));
        assertEquals(CompileConfiguration.INLINE_SOURCE, result.metadata().get("source"));
        assertTrue(result.program().isPresent());
    }

    @Test
    void capabilityFailureIsReportedNotThrown() {
        var result = runner.run(CompileConfiguration.builder()
            .source("f(in) := g(in, h(in), k(in))")
            .sourceName("three.pf")
            .build());
        assertEquals(CompileResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("CAPABILITY", result.metadata().get("errorKind"));
        assertEquals("g", result.metadata().get("snippet"));
        assertEquals("dynamic-arguments<=2", result.metadata().get("limit"));
        assertEquals("three.pf", result.metadata().get("source"));
        assertFalse(result.program().isPresent());
        assertTrue(result.toTextLines().get(0).startsWith("error: Function 'g' has 3"));
    }

    @Test
    void formatFailureCarriesSnippet() {
        var result = runner.run(CompileConfiguration.builder().source("f(x) := g(x)").build());
        assertEquals("FORMAT", result.metadata().get("errorKind"));
        assertEquals("x", result.metadata().get("snippet"));
    }

    @Test
    void honoursCompilerOptions() {
        var result = runner.run(CompileConfiguration.builder()
            .source("f(in) := g(in)")
            .options(CompilerOptions.builder().emitComments(false).build())
            .build());
        assertEquals("01. f := op_by_name(\"g\")", result.render(OutputFormat.TEXT));
    }

    @Test
    void serializesToJsonAndYaml() {
        var result = runner.run(CompileConfiguration.builder().source("f(in) := g(in)").build());
        var map = result.toSerializableMap();
        assertEquals("success", map.get("status"));
        @SuppressWarnings("unchecked")
        var program = (Map<String, Object>) map.get("program");
        assertEquals("f", program.get("function"));

        String json = result.render(OutputFormat.JSON);
        assertTrue(json.contains("\"op_by_name\""), json);
        assertTrue(json.contains("\"final composite operator\""), json);

        String yaml = result.render(OutputFormat.YAML);
        assertTrue(yaml.contains("op_by_name"), yaml);
        assertTrue(yaml.contains("status:"), yaml);
    }

    @Test
    void failedResultOmitsProgramInJson() {
        var result = runner.run(CompileConfiguration.builder().source("nonsense").build());
        assertFalse(result.toSerializableMap().containsKey("program"));
        assertTrue(result.toPrettyJson().contains("\"failure\""));
    }

    @Test
    void parsesEnumsLeniently() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.FATAL, LogLevel.from(null));
        assertEquals(OutputFormat.YAML, OutputFormat.from("Yaml"));
        assertEquals(OutputFormat.TEXT, OutputFormat.from(""));
    }
}
