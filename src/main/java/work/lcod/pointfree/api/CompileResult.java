package work.lcod.pointfree.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pointfree.compiler.CompiledProgram;

/**
 * Outcome of a {@link PointFreeRunner} compile (usable by the CLI and embedding apps).
 */
public record CompileResult(
    Status status,
    Optional<CompiledProgram> program,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(new YAMLFactory()).writer();

    public CompileResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(program, "program");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CompileResult success(CompiledProgram program, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("function", program.functionName());
        meta.put("stepCount", program.steps().size());
        return new CompileResult(Status.SUCCESS, Optional.of(program), meta, startedAt, Instant.now());
    }

    public static CompileResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new CompileResult(Status.FAILURE, Optional.empty(), meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        program.ifPresent(compiled -> serializable.put("program", compiled.toSerializableMap()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return JSON_WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public String toYaml() {
        try {
            return YAML_WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "status: error\nmessage: \"" + ex.getOriginalMessage() + "\"\n";
        }
    }

    /** Numbered step lines on success, a single {@code error:} line otherwise. */
    public List<String> toTextLines() {
        if (program.isPresent()) {
            return program.get().numberedLines();
        }
        var lines = new ArrayList<String>();
        lines.add("error: " + metadata.get("error"));
        return lines;
    }

    public String render(OutputFormat format) {
        return switch (format) {
            case TEXT -> String.join(System.lineSeparator(), toTextLines());
            case JSON -> toPrettyJson();
            case YAML -> toYaml();
        };
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
