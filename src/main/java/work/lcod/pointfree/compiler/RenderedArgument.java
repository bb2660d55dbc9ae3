package work.lcod.pointfree.compiler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of a {@link RenderedStep}.
 */
public sealed interface RenderedArgument {
    String text();

    Map<String, Object> toSerializableMap();

    /** Back-reference to an earlier step by its 1-based position. */
    record Reference(int stepIndex, String name) implements RenderedArgument {
        @Override
        public String text() {
            return name;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("ref", stepIndex);
            map.put("name", name);
            return map;
        }
    }

    record Literal(String text) implements RenderedArgument {
        @Override
        public Map<String, Object> toSerializableMap() {
            return Map.of("literal", text);
        }
    }
}
