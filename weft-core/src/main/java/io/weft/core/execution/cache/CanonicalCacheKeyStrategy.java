package io.weft.core.execution.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Builds keys of the form `toolName:canonical(input)`.
///
/// The canonical form renders maps with their entries sorted by key, recursively,
/// and renders lists, arrays and scalars in order, so the key does not depend on
/// map insertion order. Strings are quoted to keep `1` and `"1"` apart.
public final class CanonicalCacheKeyStrategy implements CacheKeyStrategy {

    @Override
    public String key(String toolName, Map<String, Object> input) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        StringBuilder key = new StringBuilder(toolName).append(':');
        render(input != null ? input : Map.of(), key);
        return key.toString();
    }

    private static void render(Object value, StringBuilder out) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            out.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                quote(entry.getKey(), out);
                out.append(':');
                render(entry.getValue(), out);
            }
            out.append('}');
        } else if (value instanceof Collection<?> collection) {
            renderSequence(collection.toArray(), out);
        } else if (value instanceof Object[] array) {
            renderSequence(array, out);
        } else if (value instanceof CharSequence
                || value instanceof Character
                || value instanceof Enum<?>) {
            quote(value.toString(), out);
        } else {
            out.append(value);
        }
    }

    private static void renderSequence(Object[] values, StringBuilder out) {
        out.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            render(values[i], out);
        }
        out.append(']');
    }

    private static void quote(String text, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append('"');
    }
}
