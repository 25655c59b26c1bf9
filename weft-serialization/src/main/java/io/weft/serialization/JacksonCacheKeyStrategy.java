package io.weft.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.weft.core.execution.cache.CacheKeyStrategy;
import java.util.Map;
import java.util.Objects;

/// Cache keys of the form `toolName:json(input)` with map entries and bean
/// properties sorted, so equal inputs built in a different order share a key.
///
/// Unlike {@link io.weft.core.execution.cache.CanonicalCacheKeyStrategy}, values are
/// rendered the way Jackson would serialize them, so beans and records in the input
/// contribute their properties instead of their `toString()`.
///
/// @implNote Thread-safe. The mapper is configured once and never mutated.
public final class JacksonCacheKeyStrategy implements CacheKeyStrategy {

    private final ObjectMapper mapper =
            JsonMapper.builder()
                    .addModule(new JavaTimeModule())
                    .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                    .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                    .build();

    /// @throws IllegalArgumentException if the input cannot be serialized
    @Override
    public String key(String toolName, Map<String, Object> input) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        try {
            return toolName + ":" + mapper.writeValueAsString(input != null ? input : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot derive cache key for " + toolName + ": " + e.getOriginalMessage(), e);
        }
    }
}
