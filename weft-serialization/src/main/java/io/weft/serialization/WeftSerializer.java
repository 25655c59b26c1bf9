package io.weft.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.weft.core.execution.ExecutionResult;
import io.weft.core.performance.PerformanceExport;
import io.weft.core.plan.ExecutionPlan;

/// Utility class for reading tool catalogs and writing plans, results and
/// performance exports as JSON.
///
/// ### Usage
/// {@snippet :
/// ToolCatalog catalog = WeftSerializer.readCatalog(Files.readString(path));
/// catalog.tools().forEach(coordinator::registerTool);
///
/// ExecutionPlan plan = coordinator.createPlan(
///         catalog.name(), catalog.description(), catalog.requests(), catalog.constraints());
/// String json = WeftSerializer.planToJson(plan);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see WeftJacksonModule for the registered type handlers
public final class WeftSerializer {

    private WeftSerializer() {}

    /// Serializes any Weft value to pretty-printed JSON.
    ///
    /// @param value the value, may be null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    /// Reads a tool catalog.
    ///
    /// @param json JSON string, not null
    /// @return the catalog, never null
    /// @throws IllegalArgumentException if the JSON is malformed or a tool fails validation
    public static ToolCatalog readCatalog(String json) {
        return read(json, ToolCatalog.class, "catalog");
    }

    public static String planToJson(ExecutionPlan plan) {
        return toJson(plan);
    }

    /// Reads a plan previously written by {@link #planToJson(ExecutionPlan)}.
    ///
    /// @param json JSON string, not null
    /// @return the plan, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static ExecutionPlan readPlan(String json) {
        return read(json, ExecutionPlan.class, "plan");
    }

    public static String resultToJson(ExecutionResult result) {
        return toJson(result);
    }

    public static String exportToJson(PerformanceExport export) {
        return toJson(export);
    }

    /// Creates an ObjectMapper configured for Weft serialization.
    ///
    /// Registers:
    /// - `WeftJacksonModule` for builder-based tools and defaulted constraints
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps and durations written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new WeftJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
