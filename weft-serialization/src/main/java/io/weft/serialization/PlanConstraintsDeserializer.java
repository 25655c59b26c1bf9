package io.weft.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.weft.core.plan.PlanConstraints;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/// Deserializes `PlanConstraints`, filling absent fields from
/// {@link PlanConstraints#defaults()}.
///
/// `maxDuration` accepts an ISO-8601 duration (`"PT30S"`) or a number of
/// milliseconds. `null` or absent limits stay unset.
class PlanConstraintsDeserializer extends StdDeserializer<PlanConstraints> {

    @Serial private static final long serialVersionUID = -2741096386319725710L;

    PlanConstraintsDeserializer() {
        super(PlanConstraints.class);
    }

    @Override
    public PlanConstraints deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        JsonNode root = p.readValueAsTree();
        PlanConstraints defaults = PlanConstraints.defaults();

        Duration maxDuration = readDuration(root.get("maxDuration"));
        JsonNode maxCost = root.get("maxCost");
        JsonNode reliability = root.get("requiredReliability");
        JsonNode retries = root.get("defaultRetries");

        try {
            return new PlanConstraints(
                    maxDuration,
                    present(maxCost) ? maxCost.asDouble() : null,
                    present(reliability)
                            ? reliability.asDouble()
                            : defaults.requiredReliability(),
                    present(retries) ? retries.asInt() : defaults.defaultRetries());
        } catch (IllegalArgumentException e) {
            throw ctx.weirdStringException(root.toString(), PlanConstraints.class, e.getMessage());
        }
    }

    private static Duration readDuration(JsonNode node) throws IOException {
        if (!present(node)) {
            return null;
        }
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        try {
            return Duration.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid maxDuration: " + node.asText(), e);
        }
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }
}
