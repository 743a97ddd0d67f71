package com.flagship.settlement.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * A verified payment provider event.
 *
 * Only the envelope is typed; {@code object} is the provider's
 * {@code data.object} and handlers read the fields they need from it.
 */
@Value
public class ProviderEvent {
    String id;
    String type;
    Instant created;
    JsonNode object;

    /**
     * Parses the provider envelope.
     *
     * @throws IllegalArgumentException if the id, type or data object is missing
     */
    public static ProviderEvent fromJson(JsonNode root) {
        String id = text(root, "id");
        String type = text(root, "type");
        JsonNode data = root.path("data").path("object");
        if (id == null || type == null || !data.isObject()) {
            throw new IllegalArgumentException("Event envelope is missing id, type or data.object");
        }
        JsonNode created = root.get("created");
        return new ProviderEvent(
            id,
            type,
            created != null && created.canConvertToLong() ? Instant.ofEpochSecond(created.asLong()) : Instant.now(),
            data
        );
    }

    public String getObjectId() {
        return text(object, "id");
    }

    /**
     * String field of the data object, or null when absent.
     */
    public String field(String name) {
        return text(object, name);
    }

    public String metadata(String key) {
        return text(object.path("metadata"), key);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
