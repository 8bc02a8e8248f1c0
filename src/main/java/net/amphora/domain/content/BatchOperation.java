package net.amphora.domain.content;

import java.util.Objects;
import tools.jackson.databind.JsonNode;

/**
 * One staged write inside an atomic multi-key batch.
 *
 * @param type operation kind
 * @param key resource key written by the operation
 * @param value JSON document stored under the key
 */
public record BatchOperation(Type type, String key, JsonNode value) {

    public BatchOperation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static BatchOperation put(String key, JsonNode value) {
        return new BatchOperation(Type.PUT, key, value);
    }

    public enum Type {
        PUT
    }
}
