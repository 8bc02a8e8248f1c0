package net.amphora.domain.content;

import tools.jackson.databind.JsonNode;

/**
 * Listing entry returned when a prefix listing asks for values.
 *
 * @param key stored resource key
 * @param value stored JSON document
 */
public record KeyValueEntry(String key, JsonNode value) {
}
