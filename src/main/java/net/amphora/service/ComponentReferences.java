package net.amphora.service;

import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Resolves component references to their data and schemas.
 */
public interface ComponentReferences {

    /**
     * @param key component or instance key, e.g. {@code /components/article/instances/abc}
     * @return the stored data, or the component defaults for a bare component key
     */
    Mono<JsonNode> getComponentData(String key);

    Mono<JsonNode> putComponentData(String key, JsonNode data);

    /**
     * @param key schema key, e.g. {@code /components/article/schema}
     */
    Mono<JsonNode> getSchema(String key);

    /**
     * Extracts the component name from any reference that points into a component.
     *
     * @param reference component, instance or schema reference
     * @return the component name, or {@code null} when the value is not a component reference
     */
    String getComponentName(String reference);
}
