package net.amphora.adapters.references;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.amphora.exception.ContentNotFoundException;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ContentStore;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Component references backed by the content store, with schemas read from
 * {@code classpath:components/{name}/schema.json}.
 */
@Slf4j
public class StoreComponentReferences implements ComponentReferences {

    private static final Pattern COMPONENT_NAME = Pattern.compile("/components/([^/.@?]+)");
    private static final String SCHEMA_LOCATION = "classpath:components/%s/schema.json";

    private final ContentStore contentStore;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public StoreComponentReferences(ContentStore contentStore, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.contentStore = contentStore;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public Mono<JsonNode> getComponentData(String key) {
        return contentStore.get(key).map(objectMapper::readTree);
    }

    @Override
    public Mono<JsonNode> putComponentData(String key, JsonNode data) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(data))
            .flatMap(serialized -> contentStore.put(key, serialized))
            .thenReturn(data);
    }

    @Override
    public Mono<JsonNode> getSchema(String key) {
        String name = getComponentName(key);
        if (name == null) {
            return Mono.error(new ContentNotFoundException(key, "Not a component reference: " + key));
        }
        return Mono.fromCallable(() -> readSchema(key, name))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String getComponentName(String reference) {
        if (reference == null) {
            return null;
        }
        Matcher matcher = COMPONENT_NAME.matcher(reference);
        return matcher.find() ? matcher.group(1) : null;
    }

    private JsonNode readSchema(String key, String name) throws IOException {
        Resource resource = resourceLoader.getResource(String.format(SCHEMA_LOCATION, name));
        if (!resource.exists()) {
            throw new ContentNotFoundException(key, "Schema not found for component " + name);
        }
        try (InputStream in = resource.getInputStream()) {
            log.debug("Loaded schema for component {}", name);
            return objectMapper.readTree(in);
        }
    }
}
