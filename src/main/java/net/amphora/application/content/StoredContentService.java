package net.amphora.application.content;

import net.amphora.domain.content.KeyListing;
import net.amphora.service.ContentStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Raw JSON access to the content store for pages and URIs, bypassing the
 * component reference resolver.
 */
@Service
public class StoredContentService {

    private final ContentStore contentStore;
    private final ObjectMapper objectMapper;

    public StoredContentService(ContentStore contentStore, ObjectMapper objectMapper) {
        this.contentStore = contentStore;
        this.objectMapper = objectMapper;
    }

    public Mono<JsonNode> read(String key) {
        return contentStore.get(key).map(objectMapper::readTree);
    }

    /**
     * Stores the document and echoes it back.
     */
    public Mono<JsonNode> write(String key, JsonNode document) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(document))
            .flatMap(serialized -> contentStore.put(key, serialized))
            .thenReturn(document);
    }

    /**
     * Lists keys under a prefix, without values.
     */
    public KeyListing listKeys(String prefix) {
        return contentStore.list(prefix, false);
    }
}
