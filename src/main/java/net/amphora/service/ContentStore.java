package net.amphora.service;

import java.util.List;
import net.amphora.domain.content.BatchOperation;
import net.amphora.domain.content.KeyListing;
import reactor.core.publisher.Mono;

/**
 * Key/value storage for components, instances, pages and URIs.
 *
 * <p>Values are JSON documents stored as text. Missing keys fail with
 * {@link net.amphora.exception.ContentNotFoundException}.
 */
public interface ContentStore {

    Mono<String> get(String key);

    Mono<Void> put(String key, String value);

    /**
     * Lists everything stored under a key prefix.
     *
     * @param prefix key prefix, matched literally
     * @param values whether entries carry their stored values
     * @return a buffered collection or a live stream; never {@code null}
     */
    KeyListing list(String prefix, boolean values);

    /**
     * Applies every operation atomically: readers see all of the keys or none.
     */
    Mono<Void> batch(List<BatchOperation> operations);
}
