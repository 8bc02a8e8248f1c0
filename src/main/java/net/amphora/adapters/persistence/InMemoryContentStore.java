package net.amphora.adapters.persistence;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import net.amphora.domain.content.BatchOperation;
import net.amphora.domain.content.KeyListing;
import net.amphora.domain.content.KeyValueEntry;
import net.amphora.exception.ContentNotFoundException;
import net.amphora.service.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;
import tools.jackson.databind.ObjectMapper;

/**
 * Process-local content store backed by a sorted map.
 *
 * <p>Batches are applied under a write lock so readers observe all of a batch or
 * none of it. When {@code streamListings} is on, listings are handed out as a
 * JSON byte stream instead of a buffered collection.
 */
public class InMemoryContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContentStore.class);

    private final NavigableMap<String, String> entries = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper objectMapper;
    private final boolean streamListings;

    public InMemoryContentStore(ObjectMapper objectMapper, boolean streamListings) {
        this.objectMapper = objectMapper;
        this.streamListings = streamListings;
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> {
            String value = read(key);
            if (value == null) {
                throw new ContentNotFoundException(key);
            }
            return value;
        });
    }

    @Override
    public Mono<Void> put(String key, String value) {
        return Mono.fromRunnable(() -> {
            lock.writeLock().lock();
            try {
                entries.put(key, value);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public KeyListing list(String prefix, boolean values) {
        if (streamListings) {
            byte[] body = objectMapper.writeValueAsBytes(snapshot(prefix, values));
            return KeyListing.streamed(new ByteArrayInputStream(body), MediaType.APPLICATION_JSON);
        }
        return KeyListing.buffered(Mono.fromCallable(() -> snapshot(prefix, values)));
    }

    @Override
    public Mono<Void> batch(List<BatchOperation> operations) {
        return Mono.fromCallable(() -> {
                Map<String, String> staged = new LinkedHashMap<>();
                for (BatchOperation operation : operations) {
                    if (operation.type() != BatchOperation.Type.PUT) {
                        throw new IllegalArgumentException("Unsupported batch operation " + operation.type());
                    }
                    staged.put(operation.key(), objectMapper.writeValueAsString(operation.value()));
                }
                return staged;
            })
            .doOnNext(staged -> {
                lock.writeLock().lock();
                try {
                    entries.putAll(staged);
                } finally {
                    lock.writeLock().unlock();
                }
                log.debug("Committed batch of {} key(s)", staged.size());
            })
            .then();
    }

    private String read(String key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Object> snapshot(String prefix, boolean values) {
        lock.readLock().lock();
        try {
            List<Object> listed = new ArrayList<>();
            for (Map.Entry<String, String> entry : entries.tailMap(prefix, true).entrySet()) {
                if (!entry.getKey().startsWith(prefix)) {
                    break;
                }
                listed.add(values
                    ? new KeyValueEntry(entry.getKey(), objectMapper.readTree(entry.getValue()))
                    : entry.getKey());
            }
            return listed;
        } finally {
            lock.readLock().unlock();
        }
    }
}
