package net.amphora.adapters.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.amphora.domain.content.BatchOperation;
import net.amphora.domain.content.KeyListing;
import net.amphora.domain.content.KeyValueEntry;
import net.amphora.exception.ContentNotFoundException;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryContentStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryContentStore store = new InMemoryContentStore(objectMapper, false);

    @Test
    void get_missingKeyIsNotFound() {
        StepVerifier.create(store.get("/pages/missing"))
            .expectError(ContentNotFoundException.class)
            .verify();
    }

    @Test
    void put_thenGetReturnsStoredValue() {
        StepVerifier.create(store.put("/uris/home", "\"/pages/a\"").then(store.get("/uris/home")))
            .expectNext("\"/pages/a\"")
            .verifyComplete();
    }

    @Test
    void batch_writesEveryOperation() {
        List<BatchOperation> operations = List.of(
            BatchOperation.put("/components/a/instances/1", objectMapper.readTree("{\"x\":1}")),
            BatchOperation.put("/pages/1", objectMapper.readTree("{\"main\":\"/components/a/instances/1\"}")));

        StepVerifier.create(store.batch(operations)).verifyComplete();

        StepVerifier.create(store.get("/pages/1"))
            .expectNext("{\"main\":\"/components/a/instances/1\"}")
            .verifyComplete();
        StepVerifier.create(store.get("/components/a/instances/1"))
            .expectNext("{\"x\":1}")
            .verifyComplete();
    }

    @Test
    void list_returnsKeysUnderPrefixInOrder() {
        store.put("/pages/b", "{}").block();
        store.put("/pages/a", "{}").block();
        store.put("/uris/a", "{}").block();

        KeyListing listing = store.list("/pages", false);

        assertThat(listing).isInstanceOf(KeyListing.Buffered.class);
        StepVerifier.create(((KeyListing.Buffered) listing).entries())
            .assertNext(entries -> assertThat(entries)
                .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                .containsExactly("/pages/a", "/pages/b"))
            .verifyComplete();
    }

    @Test
    void list_withValuesReturnsEntries() {
        store.put("/pages/a", "{\"k\":\"v\"}").block();

        KeyListing.Buffered listing = (KeyListing.Buffered) store.list("/pages", true);

        StepVerifier.create(listing.entries())
            .assertNext(entries -> {
                assertThat(entries).hasSize(1);
                KeyValueEntry entry = (KeyValueEntry) entries.get(0);
                assertThat(entry.key()).isEqualTo("/pages/a");
                assertThat(entry.value().get("k").asString()).isEqualTo("v");
            })
            .verifyComplete();
    }

    @Test
    void list_streamedWhenConfigured() throws IOException {
        InMemoryContentStore streaming = new InMemoryContentStore(objectMapper, true);
        streaming.put("/pages/a", "{}").block();

        KeyListing listing = streaming.list("/pages", false);

        assertThat(listing).isInstanceOf(KeyListing.Streamed.class);
        KeyListing.Streamed streamed = (KeyListing.Streamed) listing;
        assertThat(streamed.contentType()).isEqualTo(MediaType.APPLICATION_JSON);
        try (InputStream in = streamed.body()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("[\"/pages/a\"]");
        }
    }
}
