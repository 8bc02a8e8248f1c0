package net.amphora.domain.content;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

/**
 * Result of a prefix listing. A store either answers with a deferred collection
 * or hands over a live byte stream that is forwarded to the client as-is.
 */
public sealed interface KeyListing permits KeyListing.Buffered, KeyListing.Streamed {

    static KeyListing buffered(Mono<? extends List<?>> entries) {
        return new Buffered(entries);
    }

    static KeyListing streamed(InputStream body, MediaType contentType) {
        return new Streamed(body, contentType);
    }

    /**
     * @param entries keys, or key/value entries when values were requested
     */
    record Buffered(Mono<? extends List<?>> entries) implements KeyListing {
        public Buffered {
            Objects.requireNonNull(entries, "entries");
        }
    }

    /**
     * @param body live stream, owned by the receiver once returned
     * @param contentType media type of the stream content
     */
    record Streamed(InputStream body, MediaType contentType) implements KeyListing {
        public Streamed {
            Objects.requireNonNull(body, "body");
            contentType = contentType != null ? contentType : MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
