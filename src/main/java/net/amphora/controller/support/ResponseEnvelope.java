package net.amphora.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.amphora.domain.content.KeyListing;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Wraps handler computations into responses: serializes successes, classifies
 * and renders failures for the negotiated format.
 *
 * <p>This is the only place handlers turn results into response bodies.
 */
@Slf4j
public final class ResponseEnvelope {

    private ResponseEnvelope() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Runs a JSON-producing computation. Synchronous throws inside the supplier are
     * treated like asynchronous failures.
     */
    public static Mono<ResponseEntity<Object>> json(HttpServletRequest request,
                                                    Supplier<? extends Mono<?>> computation) {
        return Mono.defer(computation)
            .map(result -> ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .<Object>body(result))
            .switchIfEmpty(Mono.fromSupplier(() -> ResponseEntity.ok().<Object>build()))
            .onErrorResume(error -> Mono.just(failure(request, error)));
    }

    /**
     * Runs an HTML-producing computation and sends the markup as-is.
     */
    public static Mono<ResponseEntity<Object>> html(HttpServletRequest request,
                                                    Supplier<? extends Mono<String>> computation) {
        return Mono.defer(computation)
            .map(markup -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .<Object>body(markup))
            .onErrorResume(error -> Mono.just(failure(request, error)));
    }

    /**
     * Answers a prefix listing. Buffered listings go through {@link #json}; streamed
     * listings are forwarded to the client even when the stream fails part way.
     *
     * @throws IllegalStateException when the store handed back no usable listing
     */
    public static Mono<ResponseEntity<Object>> listing(HttpServletRequest request, String prefix, KeyListing listing) {
        if (listing instanceof KeyListing.Buffered buffered) {
            return json(request, buffered::entries);
        }
        if (listing instanceof KeyListing.Streamed streamed) {
            InputStreamResource body =
                new InputStreamResource(new ErrorLoggingInputStream(streamed.body(), prefix));
            return Mono.just(ResponseEntity.ok()
                .contentType(streamed.contentType())
                .<Object>body(body));
        }
        throw new IllegalStateException("Cannot answer listing of " + prefix + " with " + listing);
    }

    /**
     * Logs and answers a deliberately unimplemented route.
     */
    public static ResponseEntity<Object> notImplemented(HttpServletRequest request) {
        log.warn("Not Implemented {} {}", 501, ResourcePaths.requestPath(request));
        return ErrorResponseUtils.notImplemented();
    }

    /**
     * Classifies a failure and renders it for the negotiated format. Server errors are
     * always logged with their stack trace before answering.
     */
    public static ResponseEntity<Object> failure(HttpServletRequest request, Throwable error) {
        ContentNegotiation.Format format = ContentNegotiation.resolve(request);
        if (FailureClassifier.classify(error) == FailureClassifier.Kind.NOT_FOUND) {
            log.info("Not found: {} {}", ResourcePaths.requestPath(request), error.getMessage(), error);
            return ErrorResponseUtils.notFound(format);
        }
        log.error("Server error on {} {}: {}", request.getMethod(), ResourcePaths.requestPath(request),
            error.getMessage(), error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ErrorResponseUtils.serverError(format, message);
    }
}
