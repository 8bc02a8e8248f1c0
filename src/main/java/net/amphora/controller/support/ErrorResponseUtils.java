package net.amphora.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error responses per negotiated format.
 * Bodies never carry stack traces: a short message and the numeric code at most.
 */
public final class ErrorResponseUtils {

    static final String NOT_FOUND_MESSAGE = "Not Found";
    static final String NOT_FOUND_HTML = "404 Not Found";
    static final String SERVER_ERROR_HTML = "500 Server Error";

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message, HttpStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("code", status.value());
        return body;
    }

    public static ResponseEntity<Object> notFound(ContentNegotiation.Format format) {
        return error(format, HttpStatus.NOT_FOUND, NOT_FOUND_MESSAGE, NOT_FOUND_HTML);
    }

    public static ResponseEntity<Object> serverError(ContentNegotiation.Format format, String message) {
        return error(format, HttpStatus.INTERNAL_SERVER_ERROR, message, SERVER_ERROR_HTML);
    }

    public static ResponseEntity<Object> notImplemented() {
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).build();
    }

    private static ResponseEntity<Object> error(ContentNegotiation.Format format,
                                                HttpStatus status,
                                                String jsonMessage,
                                                String html) {
        return switch (format) {
            case JSON -> ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(errorBody(jsonMessage, status));
            case HTML -> ResponseEntity.status(status)
                .contentType(MediaType.TEXT_HTML)
                .body(html);
            case OTHER -> ResponseEntity.status(status).build();
        };
    }
}
