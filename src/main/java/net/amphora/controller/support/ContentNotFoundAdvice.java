package net.amphora.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import net.amphora.exception.ContentNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Answers not-found failures raised outside a handler's reactive pipeline,
 * such as a rejected host, in the same negotiated format as the envelope.
 */
@Slf4j
@RestControllerAdvice
public class ContentNotFoundAdvice {

    @ExceptionHandler(ContentNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ContentNotFoundException ex, HttpServletRequest request) {
        log.debug("Rejected {} before dispatch", ex.getKey());
        return ResponseEnvelope.failure(request, ex);
    }
}
