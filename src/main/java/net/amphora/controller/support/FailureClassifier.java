package net.amphora.controller.support;

import net.amphora.exception.ContentNotFoundException;
import reactor.core.Exceptions;

/**
 * Splits handler failures into missing resources and server errors.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public enum Kind {
        NOT_FOUND,
        SERVER_ERROR
    }

    /**
     * A failure is a missing resource when it is a {@link ContentNotFoundException},
     * or when its message mentions {@code ENOENT} or {@code not found} (case-sensitive).
     * Never throws.
     */
    public static Kind classify(Throwable failure) {
        if (failure == null) {
            return Kind.SERVER_ERROR;
        }
        Throwable unwrapped = Exceptions.unwrap(failure);
        if (unwrapped instanceof ContentNotFoundException) {
            return Kind.NOT_FOUND;
        }
        String message = unwrapped.getMessage();
        if (message != null && (message.contains("ENOENT") || message.contains("not found"))) {
            return Kind.NOT_FOUND;
        }
        return Kind.SERVER_ERROR;
    }
}
