package net.amphora.exception;

/**
 * Page creation failed while resolving slots or committing the batch.
 * Always answered as a server error; the underlying failure is the cause.
 */
public class PageCreationException extends RuntimeException {

    private final String pageKey;

    public PageCreationException(String pageKey, Throwable cause) {
        super("Failed to create page", cause);
        this.pageKey = pageKey;
    }

    public String getPageKey() {
        return pageKey;
    }
}
