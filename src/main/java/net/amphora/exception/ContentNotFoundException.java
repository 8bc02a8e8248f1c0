package net.amphora.exception;

/**
 * A resource key, schema or route that does not exist.
 * Always answered as 404 by the response envelope.
 */
public class ContentNotFoundException extends RuntimeException {

    private final String key;

    public ContentNotFoundException(String key) {
        this(key, "No content stored at " + key);
    }

    public ContentNotFoundException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
