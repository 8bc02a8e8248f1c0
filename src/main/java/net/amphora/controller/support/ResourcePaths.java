package net.amphora.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives storage keys from request paths.
 *
 * <p>A resource key is the request path with its query string and extension
 * removed: {@code /components/foo.html?x=1} becomes {@code /components/foo}.
 */
public final class ResourcePaths {

    private ResourcePaths() {
    }

    public static String removeQueryString(String path) {
        int queryIndex = path.indexOf('?');
        return queryIndex >= 0 ? path.substring(0, queryIndex) : path;
    }

    /**
     * Cuts the last path segment at its first dot.
     */
    public static String removeExtension(String path) {
        int dotIndex = extensionDot(path);
        return dotIndex >= 0 ? path.substring(0, dotIndex) : path;
    }

    public static String normalize(String path) {
        return removeExtension(removeQueryString(path));
    }

    /**
     * @return the lower-cased extension of the last segment, without the dot
     */
    public static Optional<String> extension(String path) {
        String withoutQuery = removeQueryString(path);
        int dotIndex = extensionDot(withoutQuery);
        if (dotIndex < 0 || dotIndex == withoutQuery.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(withoutQuery.substring(dotIndex + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Original request path plus query string, as the client sent it.
     */
    public static String requestPath(HttpServletRequest request) {
        String query = request.getQueryString();
        String uri = request.getRequestURI();
        return (query == null || query.isEmpty()) ? uri : uri + "?" + query;
    }

    public static String resourceKey(HttpServletRequest request) {
        return normalize(requestPath(request));
    }

    /**
     * Keeps only the allowed query parameters, first value of each.
     */
    public static Map<String, String> pickQueryOptions(HttpServletRequest request, Set<String> allowed) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String name : allowed) {
            String value = request.getParameter(name);
            if (value != null) {
                options.put(name, value);
            }
        }
        return options;
    }

    private static int extensionDot(String path) {
        int segmentStart = path.lastIndexOf('/') + 1;
        return path.indexOf('.', segmentStart);
    }
}
