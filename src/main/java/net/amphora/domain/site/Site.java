package net.amphora.domain.site;

import java.util.Objects;

/**
 * One tenant's configuration: a slug, the canonical host it is served from and
 * the path it is mounted at on that host.
 *
 * <p>Several sites may share a host and their paths may nest ({@code /} and
 * {@code /foo/} on the same host is expected).
 *
 * @param slug site identifier exposed to rendering and site extensions
 * @param host canonical host name, before per-environment aliasing
 * @param path mount path on the host
 */
public record Site(String slug, String host, String path) {

    public Site {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(host, "host");
        path = (path == null || path.isBlank()) ? "/" : path;
    }

    /**
     * Number of segments in the mount path, counted the way a plain
     * {@code path.split("/")} does in JavaScript: empty trailing segments count.
     */
    public int pathDepth() {
        return path.split("/", -1).length;
    }

    /**
     * Mount path without a trailing slash; the root site yields an empty string.
     */
    public String mountPrefix() {
        String prefix = path.startsWith("/") ? path : "/" + path;
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }

    /**
     * Whether a request path falls under this site's mount path. Matching is
     * case-insensitive and respects segment boundaries.
     */
    public boolean mounts(String requestPath) {
        String prefix = mountPrefix();
        if (prefix.isEmpty()) {
            return true;
        }
        if (requestPath == null || requestPath.length() < prefix.length()) {
            return false;
        }
        if (!requestPath.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return false;
        }
        return requestPath.length() == prefix.length() || requestPath.charAt(prefix.length()) == '/';
    }
}
