package net.amphora.routing;

import java.util.List;
import java.util.Optional;
import net.amphora.domain.site.Site;

/**
 * Sites served on one host, ordered by ascending mount-path depth.
 *
 * @param host canonical host shared by the sites
 * @param alias host name this environment answers on
 * @param sites sites on the host, shallow to deep, registry order on ties
 */
public record HostRoutingTable(String host, String alias, List<Site> sites) {

    public HostRoutingTable {
        sites = List.copyOf(sites);
    }

    /**
     * Longest-prefix match of a request path against the site mount paths.
     * When several sites mount the same prefix, the one later in depth order
     * wins: the deeper path ({@code /foo/} over {@code /foo}), then the one
     * declared later among equal depths.
     *
     * @param requestPath request path without query string
     * @return the most specific site mounting the path
     */
    public Optional<Site> resolve(String requestPath) {
        Site best = null;
        int bestLength = -1;
        for (Site site : sites) {
            if (!site.mounts(requestPath)) {
                continue;
            }
            int length = site.mountPrefix().length();
            if (length >= bestLength) {
                best = site;
                bestLength = length;
            }
        }
        return Optional.ofNullable(best);
    }
}
