package net.amphora.routing;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import net.amphora.domain.site.Site;

/**
 * Every host routing table, keyed by the environment host alias.
 * Built once at startup and read-only afterwards.
 */
public final class HostRouting {

    private final Map<String, HostRoutingTable> tablesByAlias;

    HostRouting(Map<String, HostRoutingTable> tablesByAlias) {
        this.tablesByAlias = Map.copyOf(tablesByAlias);
    }

    public Optional<HostRoutingTable> table(String hostName) {
        if (hostName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tablesByAlias.get(hostName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves the site owning a request.
     *
     * @param hostName host name the request arrived on, without port
     * @param requestPath request path without query string
     * @return the most specific site on that host mounting the path
     */
    public Optional<Site> resolve(String hostName, String requestPath) {
        return table(hostName).flatMap(table -> table.resolve(requestPath));
    }

    public Collection<HostRoutingTable> tables() {
        return tablesByAlias.values();
    }
}
