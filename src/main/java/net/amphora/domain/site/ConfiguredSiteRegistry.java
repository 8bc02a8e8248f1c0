package net.amphora.domain.site;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable site registry assembled from application configuration.
 *
 * @param sites configured sites in declaration order
 * @param hostAliases canonical host to environment host
 */
public record ConfiguredSiteRegistry(List<Site> sites, Map<String, String> hostAliases) implements SiteRegistry {

    public ConfiguredSiteRegistry {
        sites = List.copyOf(sites);
        hostAliases = Map.copyOf(hostAliases);
    }

    @Override
    public List<String> hosts() {
        LinkedHashSet<String> hosts = new LinkedHashSet<>();
        for (Site site : sites) {
            hosts.add(site.host());
        }
        return List.copyOf(hosts);
    }

    @Override
    public Optional<String> hostAlias(String host) {
        return Optional.ofNullable(hostAliases.get(host)).filter(alias -> !alias.isBlank());
    }
}
