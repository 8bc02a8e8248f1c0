package net.amphora.routing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.amphora.domain.site.Site;
import net.amphora.domain.site.SiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one routing table per distinct host from the site registry.
 *
 * <p>Sites on a host are ordered by the depth of their mount path so
 * {@code domain.com/} and {@code domain.com/foo/} can live side by side; the
 * sort is stable, keeping registry order for sites of equal depth.
 */
public class HostRouterBuilder {

    private static final Logger log = LoggerFactory.getLogger(HostRouterBuilder.class);

    /**
     * @param registry immutable site registry loaded at startup
     * @return routing tables keyed by environment host alias
     * @throws IllegalStateException when a host has no alias for this environment,
     *                               or two hosts share one alias
     */
    public HostRouting build(SiteRegistry registry) {
        Map<String, HostRoutingTable> tables = new LinkedHashMap<>();
        for (String host : registry.hosts()) {
            String alias = registry.hostAlias(host)
                .orElseThrow(() -> new IllegalStateException("No host alias configured for host '" + host + "'"));

            List<Site> sitesOnHost = new ArrayList<>();
            for (Site site : registry.sites()) {
                if (site.host().equals(host)) {
                    sitesOnHost.add(site);
                }
            }
            sitesOnHost.sort(Comparator.comparingInt(Site::pathDepth));

            String key = alias.toLowerCase(Locale.ROOT);
            if (tables.containsKey(key)) {
                throw new IllegalStateException("Host alias '" + alias + "' is configured for more than one host");
            }
            tables.put(key, new HostRoutingTable(host, alias, sitesOnHost));
            log.info("Routing host {} (as {}) to sites {}", host, alias,
                sitesOnHost.stream().map(site -> site.slug() + "@" + site.path()).toList());
        }
        return new HostRouting(tables);
    }
}
