package net.amphora.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.amphora.domain.site.Site;
import net.amphora.service.ComponentRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Custom route tables for every routed site, built once at startup by applying
 * the matching {@link SiteExtension} beans.
 */
public final class SiteRouteRegistry {

    private static final Logger log = LoggerFactory.getLogger(SiteRouteRegistry.class);

    private final Map<Site, SiteRouteTable> tables;

    private SiteRouteRegistry(Map<Site, SiteRouteTable> tables) {
        this.tables = Map.copyOf(tables);
    }

    public static SiteRouteRegistry build(HostRouting hostRouting,
                                          List<SiteExtension> extensions,
                                          ComponentRenderer renderer) {
        Map<Site, SiteRouteTable> tables = new LinkedHashMap<>();
        for (HostRoutingTable table : hostRouting.tables()) {
            for (Site site : table.sites()) {
                SiteRoutes routes = new SiteRoutes(renderer);
                boolean extended = false;
                for (SiteExtension extension : extensions) {
                    if (extension.slug().equals(site.slug())) {
                        extension.configure(routes, renderer);
                        extended = true;
                    }
                }
                SiteRouteTable built = routes.build();
                if (extended) {
                    log.info("Site {} on {} registered {} custom route(s)", site.slug(), table.alias(), built.size());
                } else {
                    log.info("Site {} on {} has no site extension", site.slug(), table.alias());
                }
                tables.put(site, built);
            }
        }
        return new SiteRouteRegistry(tables);
    }

    /**
     * @param site resolved site
     * @param sitePath request path relative to the site's mount path
     */
    public Optional<SiteRouteTable.Match> match(Site site, String sitePath) {
        return tables.getOrDefault(site, SiteRouteTable.EMPTY).match(sitePath);
    }
}
