package net.amphora.routing;

import net.amphora.service.ComponentRenderer;

/**
 * Per-tenant route module. Spring beans implementing this interface are applied
 * once at startup to every configured site whose slug matches.
 */
public interface SiteExtension {

    /**
     * @return slug of the site this extension customizes
     */
    String slug();

    /**
     * Registers the site's custom routes. Resource routes always take precedence.
     *
     * @param routes route builder scoped to the site's mount path
     * @param renderer renderer available to custom handlers
     */
    void configure(SiteRoutes routes, ComponentRenderer renderer);
}
