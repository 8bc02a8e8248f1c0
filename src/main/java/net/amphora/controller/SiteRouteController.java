package net.amphora.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import net.amphora.controller.support.ResponseEnvelope;
import net.amphora.domain.site.Site;
import net.amphora.exception.ContentNotFoundException;
import net.amphora.routing.SiteContext;
import net.amphora.routing.SiteRouteRegistry;
import net.amphora.routing.SiteRouteRequest;
import net.amphora.routing.SiteRouteTable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Fallback for every GET no resource route claimed: dispatches to the custom
 * routes registered by the resolved site's extension.
 */
@RestController
public class SiteRouteController {

    private final SiteRouteRegistry siteRoutes;

    public SiteRouteController(SiteRouteRegistry siteRoutes) {
        this.siteRoutes = siteRoutes;
    }

    @GetMapping("/**")
    public Mono<ResponseEntity<Object>> route(HttpServletRequest request) {
        return ResponseEnvelope.html(request, () -> {
            String path = request.getRequestURI();
            Site site = SiteContext.resolvedSite(request)
                .orElseThrow(() -> new ContentNotFoundException(path, "No site mounts " + path));
            SiteRouteTable.Match match = siteRoutes.match(site, sitePath(site, path))
                .orElseThrow(() -> new ContentNotFoundException(path, "No route for " + path + " on site " + site.slug()));
            return match.handler().handle(new SiteRouteRequest(SiteContext.current(request), match.params(), query(request)));
        });
    }

    static String sitePath(Site site, String requestPath) {
        String relative = requestPath.substring(Math.min(site.mountPrefix().length(), requestPath.length()));
        return relative.isEmpty() ? "/" : relative;
    }

    private static Map<String, String> query(HttpServletRequest request) {
        Map<String, String> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                query.put(name, values[0]);
            }
        });
        return query;
    }
}
