package net.amphora.routing;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;

/**
 * Frozen custom routes of one site, matched in registration order.
 */
public final class SiteRouteTable {

    static final SiteRouteTable EMPTY = new SiteRouteTable(List.of());

    private final List<Route> routes;

    SiteRouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    public Optional<Match> match(String sitePath) {
        PathContainer path = PathContainer.parsePath(sitePath);
        for (Route route : routes) {
            PathPattern.PathMatchInfo info = route.pattern().matchAndExtract(path);
            if (info != null) {
                return Optional.of(new Match(route.handler(), info.getUriVariables()));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return routes.size();
    }

    record Route(PathPattern pattern, SiteRouteHandler handler) {
    }

    /**
     * @param handler handler of the first matching route
     * @param params captured route variables
     */
    public record Match(SiteRouteHandler handler, Map<String, String> params) {
    }
}
