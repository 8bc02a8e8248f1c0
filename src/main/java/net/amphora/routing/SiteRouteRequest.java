package net.amphora.routing;

import java.util.Map;

/**
 * @param context site context of the request
 * @param params variables captured by the route pattern
 * @param query first value of each query parameter
 */
public record SiteRouteRequest(SiteContext context, Map<String, String> params, Map<String, String> query) {

    public SiteRouteRequest {
        params = Map.copyOf(params);
        query = Map.copyOf(query);
    }
}
