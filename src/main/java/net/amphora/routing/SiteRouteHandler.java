package net.amphora.routing;

import reactor.core.publisher.Mono;

/**
 * Custom GET route contributed by a site extension. Produces HTML.
 */
@FunctionalInterface
public interface SiteRouteHandler {

    Mono<String> handle(SiteRouteRequest request);
}
