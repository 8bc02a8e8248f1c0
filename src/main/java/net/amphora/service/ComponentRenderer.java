package net.amphora.service;

import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * Turns a component reference into HTML.
 */
public interface ComponentRenderer {

    /**
     * Query option that renders a component from its schema defaults only.
     */
    String IGNORE_DATA_OPTION = "ignore-data";

    /**
     * @param key component or instance key to render
     * @param context request-scoped state for the render
     * @param options whitelisted query options, e.g. {@link #IGNORE_DATA_OPTION}
     * @return rendered HTML
     */
    Mono<String> renderComponent(String key, RenderContext context, Map<String, String> options);
}
