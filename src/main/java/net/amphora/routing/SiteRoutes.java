package net.amphora.routing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.RenderContext;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

/**
 * Builder for one site's custom routes. Patterns are relative to the site's
 * mount path and use Spring's path pattern syntax ({@code /users/{id}}).
 */
public class SiteRoutes {

    static final String LAYOUT_LOCAL = "layout";

    private final ComponentRenderer renderer;
    private final List<SiteRouteTable.Route> routes = new ArrayList<>();

    public SiteRoutes(ComponentRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public SiteRoutes get(String pattern, SiteRouteHandler handler) {
        PathPattern parsed = PathPatternParser.defaultInstance.parse(pattern);
        routes.add(new SiteRouteTable.Route(parsed, Objects.requireNonNull(handler, "handler")));
        return this;
    }

    /**
     * Routes a pattern straight to a layout component. Every captured route
     * variable and the layout name are exposed to the render as locals.
     *
     * @param pattern route pattern, e.g. {@code /users/{id}}
     * @param layout layout component name, e.g. {@code user-page}
     */
    public SiteRoutes layout(String pattern, String layout) {
        String layoutKey = layout.startsWith("/") ? layout : "/components/" + layout;
        return get(pattern, request -> {
            Map<String, Object> locals = new LinkedHashMap<>(request.params());
            locals.put(LAYOUT_LOCAL, layout);
            return renderer.renderComponent(layoutKey, RenderContext.of(request.context()).withLocals(locals), Map.of());
        });
    }

    SiteRouteTable build() {
        return new SiteRouteTable(routes);
    }
}
