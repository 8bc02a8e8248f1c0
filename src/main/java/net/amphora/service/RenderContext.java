package net.amphora.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import net.amphora.routing.SiteContext;

/**
 * State handed to the renderer for one request.
 *
 * @param url fully reconstructed request URL
 * @param site resolved site slug, {@code null} outside any site
 * @param editMode whether the page is rendered for editing
 * @param locals extra values exposed to templates (route params, layout, sandbox name)
 */
public record RenderContext(String url, String site, boolean editMode, Map<String, Object> locals) {

    public RenderContext {
        locals = Collections.unmodifiableMap(new LinkedHashMap<>(locals));
    }

    public static RenderContext of(SiteContext context) {
        return new RenderContext(context.url(), context.site(), context.editMode(), Map.of());
    }

    public RenderContext withLocal(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(locals);
        merged.put(name, value);
        return new RenderContext(url, site, editMode, merged);
    }

    public RenderContext withLocals(Map<String, ?> values) {
        Map<String, Object> merged = new LinkedHashMap<>(locals);
        merged.putAll(values);
        return new RenderContext(url, site, editMode, merged);
    }
}
