package net.amphora.domain.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

/**
 * Page under construction: an optional layout reference plus the instance key
 * created for each named slot. Frozen once every slot has resolved.
 *
 * @param layout layout reference, or {@code null} when the request named none
 * @param slots slot name to newly created component instance key
 */
public record PageDraft(String layout, Map<String, String> slots) {

    public static final String LAYOUT_FIELD = "layout";
    public static final String SELF_REFERENCE_FIELD = "_ref";

    public PageDraft {
        slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
    }

    /**
     * Stored form of the page: {@code {layout, ...slots}}, layout omitted when absent.
     */
    public ObjectNode toJson() {
        ObjectNode page = JsonNodeFactory.instance.objectNode();
        if (layout != null) {
            page.put(LAYOUT_FIELD, layout);
        }
        slots.forEach(page::put);
        return page;
    }

    /**
     * Stored form plus a self reference pointing at the page key.
     */
    public ObjectNode toJson(String pageKey) {
        ObjectNode page = toJson();
        page.put(SELF_REFERENCE_FIELD, pageKey);
        return page;
    }
}
