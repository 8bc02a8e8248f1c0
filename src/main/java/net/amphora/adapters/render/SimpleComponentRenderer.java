package net.amphora.adapters.render;

import java.util.Map;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.RenderContext;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

/**
 * Minimal renderer: a wrapper element carrying the component reference and its
 * data as embedded JSON. Real template rendering plugs in as another
 * {@link ComponentRenderer} bean.
 */
public class SimpleComponentRenderer implements ComponentRenderer {

    private final ComponentReferences references;
    private final ObjectMapper objectMapper;

    public SimpleComponentRenderer(ComponentReferences references, ObjectMapper objectMapper) {
        this.references = references;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> renderComponent(String key, RenderContext context, Map<String, String> options) {
        Mono<ObjectNode> data = isIgnoreData(options)
            ? Mono.just(JsonNodeFactory.instance.objectNode())
            : references.getComponentData(key).map(SimpleComponentRenderer::asObject);
        return data.map(node -> markup(key, context, node));
    }

    private String markup(String key, RenderContext context, ObjectNode data) {
        ObjectNode locals = JsonNodeFactory.instance.objectNode();
        context.locals().forEach((name, value) -> locals.set(name, objectMapper.<JsonNode>valueToTree(value)));
        data.set("_locals", locals);
        data.put("_url", context.url());
        data.put("_edit", context.editMode());

        String json = objectMapper.writeValueAsString(data).replace("</", "<\\/");
        StringBuilder html = new StringBuilder("<div data-uri=\"")
            .append(HtmlUtils.htmlEscape(key))
            .append('"');
        if (context.site() != null) {
            html.append(" data-site=\"").append(HtmlUtils.htmlEscape(context.site())).append('"');
        }
        return html.append("><script type=\"application/json\">")
            .append(json)
            .append("</script></div>")
            .toString();
    }

    private static ObjectNode asObject(JsonNode node) {
        if (node.isObject()) {
            return ((ObjectNode) node).deepCopy();
        }
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.set("value", node);
        return wrapper;
    }

    private static boolean isIgnoreData(Map<String, String> options) {
        String value = options.get(IGNORE_DATA_OPTION);
        return value != null && !"false".equalsIgnoreCase(value);
    }
}
