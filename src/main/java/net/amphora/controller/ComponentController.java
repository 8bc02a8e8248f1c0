package net.amphora.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.amphora.controller.support.ContentNegotiation;
import net.amphora.controller.support.ResourcePaths;
import net.amphora.controller.support.ResponseEnvelope;
import net.amphora.routing.SiteContext;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.ContentStore;
import net.amphora.service.RenderContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Components, their instances and schemas.
 *
 * <p>The path variables only select the route: the storage key is always derived
 * from the raw request path, and a trailing extension picks the representation.
 */
@RestController
@RequestMapping("/components")
@Slf4j
public class ComponentController {

    static final MediaType TEXT_YAML = MediaType.parseMediaType("text/yaml");

    private static final Set<String> RENDER_OPTIONS = Set.of(ComponentRenderer.IGNORE_DATA_OPTION);

    private final ComponentReferences references;
    private final ComponentRenderer renderer;
    private final ContentStore contentStore;

    public ComponentController(ComponentReferences references,
                               ComponentRenderer renderer,
                               ContentStore contentStore) {
        this.references = references;
        this.renderer = renderer;
        this.contentStore = contentStore;
    }

    @GetMapping({"", "/"})
    public ResponseEntity<Object> listComponents(HttpServletRequest request) {
        return ResponseEnvelope.notImplemented(request);
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<Object>> getComponent(@PathVariable String name, HttpServletRequest request) {
        return routeByExtension(request, Map.of("name", name));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<Object>> putComponent(@PathVariable String name,
                                                     @RequestBody JsonNode body,
                                                     HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> references.putComponentData(key, body));
    }

    @GetMapping("/{name}/instances")
    public Mono<ResponseEntity<Object>> listInstances(@PathVariable String name, HttpServletRequest request) {
        String prefix = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.listing(request, prefix, contentStore.list(prefix, false));
    }

    @GetMapping("/{name}/instances/{id}")
    public Mono<ResponseEntity<Object>> getInstance(@PathVariable String name,
                                                    @PathVariable String id,
                                                    HttpServletRequest request) {
        return routeByExtension(request, Map.of("name", name, "id", id));
    }

    @PutMapping("/{name}/instances/{id}")
    public Mono<ResponseEntity<Object>> putInstance(@PathVariable String name,
                                                    @PathVariable String id,
                                                    @RequestBody JsonNode body,
                                                    HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> references.putComponentData(key, body));
    }

    @GetMapping("/{name}/schema")
    public Mono<ResponseEntity<Object>> getSchema(@PathVariable String name, HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> references.getSchema(key));
    }

    private Mono<ResponseEntity<Object>> routeByExtension(HttpServletRequest request, Map<String, String> params) {
        String path = ResourcePaths.requestPath(request);
        String key = ResourcePaths.normalize(path);
        String extension = ResourcePaths.extension(path).orElse("");
        log.info("routeByExtension {} {}", params, extension);

        switch (extension) {
            case "html" -> {
                ContentNegotiation.force(request, MediaType.TEXT_HTML);
                Map<String, String> options = ResourcePaths.pickQueryOptions(request, RENDER_OPTIONS);
                RenderContext context = RenderContext.of(SiteContext.current(request));
                return ResponseEnvelope.html(request, () -> renderer.renderComponent(key, context, options));
            }
            case "yaml" -> {
                ContentNegotiation.force(request, TEXT_YAML);
                return Mono.just(ResponseEnvelope.notImplemented(request));
            }
            default -> {
                ContentNegotiation.force(request, MediaType.APPLICATION_JSON);
                return ResponseEnvelope.json(request, () -> references.getComponentData(key));
            }
        }
    }
}
