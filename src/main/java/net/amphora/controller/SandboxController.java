package net.amphora.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import net.amphora.controller.support.ResponseEnvelope;
import net.amphora.routing.SiteContext;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.RenderContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Renders the shared sandbox instance with the requested name in scope, for
 * previewing components outside a page.
 */
@RestController
public class SandboxController {

    static final String SANDBOX_INSTANCE = "/components/sandbox/instances/0";

    private final ComponentRenderer renderer;

    public SandboxController(ComponentRenderer renderer) {
        this.renderer = renderer;
    }

    @GetMapping("/sandbox/{name}")
    public Mono<ResponseEntity<Object>> sandbox(@PathVariable String name, HttpServletRequest request) {
        RenderContext context = RenderContext.of(SiteContext.current(request)).withLocal("name", name);
        return ResponseEnvelope.html(request, () -> renderer.renderComponent(SANDBOX_INSTANCE, context, Map.of()));
    }
}
