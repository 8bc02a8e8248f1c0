package net.amphora.controller;

import jakarta.servlet.http.HttpServletRequest;
import net.amphora.application.content.StoredContentService;
import net.amphora.controller.support.ResourcePaths;
import net.amphora.controller.support.ResponseEnvelope;
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
 * Raw URI documents: a public URL mapped to the page it serves.
 */
@RestController
@RequestMapping("/uris")
public class UriController {

    private final StoredContentService storedContent;

    public UriController(StoredContentService storedContent) {
        this.storedContent = storedContent;
    }

    @GetMapping({"", "/"})
    public Mono<ResponseEntity<Object>> listUris(HttpServletRequest request) {
        String prefix = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.listing(request, prefix, storedContent.listKeys(prefix));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<Object>> getUri(@PathVariable String name, HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> storedContent.read(key));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<Object>> putUri(@PathVariable String name,
                                               @RequestBody JsonNode body,
                                               HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> storedContent.write(key, body));
    }
}
