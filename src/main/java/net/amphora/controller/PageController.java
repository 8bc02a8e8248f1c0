package net.amphora.controller;

import jakarta.servlet.http.HttpServletRequest;
import net.amphora.application.content.StoredContentService;
import net.amphora.application.page.PageCreationService;
import net.amphora.controller.support.ResourcePaths;
import net.amphora.controller.support.ResponseEnvelope;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Raw page documents and page creation.
 */
@RestController
@RequestMapping("/pages")
public class PageController {

    private final StoredContentService storedContent;
    private final PageCreationService pageCreationService;

    public PageController(StoredContentService storedContent, PageCreationService pageCreationService) {
        this.storedContent = storedContent;
        this.pageCreationService = pageCreationService;
    }

    @GetMapping({"", "/"})
    public Mono<ResponseEntity<Object>> listPages(HttpServletRequest request) {
        String prefix = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.listing(request, prefix, storedContent.listKeys(prefix));
    }

    @PostMapping({"", "/"})
    public Mono<ResponseEntity<Object>> createPage(@RequestBody(required = false) JsonNode body,
                                                   HttpServletRequest request) {
        return ResponseEnvelope.json(request, () -> pageCreationService.createPage(body));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<Object>> getPage(@PathVariable String name, HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> storedContent.read(key));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<Object>> putPage(@PathVariable String name,
                                                @RequestBody JsonNode body,
                                                HttpServletRequest request) {
        String key = ResourcePaths.resourceKey(request);
        return ResponseEnvelope.json(request, () -> storedContent.write(key, body));
    }
}
