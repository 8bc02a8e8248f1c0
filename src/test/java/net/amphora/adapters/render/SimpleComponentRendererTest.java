package net.amphora.adapters.render;

import java.util.Map;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SimpleComponentRendererTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ComponentReferences references;

    @Test
    void renderComponent_embedsDataAndSite() {
        when(references.getComponentData("/components/article"))
            .thenReturn(Mono.just(objectMapper.readTree("{\"title\":\"</script><b>\"}")));
        SimpleComponentRenderer renderer = new SimpleComponentRenderer(references, objectMapper);
        RenderContext context = new RenderContext("http://localhost/components/article.html", "main", true, Map.of());

        StepVerifier.create(renderer.renderComponent("/components/article", context, Map.of()))
            .assertNext(html -> {
                assertThat(html).startsWith("<div data-uri=\"/components/article\" data-site=\"main\">");
                assertThat(html).contains("<\\/script><b>");
                assertThat(html).contains("\"_edit\":true");
                assertThat(html).endsWith("</script></div>");
            })
            .verifyComplete();
    }

    @Test
    void renderComponent_ignoreDataSkipsLookup() {
        SimpleComponentRenderer renderer = new SimpleComponentRenderer(references, objectMapper);
        RenderContext context = new RenderContext("http://localhost/", null, false, Map.of("name", "x"));

        StepVerifier.create(renderer.renderComponent("/components/article", context, Map.of(ComponentRenderer.IGNORE_DATA_OPTION, "true")))
            .assertNext(html -> {
                assertThat(html).doesNotContain("data-site");
                assertThat(html).contains("\"_locals\":{\"name\":\"x\"}");
            })
            .verifyComplete();

        verify(references, never()).getComponentData(anyString());
    }

    @Test
    void renderComponent_ignoreDataFalseStillLoadsData() {
        when(references.getComponentData("/components/article"))
            .thenReturn(Mono.just(objectMapper.readTree("{\"title\":\"Hello\"}")));
        SimpleComponentRenderer renderer = new SimpleComponentRenderer(references, objectMapper);
        RenderContext context = new RenderContext("http://localhost/", "main", false, Map.of());

        StepVerifier.create(renderer.renderComponent("/components/article", context,
                Map.of(ComponentRenderer.IGNORE_DATA_OPTION, "false")))
            .assertNext(html -> assertThat(html).contains("\"title\":\"Hello\""))
            .verifyComplete();
    }
}
