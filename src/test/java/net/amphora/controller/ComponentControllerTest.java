package net.amphora.controller;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import net.amphora.domain.content.KeyListing;
import net.amphora.exception.ContentNotFoundException;
import net.amphora.service.RenderContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ComponentControllerTest extends AbstractResourceControllerMvcTest {

    @Test
    @DisplayName("GET /components answers 501")
    void listComponents_notImplemented() throws Exception {
        performAsync(get("/components"))
            .andExpect(status().isNotImplemented());
    }

    @Test
    @DisplayName("Resource routes on an unrouted host answer 404 before any handler runs")
    void getComponent_unroutedHost_notFound() throws Exception {
        performAsync(get("/components/article").with(request -> {
                request.setServerName("unrouted.test");
                return request;
            }).accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isNotFound())
            .andExpect(content().json("{\"message\":\"Not Found\",\"code\":404}"));

        verify(componentReferences, never()).getComponentData(anyString());
    }

    @Test
    @DisplayName("No extension returns component JSON for the normalized key")
    void getComponent_withoutExtension_returnsJson() throws Exception {
        when(componentReferences.getComponentData("/components/article")).thenReturn(monoJson("{\"title\":\"Hello\"}"));

        performAsync(get("/components/article?edit=true"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.title", equalTo("Hello")));
    }

    @Test
    void getComponent_jsonExtension_returnsJsonEvenForBrowsers() throws Exception {
        when(componentReferences.getComponentData("/components/article")).thenReturn(monoJson("{\"title\":\"Hello\"}"));

        performAsync(get("/components/article.json").accept(MediaType.TEXT_HTML))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.title", equalTo("Hello")));
    }

    @Test
    @DisplayName(".html renders with only whitelisted options")
    void getComponent_htmlExtension_renders() throws Exception {
        when(componentRenderer.renderComponent(eq("/components/article"), any(RenderContext.class), any()))
            .thenReturn(Mono.just("<article>Hello</article>"));

        performAsync(get("/components/article.html?ignore-data=true&other=x"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
            .andExpect(content().string("<article>Hello</article>"));

        ArgumentCaptor<RenderContext> context = ArgumentCaptor.forClass(RenderContext.class);
        verify(componentRenderer).renderComponent(eq("/components/article"), context.capture(),
            eq(Map.of("ignore-data", "true")));
        assertThat(context.getValue().site()).isEqualTo("main");
        assertThat(context.getValue().url()).startsWith("http://localhost/components/article.html?");
    }

    @Test
    void getInstance_htmlExtension_rendersInstance() throws Exception {
        when(componentRenderer.renderComponent(eq("/components/article/instances/abc"), any(RenderContext.class), any()))
            .thenReturn(Mono.just("<article/>"));

        performAsync(get("/components/article/instances/abc.HTML"))
            .andExpect(status().isOk())
            .andExpect(content().string("<article/>"));
    }

    @Test
    void getComponent_yamlExtension_notImplemented() throws Exception {
        performAsync(get("/components/article.yaml"))
            .andExpect(status().isNotImplemented());

        verify(componentReferences, never()).getComponentData(anyString());
    }

    @Test
    @DisplayName("Missing component answers the JSON not-found body")
    void getInstance_missing_returnsJson404() throws Exception {
        when(componentReferences.getComponentData("/components/article/instances/missing"))
            .thenReturn(Mono.error(new ContentNotFoundException("/components/article/instances/missing")));

        performAsync(get("/components/article/instances/missing").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isNotFound())
            .andExpect(content().json("{\"message\":\"Not Found\",\"code\":404}"));
    }

    @Test
    @DisplayName("Render failure answers the HTML server error body")
    void getComponent_renderFailure_returnsHtml500() throws Exception {
        when(componentRenderer.renderComponent(eq("/components/article"), any(RenderContext.class), any()))
            .thenReturn(Mono.error(new IllegalStateException("template exploded")));

        performAsync(get("/components/article.html").accept(MediaType.TEXT_HTML))
            .andExpect(status().isInternalServerError())
            .andExpect(content().string("500 Server Error"));
    }

    @Test
    void putComponent_persistsThroughReferencesAndEchoes() throws Exception {
        when(componentReferences.putComponentData(eq("/components/article"), any()))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(1)));

        performAsync(put("/components/article.json")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Saved\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title", equalTo("Saved")));

        verify(componentReferences).putComponentData(eq("/components/article"), eq(json("{\"title\":\"Saved\"}")));
    }

    @Test
    void putInstance_usesInstanceKey() throws Exception {
        when(componentReferences.putComponentData(eq("/components/article/instances/abc"), any()))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(1)));

        performAsync(put("/components/article/instances/abc")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Instance\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title", equalTo("Instance")));
    }

    @Test
    void listInstances_bufferedListing() throws Exception {
        when(contentStore.list("/components/article/instances", false))
            .thenReturn(KeyListing.buffered(Mono.just(List.of("/components/article/instances/a"))));

        performAsync(get("/components/article/instances"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]", equalTo("/components/article/instances/a")));
    }

    @Test
    void listInstances_streamedListingIsForwarded() throws Exception {
        byte[] body = "[\"/components/article/instances/a\"]".getBytes(StandardCharsets.UTF_8);
        when(contentStore.list("/components/article/instances", false))
            .thenReturn(KeyListing.streamed(new ByteArrayInputStream(body), MediaType.APPLICATION_JSON));

        performAsync(get("/components/article/instances"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(content().string("[\"/components/article/instances/a\"]"));
    }

    @Test
    @DisplayName("A store returning no listing is a programming error, not a 500 body")
    void listInstances_missingListingPropagates() {
        when(contentStore.list("/components/article/instances", false)).thenReturn(null);

        assertThatThrownBy(() -> mockMvc.perform(get("/components/article/instances")))
            .satisfies(error -> assertThat(NestedExceptionUtils.getMostSpecificCause(error))
                .isInstanceOf(IllegalStateException.class));
    }

    @Test
    void getSchema_returnsSchemaJson() throws Exception {
        when(componentReferences.getSchema("/components/article/schema")).thenReturn(monoJson("{\"title\":{\"_has\":\"text\"}}"));

        performAsync(get("/components/article/schema"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title._has", equalTo("text")));
    }

    @Test
    void sandbox_rendersSandboxInstanceWithName() throws Exception {
        when(componentRenderer.renderComponent(eq("/components/sandbox/instances/0"), any(RenderContext.class), any()))
            .thenReturn(Mono.just("<div>sandbox</div>"));

        performAsync(get("/sandbox/button"))
            .andExpect(status().isOk())
            .andExpect(content().string("<div>sandbox</div>"));

        ArgumentCaptor<RenderContext> context = ArgumentCaptor.forClass(RenderContext.class);
        verify(componentRenderer).renderComponent(eq("/components/sandbox/instances/0"), context.capture(), eq(Map.of()));
        assertThat(context.getValue().locals()).containsEntry("name", "button");
    }
}
