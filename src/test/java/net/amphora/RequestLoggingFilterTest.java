package net.amphora;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class RequestLoggingFilterTest {

    @Test
    void extension_readsOnlyLastSegment() {
        assertEquals("html", RequestLoggingFilter.extension("/components/article.HTML"));
        assertEquals("", RequestLoggingFilter.extension("/v1.2/pages/home"));
        assertEquals("", RequestLoggingFilter.extension("/components/article."));
    }

    @Test
    void doFilter_alwaysContinuesChain() throws Exception {
        RequestLoggingFilter filter = new RequestLoggingFilter();
        MockHttpServletRequest asset = new MockHttpServletRequest("GET", "/static/app.css");
        MockHttpServletRequest page = new MockHttpServletRequest("GET", "/pages/home");
        MockFilterChain assetChain = new MockFilterChain();
        MockFilterChain pageChain = new MockFilterChain();

        filter.doFilter(asset, new MockHttpServletResponse(), assetChain);
        filter.doFilter(page, new MockHttpServletResponse(), pageChain);

        assertSame(asset, assetChain.getRequest());
        assertSame(page, pageChain.getRequest());
    }

    @Test
    void doFilter_asyncRequestLogsOnCompletion() throws Exception {
        RequestLoggingFilter filter = new RequestLoggingFilter();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/pages/home.json");
        request.setAsyncSupported(true);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) {
                req.startAsync();
            }
        });

        filter.doFilter(request, response, chain);

        MockAsyncContext asyncContext = (MockAsyncContext) request.getAsyncContext();
        assertEquals(1, asyncContext.getListeners().size());

        response.setStatus(404);
        assertDoesNotThrow(asyncContext::complete);
        assertFalse(request.isAsyncStarted());
    }
}
