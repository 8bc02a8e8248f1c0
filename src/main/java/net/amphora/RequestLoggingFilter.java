/**
 * Request logging and timing filter for HTTP requests
 *
 * Features:
 * - Logs incoming HTTP requests with method, URI, host and source IP
 * - Measures and logs request processing duration
 * - Records HTTP response status codes, for async requests once they complete
 * - Skips static asset requests to reduce log noise
 */
package net.amphora;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    // Extensions that select a resource representation and are always logged
    private static final Set<String> LOGGED_EXTENSIONS = Set.of("html", "json", "yaml");

    /**
     * Logs the request before and after it passes through the chain.
     * Static assets (any other extension) pass through unlogged.
     *
     * @param request The incoming servlet request
     * @param response The servlet response
     * @param chain The filter processing chain
     * @throws IOException If an I/O error occurs during request processing
     * @throws ServletException If a servlet error occurs during processing
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        String ext = extension(uri);
        if (!ext.isEmpty() && !LOGGED_EXTENSIONS.contains(ext)) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} on {} from {}", req.getMethod(), uri, req.getServerName(), req.getRemoteAddr());
        chain.doFilter(request, response);
        long duration = System.currentTimeMillis() - startTime;
        int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
        if (req.isAsyncStarted()) {
            logger.debug("Dispatched async request: {} {} after {} ms", req.getMethod(), uri, duration);
            req.getAsyncContext().addListener(new CompletionListener(req.getMethod(), uri, startTime));
        } else {
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }

    /**
     * Logs the final status of a request whose response is written after an
     * async dispatch, once the container completes it.
     */
    private static final class CompletionListener implements AsyncListener {
        private final String method;
        private final String uri;
        private final long startTime;

        CompletionListener(String method, String uri, long startTime) {
            this.method = method;
            this.uri = uri;
            this.startTime = startTime;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            long duration = System.currentTimeMillis() - startTime;
            logger.info("Completed request: {} {} with status {} in {} ms", method, uri, status(event), duration);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            logger.warn("Timed out request: {} {} after {} ms", method, uri, System.currentTimeMillis() - startTime);
        }

        @Override
        public void onError(AsyncEvent event) {
            logger.error("Failed request: {} {} after {} ms", method, uri, System.currentTimeMillis() - startTime,
                event.getThrowable());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }

        private static int status(AsyncEvent event) {
            ServletResponse response = event.getSuppliedResponse();
            return response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
        }
    }

    static String extension(String uri) {
        int segmentStart = uri.lastIndexOf('/') + 1;
        int dotIdx = uri.lastIndexOf('.');
        if (dotIdx >= segmentStart && dotIdx < uri.length() - 1) {
            return uri.substring(dotIdx + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
