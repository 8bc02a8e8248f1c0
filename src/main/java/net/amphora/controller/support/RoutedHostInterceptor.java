package net.amphora.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import net.amphora.exception.ContentNotFoundException;
import net.amphora.routing.SiteContext;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Keeps every handler behind the host routing: a request on a host with no
 * routing table never reaches a controller and is answered as not found.
 */
public class RoutedHostInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (SiteContext.isUnroutedHost(request)) {
            throw new ContentNotFoundException(ResourcePaths.requestPath(request),
                "No site is served on host " + request.getServerName());
        }
        return true;
    }
}
