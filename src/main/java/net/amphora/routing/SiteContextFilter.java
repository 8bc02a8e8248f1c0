package net.amphora.routing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.amphora.domain.site.Site;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the site owning each request and records its {@link SiteContext}
 * before any handler runs. Never short-circuits the chain; requests on hosts
 * without a routing table are only marked, and rejected by
 * {@code RoutedHostInterceptor} before dispatch.
 */
@Slf4j
public class SiteContextFilter extends OncePerRequestFilter {

    private final HostRouting hostRouting;

    public SiteContextFilter(HostRouting hostRouting) {
        this.hostRouting = hostRouting;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Optional<HostRoutingTable> table = hostRouting.table(request.getServerName());
        if (table.isEmpty()) {
            request.setAttribute(SiteContext.UNROUTED_HOST_ATTRIBUTE, Boolean.TRUE);
        }
        Optional<Site> site = table.flatMap(routes -> routes.resolve(request.getRequestURI()));
        String url = SiteContext.reconstructUrl(request);
        boolean editMode = SiteContext.isEditMode(request);

        if (site.isPresent()) {
            request.setAttribute(SiteContext.SITE_ATTRIBUTE, site.get());
            request.setAttribute(SiteContext.ATTRIBUTE, new SiteContext(url, site.get().slug(), editMode));
        } else {
            log.debug("No site mounts {} on host {}", request.getRequestURI(), request.getServerName());
            request.setAttribute(SiteContext.ATTRIBUTE, new SiteContext(url, null, editMode));
        }
        chain.doFilter(request, response);
    }
}
