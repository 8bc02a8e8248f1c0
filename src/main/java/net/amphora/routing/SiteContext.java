package net.amphora.routing;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import net.amphora.domain.site.Site;

/**
 * Request-scoped state injected ahead of every handler.
 *
 * @param url scheme, host, original path and query of the request
 * @param site slug of the site that owns the request, {@code null} when no site matched
 * @param editMode whether the request asked for edit mode; never part of a storage key
 */
public record SiteContext(String url, String site, boolean editMode) {

    public static final String ATTRIBUTE = SiteContext.class.getName();
    public static final String SITE_ATTRIBUTE = Site.class.getName();
    public static final String UNROUTED_HOST_ATTRIBUTE = SiteContext.class.getName() + ".UNROUTED_HOST";

    /**
     * Context recorded by {@link SiteContextFilter}, or a site-less context rebuilt
     * from the request when the filter did not run.
     */
    public static SiteContext current(HttpServletRequest request) {
        Object attribute = request.getAttribute(ATTRIBUTE);
        if (attribute instanceof SiteContext context) {
            return context;
        }
        return new SiteContext(reconstructUrl(request), null, isEditMode(request));
    }

    /**
     * Site resolved for the request, if any.
     */
    public static Optional<Site> resolvedSite(HttpServletRequest request) {
        Object attribute = request.getAttribute(SITE_ATTRIBUTE);
        return attribute instanceof Site site ? Optional.of(site) : Optional.empty();
    }

    /**
     * Whether the request arrived on a host that no routing table serves.
     */
    public static boolean isUnroutedHost(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(UNROUTED_HOST_ATTRIBUTE));
    }

    static String reconstructUrl(HttpServletRequest request) {
        StringBuilder url = new StringBuilder(request.getRequestURL());
        String query = request.getQueryString();
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query);
        }
        return url.toString();
    }

    /**
     * Any non-empty {@code edit} value turns edit mode on.
     */
    static boolean isEditMode(HttpServletRequest request) {
        String edit = request.getParameter("edit");
        return edit != null && !edit.isEmpty();
    }
}
