package net.amphora.config;

import jakarta.servlet.DispatcherType;
import net.amphora.domain.site.SiteRegistry;
import net.amphora.routing.HostRouterBuilder;
import net.amphora.routing.HostRouting;
import net.amphora.routing.SiteContextFilter;
import net.amphora.routing.SiteExtension;
import net.amphora.routing.SiteRouteRegistry;
import net.amphora.service.ComponentRenderer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires the site registry into host routing, the site context filter and the
 * per-site custom routes. All of it is built once, at startup.
 */
@Configuration
public class RoutingConfig {

    private static final int SITE_CONTEXT_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    @Bean
    @ConditionalOnMissingBean(SiteRegistry.class)
    public SiteRegistry siteRegistry(AmphoraProperties properties) {
        return properties.toRegistry();
    }

    @Bean
    public HostRouting hostRouting(SiteRegistry siteRegistry) {
        return new HostRouterBuilder().build(siteRegistry);
    }

    @Bean
    public SiteRouteRegistry siteRouteRegistry(HostRouting hostRouting,
                                               ObjectProvider<SiteExtension> siteExtensions,
                                               ComponentRenderer componentRenderer) {
        return SiteRouteRegistry.build(hostRouting, siteExtensions.orderedStream().toList(), componentRenderer);
    }

    @Bean
    public FilterRegistrationBean<SiteContextFilter> siteContextFilterRegistration(HostRouting hostRouting) {
        FilterRegistrationBean<SiteContextFilter> registration =
            new FilterRegistrationBean<>(new SiteContextFilter(hostRouting));
        registration.setDispatcherTypes(DispatcherType.REQUEST, DispatcherType.ASYNC);
        registration.setOrder(SITE_CONTEXT_FILTER_ORDER);
        return registration;
    }
}
