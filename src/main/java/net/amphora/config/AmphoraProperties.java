package net.amphora.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.amphora.domain.site.ConfiguredSiteRegistry;
import net.amphora.domain.site.Site;
import net.amphora.domain.site.SiteRegistry;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for sites, host aliases and the default store.
 *
 * <p>Host names containing dots must be quoted with brackets in YAML map keys,
 * e.g. {@code "[news.example.com]": news.localhost}.
 */
@Component
@ConfigurationProperties(prefix = "amphora")
public class AmphoraProperties {

    /**
     * Configured sites, in declaration order.
     */
    private List<SiteProperties> sites = new ArrayList<>();

    /**
     * Canonical host name to the host name used in this environment.
     */
    private Map<String, String> hosts = new LinkedHashMap<>();

    private Store store = new Store();

    @PostConstruct
    void validate() {
        Set<String> slugs = new HashSet<>();
        for (SiteProperties site : sites) {
            Assert.isTrue(StringUtils.hasText(site.getSlug()), "amphora.sites[].slug must not be blank");
            Assert.isTrue(StringUtils.hasText(site.getHost()),
                "amphora.sites[].host must not be blank for site " + site.getSlug());
            Assert.isTrue(slugs.add(site.getSlug()), "amphora.sites[].slug must be unique: " + site.getSlug());
        }
    }

    /**
     * Snapshot of the configuration as an immutable registry.
     */
    public SiteRegistry toRegistry() {
        List<Site> configured = new ArrayList<>(sites.size());
        for (SiteProperties site : sites) {
            configured.add(new Site(site.getSlug(), site.getHost(), site.getPath()));
        }
        return new ConfiguredSiteRegistry(configured, hosts);
    }

    public List<SiteProperties> getSites() {
        return sites;
    }

    public void setSites(List<SiteProperties> sites) {
        this.sites = sites;
    }

    public Map<String, String> getHosts() {
        return hosts;
    }

    public void setHosts(Map<String, String> hosts) {
        this.hosts = hosts;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public static class SiteProperties {

        private String slug;
        private String host;

        /**
         * Mount path on the host; defaults to the host root.
         */
        private String path = "/";

        public String getSlug() {
            return slug;
        }

        public void setSlug(String slug) {
            this.slug = slug;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Store {

        /**
         * Whether the in-memory store hands out listings as a byte stream.
         */
        private boolean streamListings = false;

        public boolean isStreamListings() {
            return streamListings;
        }

        public void setStreamListings(boolean streamListings) {
            this.streamListings = streamListings;
        }
    }
}
