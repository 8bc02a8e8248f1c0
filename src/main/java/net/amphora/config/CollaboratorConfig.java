package net.amphora.config;

import net.amphora.adapters.persistence.InMemoryContentStore;
import net.amphora.adapters.references.StoreComponentReferences;
import net.amphora.adapters.render.SimpleComponentRenderer;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ComponentRenderer;
import net.amphora.service.ContentStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import tools.jackson.databind.ObjectMapper;

/**
 * Default storage, reference and rendering collaborators. Each backs off when
 * the application defines its own bean of the same type.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(ContentStore.class)
    public ContentStore contentStore(ObjectMapper objectMapper, AmphoraProperties properties) {
        return new InMemoryContentStore(objectMapper, properties.getStore().isStreamListings());
    }

    @Bean
    @ConditionalOnMissingBean(ComponentReferences.class)
    public ComponentReferences componentReferences(ContentStore contentStore,
                                                   ObjectMapper objectMapper,
                                                   ResourceLoader resourceLoader) {
        return new StoreComponentReferences(contentStore, objectMapper, resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean(ComponentRenderer.class)
    public ComponentRenderer componentRenderer(ComponentReferences componentReferences, ObjectMapper objectMapper) {
        return new SimpleComponentRenderer(componentReferences, objectMapper);
    }
}
