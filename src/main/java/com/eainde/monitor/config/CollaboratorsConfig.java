package com.eainde.monitor.config;

import com.eainde.monitor.event.EventStore;
import com.eainde.monitor.event.InMemoryEventStore;
import com.eainde.monitor.feature.FeatureFlags;
import com.eainde.monitor.feature.FeatureProperties;
import com.eainde.monitor.feature.PropertyFeatureFlags;
import com.eainde.monitor.project.InMemoryProjectDirectory;
import com.eainde.monitor.project.ProjectDirectory;
import com.eainde.monitor.project.ProjectProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process fallbacks for the event store, project directory and feature flags.
 * A deployment replaces each of them by declaring its own bean.
 */
@Configuration
public class CollaboratorsConfig {

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public InMemoryEventStore inMemoryEventStore() {
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnMissingBean(ProjectDirectory.class)
    public InMemoryProjectDirectory inMemoryProjectDirectory(ProjectProperties properties) {
        return new InMemoryProjectDirectory(properties.getProjects().stream()
                .map(ProjectProperties.Entry::toProject)
                .toList());
    }

    @Bean
    @ConditionalOnMissingBean(FeatureFlags.class)
    public FeatureFlags propertyFeatureFlags(FeatureProperties properties) {
        return new PropertyFeatureFlags(properties);
    }
}
