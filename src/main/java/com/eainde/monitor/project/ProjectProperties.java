package com.eainde.monitor.project;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Static project list for {@link InMemoryProjectDirectory}, bound from {@code monitor.projects}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "monitor")
public class ProjectProperties {

    private List<Entry> projects = new ArrayList<>();

    @Getter
    @Setter
    public static class Entry {
        private long id;
        private String slug;
        private long organizationId;
        private String organizationSlug;

        public Project toProject() {
            return new Project(id, slug, new Organization(organizationId, organizationSlug));
        }
    }
}
