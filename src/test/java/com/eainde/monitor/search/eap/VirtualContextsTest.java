package com.eainde.monitor.search.eap;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VirtualContextsTest {

    private final SearchParams params = new SearchParams(Map.of(1L, "backend", 2L, "frontend"));

    @Test
    void project_shouldMapProjectIdsToSlugs() {
        VirtualColumnContext context = VirtualContexts.forColumn("project", params).orElseThrow();

        assertThat(context.fromColumnName()).isEqualTo("project_id");
        assertThat(context.toColumnName()).isEqualTo("project");
        assertThat(context.valueMap()).containsOnly(Map.entry("1", "backend"), Map.entry("2", "frontend"));
    }

    @Test
    void projectSlug_shouldTargetItsOwnColumn() {
        VirtualColumnContext context = VirtualContexts.forColumn("project.slug", params).orElseThrow();

        assertThat(context.toColumnName()).isEqualTo("project.slug");
        assertThat(context.valueMap()).hasSize(2);
    }

    @Test
    void forColumn_shouldBeEmpty_forStoredColumns() {
        assertThat(VirtualContexts.forColumn("span.op", params)).isEmpty();
    }

    @Test
    void everyVirtualContext_shouldHaveASpanColumn() {
        assertThat(SpanColumns.DEFINITIONS.keySet()).containsAll(VirtualContexts.CONSTRUCTORS.keySet());
    }

    @Test
    void project_shouldSkipProjectsWithoutSlug() {
        Map<Long, String> projectIdMap = new HashMap<>();
        projectIdMap.put(1L, "backend");
        projectIdMap.put(3L, null);

        VirtualColumnContext context = VirtualContexts.forColumn("project", new SearchParams(projectIdMap)).orElseThrow();

        assertThat(context.valueMap()).containsOnly(Map.entry("1", "backend"));
    }
}
