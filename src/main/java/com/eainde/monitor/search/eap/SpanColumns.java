package com.eainde.monitor.search.eap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Public span search fields and the storage columns behind them.
 */
public final class SpanColumns {

    public static final Map<String, ResolvedColumn> DEFINITIONS = index(List.of(
            ResolvedColumn.builder()
                    .publicAlias("id")
                    .internalName("span_id")
                    .searchType(SearchType.STRING)
                    .validator(Validators::isSpanId)
                    .build(),
            string("organization.id", "organization_id"),
            string("span.action", "action"),
            string("span.description", "name"),
            string("description", "name"),
            // maps to the description so that wildcard searches work on it
            string("message", "name"),
            string("span.domain", "attr_str[domain]"),
            string("span.group", "attr_str[group]"),
            string("span.op", "attr_str[op]"),
            string("span.category", "attr_str[category]"),
            ResolvedColumn.builder()
                    .publicAlias("span.self_time")
                    .internalName("exclusive_time_ms")
                    .searchType(SearchType.DURATION)
                    .build(),
            string("span.status", "attr_str[status]"),
            ResolvedColumn.builder()
                    .publicAlias("trace")
                    .internalName("trace_id")
                    .searchType(SearchType.STRING)
                    .validator(Validators::isEventId)
                    .build(),
            string("messaging.destination.name", "attr_str[messaging.destination.name]"),
            string("messaging.message.id", "attr_str[messaging.message.id]"),
            string("span.status_code", "attr_str[status_code]"),
            string("replay.id", "attr_str[replay_id]"),
            string("span.ai.pipeline.group", "attr_str[ai_pipeline_group]"),
            string("trace.status", "attr_str[trace.status]"),
            string("browser.name", "attr_str[browser.name]"),
            number("ai.total_cost", "attr_num[ai.total_cost]"),
            number("ai.total_tokens.used", "attr_num[ai_total_tokens_used]"),
            projectId("project"),
            projectId("project.slug")
    ));

    private SpanColumns() {
    }

    public static Optional<ResolvedColumn> find(String publicAlias) {
        return Optional.ofNullable(DEFINITIONS.get(publicAlias));
    }

    /**
     * @throws InvalidSearchQueryException when no span column has this alias
     */
    public static ResolvedColumn resolve(String publicAlias) {
        return find(publicAlias)
                .orElseThrow(() -> new InvalidSearchQueryException("Could not parse " + publicAlias));
    }

    private static ResolvedColumn string(String publicAlias, String internalName) {
        return ResolvedColumn.builder()
                .publicAlias(publicAlias)
                .internalName(internalName)
                .searchType(SearchType.STRING)
                .build();
    }

    private static ResolvedColumn number(String publicAlias, String internalName) {
        return ResolvedColumn.builder()
                .publicAlias(publicAlias)
                .internalName(internalName)
                .searchType(SearchType.NUMBER)
                .build();
    }

    private static ResolvedColumn projectId(String publicAlias) {
        return ResolvedColumn.builder()
                .publicAlias(publicAlias)
                .internalName("project_id")
                .searchType(SearchType.STRING)
                .internalType(AttributeType.INT)
                .build();
    }

    private static Map<String, ResolvedColumn> index(List<ResolvedColumn> columns) {
        Map<String, ResolvedColumn> byAlias = new LinkedHashMap<>();
        for (ResolvedColumn column : columns) {
            if (byAlias.put(column.publicAlias(), column) != null) {
                throw new IllegalStateException("Duplicate span column " + column.publicAlias());
            }
        }
        return Collections.unmodifiableMap(byAlias);
    }
}
