package com.eainde.monitor.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A stored error event.
 *
 * @param projectId   owning project
 * @param eventId     32 character hex id
 * @param primaryHash grouping hash shared by every event of the same issue
 * @param data        raw event payload
 */
public record Event(long projectId, String eventId, String primaryHash, JsonNode data) {

    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(primaryHash, "primaryHash");
        Objects.requireNonNull(data, "data");
    }
}
