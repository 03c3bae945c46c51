package com.eainde.monitor.event;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local event store, used when no real event store is wired in.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final Map<String, Event> events = new ConcurrentHashMap<>();

    public void save(Event event) {
        events.put(key(event.projectId(), event.eventId()), event);
        log.debug("Stored event {} for project {}", event.eventId(), event.projectId());
    }

    @Override
    public Optional<Event> getEventById(long projectId, String eventId) {
        if (eventId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(events.get(key(projectId, eventId)));
    }

    private static String key(long projectId, String eventId) {
        return projectId + ":" + eventId.replace("-", "").toLowerCase(Locale.ROOT);
    }
}
