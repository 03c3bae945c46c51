package com.eainde.monitor.event;

import java.util.Optional;

public interface EventStore {

    Optional<Event> getEventById(long projectId, String eventId);
}
