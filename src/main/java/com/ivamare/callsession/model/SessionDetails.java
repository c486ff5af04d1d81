package com.ivamare.callsession.model;

import java.util.List;

/**
 * A session together with its events in replay order (ascending event time).
 */
public record SessionDetails(CallSession session, List<SessionEvent> events) {

    public SessionDetails {
        events = events != null ? List.copyOf(events) : List.of();
    }
}
