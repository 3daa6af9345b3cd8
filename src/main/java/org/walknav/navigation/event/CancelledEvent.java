package org.walknav.navigation.event;

import java.time.Instant;

/**
 * Terminal event of a session stopped before arrival.
 */
public record CancelledEvent(Instant timestamp) implements SessionEvent {

    @Override
    public String eventType() {
        return "CANCELLED";
    }
}
