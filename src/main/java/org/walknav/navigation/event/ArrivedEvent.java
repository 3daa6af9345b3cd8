package org.walknav.navigation.event;

import org.walknav.routing.geo.Coordinate;

import java.time.Instant;

/**
 * Terminal event of a session that reached its destination.
 */
public record ArrivedEvent(Instant timestamp, Coordinate destination) implements SessionEvent {

    @Override
    public String eventType() {
        return "ARRIVED";
    }
}
