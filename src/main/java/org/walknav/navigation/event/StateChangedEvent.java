package org.walknav.navigation.event;

import org.walknav.navigation.NavigationState;

import java.time.Instant;

/**
 * Snapshot published after every processed position update and on lifecycle transitions.
 */
public record StateChangedEvent(
        Instant timestamp,
        NavigationState state,
        int currentInstructionIndex,
        double distanceTraveledMeters,
        boolean offRoute
) implements SessionEvent {

    @Override
    public String eventType() {
        return "STATE_CHANGED";
    }
}
