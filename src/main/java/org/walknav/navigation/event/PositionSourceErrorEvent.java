package org.walknav.navigation.event;

import org.walknav.navigation.PositionErrorKind;

import java.time.Instant;

/**
 * Position-source failure surfaced to the user. Guidance keeps running.
 */
public record PositionSourceErrorEvent(Instant timestamp, PositionErrorKind kind, String message)
        implements SessionEvent {

    @Override
    public String eventType() {
        return "POSITION_SOURCE_ERROR";
    }
}
