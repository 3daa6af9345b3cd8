package org.walknav.navigation.event;

import java.time.Instant;

/**
 * Request to speak {@code text}.
 *
 * @param timestamp when the announcement was requested.
 * @param text utterance.
 * @param priority interrupt current and queued speech.
 * @param force bypass duplicate suppression.
 */
public record AnnouncementEvent(Instant timestamp, String text, boolean priority, boolean force)
        implements SessionEvent {

    @Override
    public String eventType() {
        return "ANNOUNCEMENT";
    }
}
