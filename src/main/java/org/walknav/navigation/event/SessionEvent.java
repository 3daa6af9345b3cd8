package org.walknav.navigation.event;

import java.time.Instant;

/**
 * Outbound notification of a guidance session, published through {@link SessionEventBus}.
 */
public interface SessionEvent {

    /** When the event was produced. */
    Instant timestamp();

    /** Event type identifier for logs. */
    String eventType();
}
