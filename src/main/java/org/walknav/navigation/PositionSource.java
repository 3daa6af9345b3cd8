package org.walknav.navigation;

/**
 * Port to a live location provider (GPS, simulator, replay).
 */
public interface PositionSource {
    /**
     * Starts delivering fixes to {@code listener} until the returned subscription is closed.
     */
    Subscription subscribe(PositionListener listener);
}
