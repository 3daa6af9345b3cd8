package org.walknav.navigation;

/**
 * Receives fixes and failures from a {@link PositionSource}. Callbacks may arrive on any thread.
 */
public interface PositionListener {
    void onPosition(PositionUpdate update);

    void onError(PositionError error);
}
