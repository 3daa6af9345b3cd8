package org.walknav.navigation;

/**
 * Guidance lifecycle: {@code IDLE -> GUIDING <-> OFF_ROUTE -> ARRIVED -> IDLE}.
 */
public enum NavigationState {
    IDLE,
    GUIDING,
    OFF_ROUTE,
    ARRIVED;

    public boolean isActive() {
        return this == GUIDING || this == OFF_ROUTE;
    }
}
