package org.walknav.navigation;

/**
 * Position-source failure categories with their default user message.
 */
public enum PositionErrorKind {
    PERMISSION_DENIED("Location access was denied. Please enable location permissions to navigate."),
    POSITION_UNAVAILABLE("Your location is currently unavailable. Trying again."),
    TIMEOUT("Getting your location took too long. Trying again."),
    SIGNAL_LOST("GPS signal lost. Guidance will resume when the signal returns.");

    private final String userMessage;

    PositionErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
