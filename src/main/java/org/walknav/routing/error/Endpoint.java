package org.walknav.routing.error;

/**
 * Which side of a route request an endpoint-specific failure concerns.
 */
public enum Endpoint {
    START("start"),
    END("destination");

    private final String label;

    Endpoint(String label) {
        this.label = label;
    }

    /**
     * Lower-case word used in user-facing messages.
     */
    public String label() {
        return label;
    }
}
