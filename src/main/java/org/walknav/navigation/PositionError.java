package org.walknav.navigation;

import java.util.Objects;

/**
 * Failure reported by a {@link PositionSource}.
 *
 * @param kind failure category.
 * @param detail source-specific detail, may be {@code null}.
 */
public record PositionError(PositionErrorKind kind, String detail) {
    public PositionError {
        Objects.requireNonNull(kind, "kind");
    }

    public static PositionError of(PositionErrorKind kind) {
        return new PositionError(kind, null);
    }
}
