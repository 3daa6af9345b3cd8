package org.walknav.navigation;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Spoken distance phrases.
 */
@UtilityClass
public final class DistanceFormatter {

    /**
     * {@code "1.2 kilometers"} from 1000 m up, whole {@code "N meters"} below.
     */
    public static String spoken(double meters) {
        if (meters >= 1000.0d) {
            return String.format(Locale.ROOT, "%.1f kilometers", meters / 1000.0d);
        }
        return Math.round(meters) + " meters";
    }
}
