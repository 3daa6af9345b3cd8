package org.walknav.navigation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DistanceFormatter Tests")
class DistanceFormatterTest {

    @Test
    @DisplayName("Meters below one kilometer, one decimal above")
    void testSpoken() {
        assertEquals("0 meters", DistanceFormatter.spoken(0.2));
        assertEquals("50 meters", DistanceFormatter.spoken(49.6));
        assertEquals("999 meters", DistanceFormatter.spoken(999.4));
        assertEquals("1.0 kilometers", DistanceFormatter.spoken(1000.0));
        assertEquals("1.3 kilometers", DistanceFormatter.spoken(1262.0));
    }
}
