package org.walknav.navigation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GuidanceThresholds Tests")
class GuidanceThresholdsTest {
    private final GuidanceThresholds thresholds = new GuidanceThresholds(GuidanceConfig.defaults());

    @Test
    @DisplayName("Proximity lock needs a near fix with usable accuracy")
    void testProximityLock() {
        assertTrue(thresholds.locksProximity(75.0, 10.0));
        assertFalse(thresholds.locksProximity(75.01, 10.0));
        assertTrue(thresholds.locksProximity(10.0, 100.0));
        assertFalse(thresholds.locksProximity(10.0, 100.5));
    }

    @Test
    @DisplayName("Off-route threshold widens for low-accuracy fixes")
    void testOffRouteThreshold() {
        assertEquals(35.0, thresholds.offRouteThreshold(50.0));
        assertEquals(50.0, thresholds.offRouteThreshold(50.1));

        assertFalse(thresholds.isOffRoute(35.0, 10.0));
        assertTrue(thresholds.isOffRoute(35.1, 10.0));
        assertFalse(thresholds.isOffRoute(45.0, 60.0));
        assertTrue(thresholds.isOffRoute(50.1, 60.0));
    }

    @Test
    @DisplayName("Advance band, advance and arrival boundaries")
    void testProgressBoundaries() {
        assertFalse(thresholds.inAdvanceWarningBand(60.1));
        assertTrue(thresholds.inAdvanceWarningBand(60.0));
        assertTrue(thresholds.inAdvanceWarningBand(35.1));
        assertFalse(thresholds.inAdvanceWarningBand(35.0));

        assertTrue(thresholds.shouldAdvance(24.9));
        assertFalse(thresholds.shouldAdvance(25.0));

        assertTrue(thresholds.hasArrived(14.9));
        assertFalse(thresholds.hasArrived(15.0));
    }

    @Test
    @DisplayName("Config rejects an inverted advance band")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> GuidanceConfig.builder().advanceWarningOuterMeters(30.0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> GuidanceConfig.builder().instructionAdvanceMeters(40.0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> new GuidanceThresholds(GuidanceConfig.builder().arrivalMeters(0.0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> GuidanceConfig.builder().arrivalGrace(Duration.ofSeconds(-1)).build().validate());

        GuidanceConfig tuned = GuidanceConfig.builder().advanceWarningOuterMeters(80.0).build().validate();
        assertTrue(new GuidanceThresholds(tuned).inAdvanceWarningBand(75.0));
    }
}
