package org.walknav.navigation;

import java.util.Objects;

/**
 * Threshold decisions of live guidance as pure functions of config, distance and accuracy.
 */
public final class GuidanceThresholds {
    private final GuidanceConfig config;

    public GuidanceThresholds(GuidanceConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    public boolean isUsableAccuracy(double accuracyMeters) {
        return accuracyMeters <= config.getMaxUsableAccuracyMeters();
    }

    /**
     * Whether a fix arms off-route detection for the rest of the session.
     */
    public boolean locksProximity(double minDistanceToRoute, double accuracyMeters) {
        return minDistanceToRoute <= config.getProximityLockMeters() && isUsableAccuracy(accuracyMeters);
    }

    public double offRouteThreshold(double accuracyMeters) {
        return accuracyMeters > config.getLowAccuracyAboveMeters()
                ? config.getOffRouteThresholdLowAccuracyMeters()
                : config.getOffRouteThresholdMeters();
    }

    public boolean isOffRoute(double minDistanceToRoute, double accuracyMeters) {
        return minDistanceToRoute > offRouteThreshold(accuracyMeters);
    }

    /**
     * Advance warning band {@code (inner, outer]}.
     */
    public boolean inAdvanceWarningBand(double distanceToNextAnchor) {
        return distanceToNextAnchor > config.getAdvanceWarningInnerMeters()
                && distanceToNextAnchor <= config.getAdvanceWarningOuterMeters();
    }

    public boolean shouldAdvance(double distanceToNextAnchor) {
        return distanceToNextAnchor < config.getInstructionAdvanceMeters();
    }

    public boolean hasArrived(double distanceToDestination) {
        return distanceToDestination < config.getArrivalMeters();
    }

    public GuidanceConfig config() {
        return config;
    }
}
