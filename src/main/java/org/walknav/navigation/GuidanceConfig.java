package org.walknav.navigation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Distance and accuracy thresholds of live guidance, in meters unless noted.
 *
 * <p>Values are tuning defaults. The only enforced relationship is
 * {@code advanceWarningOuter > advanceWarningInner >= instructionAdvance}.</p>
 */
@Value
@Builder
public class GuidanceConfig {
    /** Route proximity that arms off-route detection. */
    @Builder.Default
    double proximityLockMeters = 75.0d;

    /** Fixes with a worse accuracy never change off-route state. */
    @Builder.Default
    double maxUsableAccuracyMeters = 100.0d;

    @Builder.Default
    double offRouteThresholdMeters = 35.0d;

    /** Looser off-route threshold used when accuracy exceeds {@link #lowAccuracyAboveMeters}. */
    @Builder.Default
    double offRouteThresholdLowAccuracyMeters = 50.0d;

    @Builder.Default
    double lowAccuracyAboveMeters = 50.0d;

    @Builder.Default
    double advanceWarningOuterMeters = 60.0d;

    @Builder.Default
    double advanceWarningInnerMeters = 35.0d;

    /** Distance to the next anchor below which the instruction index advances. */
    @Builder.Default
    double instructionAdvanceMeters = 25.0d;

    @Builder.Default
    double arrivalMeters = 15.0d;

    /** Delay between the arrival announcement and session teardown. */
    @Builder.Default
    Duration arrivalGrace = Duration.ofSeconds(3);

    public static GuidanceConfig defaults() {
        return GuidanceConfig.builder().build();
    }

    /**
     * Validates the advance-band ordering and basic sanity of every threshold.
     *
     * @return this config.
     */
    public GuidanceConfig validate() {
        if (!(advanceWarningOuterMeters > advanceWarningInnerMeters)) {
            throw new IllegalArgumentException(
                    "advanceWarningOuterMeters must exceed advanceWarningInnerMeters: "
                            + advanceWarningOuterMeters + " <= " + advanceWarningInnerMeters);
        }
        if (!(advanceWarningInnerMeters >= instructionAdvanceMeters)) {
            throw new IllegalArgumentException(
                    "advanceWarningInnerMeters must be >= instructionAdvanceMeters: "
                            + advanceWarningInnerMeters + " < " + instructionAdvanceMeters);
        }
        double[] positives = {
                proximityLockMeters, maxUsableAccuracyMeters, offRouteThresholdMeters,
                offRouteThresholdLowAccuracyMeters, lowAccuracyAboveMeters, instructionAdvanceMeters, arrivalMeters
        };
        for (double value : positives) {
            if (!(value > 0.0d) || !Double.isFinite(value)) {
                throw new IllegalArgumentException("guidance thresholds must be positive and finite");
            }
        }
        if (arrivalGrace == null || arrivalGrace.isNegative()) {
            throw new IllegalArgumentException("arrivalGrace must be non-null and non-negative");
        }
        return this;
    }
}
