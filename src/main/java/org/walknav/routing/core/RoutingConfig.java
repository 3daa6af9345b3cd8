package org.walknav.routing.core;

import lombok.Builder;
import lombok.Value;
import org.walknav.routing.instruction.InstructionConfig;
import org.walknav.routing.spatial.SnapConfig;

/**
 * Startup configuration bound once when a {@link RoutingEngine} is created.
 */
@Value
@Builder
public class RoutingConfig {
    public static final double DEFAULT_WALKING_SPEED_MPS = 1.4d;

    /** Assumed walking speed used for time estimates. */
    @Builder.Default
    double walkingSpeedMetersPerSecond = DEFAULT_WALKING_SPEED_MPS;

    @Builder.Default
    SnapConfig snapConfig = SnapConfig.defaults();

    @Builder.Default
    InstructionConfig instructionConfig = InstructionConfig.defaults();

    public static RoutingConfig defaults() {
        return RoutingConfig.builder().build();
    }

    /**
     * Validates this config and the nested ones.
     *
     * @return this config.
     */
    public RoutingConfig validate() {
        if (!(walkingSpeedMetersPerSecond > 0.0d) || !Double.isFinite(walkingSpeedMetersPerSecond)) {
            throw new IllegalArgumentException("walkingSpeedMetersPerSecond must be positive and finite");
        }
        if (snapConfig == null || instructionConfig == null) {
            throw new IllegalArgumentException("snapConfig and instructionConfig must be non-null");
        }
        snapConfig.validate();
        instructionConfig.validate();
        return this;
    }
}
