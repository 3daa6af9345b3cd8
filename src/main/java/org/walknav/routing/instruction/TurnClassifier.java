package org.walknav.routing.instruction;

import java.util.Objects;

/**
 * Maps a signed turn angle onto a {@link TurnClassification}.
 */
public final class TurnClassifier {
    private final InstructionConfig config;

    public TurnClassifier() {
        this(InstructionConfig.defaults());
    }

    public TurnClassifier(InstructionConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * @param turnAngle signed angle in {@code (-180, 180]}, positive to the right.
     */
    public TurnClassification classify(double turnAngle) {
        double magnitude = Math.abs(turnAngle);
        boolean right = turnAngle > 0.0d;
        if (magnitude < config.getContinueBelowDegrees()) {
            return TurnClassification.CONTINUE;
        }
        if (magnitude < config.getSlightBelowDegrees()) {
            return right ? TurnClassification.SLIGHT_RIGHT : TurnClassification.SLIGHT_LEFT;
        }
        if (magnitude < config.getTurnBelowDegrees()) {
            return right ? TurnClassification.RIGHT : TurnClassification.LEFT;
        }
        if (magnitude <= config.getSharpUpToDegrees()) {
            return right ? TurnClassification.SHARP_RIGHT : TurnClassification.SHARP_LEFT;
        }
        return TurnClassification.U_TURN;
    }
}
