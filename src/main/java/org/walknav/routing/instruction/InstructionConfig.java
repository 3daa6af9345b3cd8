package org.walknav.routing.instruction;

import lombok.Builder;
import lombok.Value;

/**
 * Turn-angle class boundaries (absolute degrees) and short-segment absorption length.
 */
@Value
@Builder
public class InstructionConfig {
    /** Turns strictly below this are "continue". */
    @Builder.Default
    double continueBelowDegrees = 45.0d;

    /** Turns in {@code [continue, slight)} are "slight". */
    @Builder.Default
    double slightBelowDegrees = 80.0d;

    /** Turns in {@code [slight, turn)} are plain turns. */
    @Builder.Default
    double turnBelowDegrees = 135.0d;

    /** Turns in {@code [turn, sharpUpTo]} are sharp; anything wider is a U-turn. */
    @Builder.Default
    double sharpUpToDegrees = 170.0d;

    /** Edges shorter than this are absorbed into their neighbours. */
    @Builder.Default
    double minSegmentMeters = 2.0d;

    public static InstructionConfig defaults() {
        return InstructionConfig.builder().build();
    }

    /**
     * Validates boundary ordering.
     *
     * @return this config.
     */
    public InstructionConfig validate() {
        if (!(continueBelowDegrees > 0.0d
                && continueBelowDegrees <= slightBelowDegrees
                && slightBelowDegrees <= turnBelowDegrees
                && turnBelowDegrees <= sharpUpToDegrees
                && sharpUpToDegrees <= 180.0d)) {
            throw new IllegalArgumentException(
                    "turn boundaries must satisfy 0 < continue <= slight <= turn <= sharp <= 180");
        }
        if (!(minSegmentMeters >= 0.0d) || !Double.isFinite(minSegmentMeters)) {
            throw new IllegalArgumentException("minSegmentMeters must be finite and >= 0");
        }
        return this;
    }
}
