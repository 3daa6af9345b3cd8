package org.walknav.routing.instruction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TurnClassifier Tests")
class TurnClassifierTest {
    private final TurnClassifier classifier = new TurnClassifier();

    @Test
    @DisplayName("Class boundaries are lower-inclusive")
    void testBoundaries() {
        assertEquals(TurnClassification.CONTINUE, classifier.classify(0.0));
        assertEquals(TurnClassification.CONTINUE, classifier.classify(44.99));
        assertEquals(TurnClassification.SLIGHT_RIGHT, classifier.classify(45.0));
        assertEquals(TurnClassification.SLIGHT_RIGHT, classifier.classify(79.99));
        assertEquals(TurnClassification.RIGHT, classifier.classify(80.0));
        assertEquals(TurnClassification.RIGHT, classifier.classify(134.99));
        assertEquals(TurnClassification.SHARP_RIGHT, classifier.classify(135.0));
        assertEquals(TurnClassification.SHARP_RIGHT, classifier.classify(170.0));
        assertEquals(TurnClassification.U_TURN, classifier.classify(170.01));
        assertEquals(TurnClassification.U_TURN, classifier.classify(180.0));
    }

    @Test
    @DisplayName("Negative angles are left turns")
    void testLeftSide() {
        assertEquals(TurnClassification.CONTINUE, classifier.classify(-30.0));
        assertEquals(TurnClassification.SLIGHT_LEFT, classifier.classify(-60.0));
        assertEquals(TurnClassification.LEFT, classifier.classify(-90.0));
        assertEquals(TurnClassification.SHARP_LEFT, classifier.classify(-150.0));
        assertEquals(TurnClassification.U_TURN, classifier.classify(-175.0));
    }

    @Test
    @DisplayName("Phrases read as spoken instructions")
    void testPhrases() {
        assertEquals("turn left", TurnClassification.LEFT.phrase());
        assertEquals("turn slightly right", TurnClassification.SLIGHT_RIGHT.phrase());
        assertEquals("turn sharp left", TurnClassification.SHARP_LEFT.phrase());
        assertEquals("make a U-turn", TurnClassification.U_TURN.phrase());
        assertEquals("continue", TurnClassification.CONTINUE.phrase());
    }

    @Test
    @DisplayName("Custom boundaries are honoured and validated")
    void testCustomConfig() {
        TurnClassifier tight = new TurnClassifier(InstructionConfig.builder().continueBelowDegrees(20.0).build());
        assertEquals(TurnClassification.SLIGHT_LEFT, tight.classify(-30.0));

        assertThrows(IllegalArgumentException.class, () -> new TurnClassifier(
                InstructionConfig.builder().slightBelowDegrees(150.0).build()));
        assertThrows(IllegalArgumentException.class, () -> new TurnClassifier(
                InstructionConfig.builder().minSegmentMeters(-1.0).build()));
    }
}
