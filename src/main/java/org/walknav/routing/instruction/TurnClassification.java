package org.walknav.routing.instruction;

/**
 * Maneuver category of one instruction.
 */
public enum TurnClassification {
    DEPART("head"),
    CONTINUE("continue"),
    SLIGHT_LEFT("turn slightly left"),
    SLIGHT_RIGHT("turn slightly right"),
    LEFT("turn left"),
    RIGHT("turn right"),
    SHARP_LEFT("turn sharp left"),
    SHARP_RIGHT("turn sharp right"),
    U_TURN("make a U-turn"),
    ARRIVE("arrive");

    private final String phrase;

    TurnClassification(String phrase) {
        this.phrase = phrase;
    }

    /**
     * Spoken verb phrase used in "then &lt;phrase&gt; onto &lt;road&gt;".
     */
    public String phrase() {
        return phrase;
    }
}
