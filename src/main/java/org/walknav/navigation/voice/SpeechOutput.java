package org.walknav.navigation.voice;

/**
 * Port to a text-to-speech engine. Only one utterance is audible at a time.
 */
public interface SpeechOutput {
    /**
     * Starts speaking {@code text} asynchronously and reports completion to {@code callback}.
     */
    void speak(String text, SpeechCallback callback);

    /**
     * Stops the current utterance, if any.
     */
    void cancel();
}
