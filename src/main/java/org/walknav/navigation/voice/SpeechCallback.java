package org.walknav.navigation.voice;

/**
 * Completion notification of one utterance. Exactly one method is called per utterance,
 * unless the utterance was cancelled, in which case a call may or may not follow.
 */
public interface SpeechCallback {
    void onFinished();

    void onFailed(String reason);
}
