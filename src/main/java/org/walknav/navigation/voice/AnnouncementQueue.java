package org.walknav.navigation.voice;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Serializes announcements onto a {@link SpeechOutput} so that one utterance is audible at a
 * time.
 *
 * <p>Priority announcements flush the queue, stop the current utterance and speak at once;
 * others wait in FIFO order. Identical unforced text within the dedup cooldown is dropped.
 * Every started utterance gets a new generation number and completions carrying an older
 * generation are ignored, so a late callback from cancelled speech can never advance the
 * queue.</p>
 *
 * <p>Thread-safe; callbacks may arrive on any thread, including synchronously from
 * {@link SpeechOutput#speak}.</p>
 */
@Slf4j
public final class AnnouncementQueue {
    private final SpeechOutput output;
    private final AnnouncementConfig config;
    private final Clock clock;

    private final Deque<Utterance> pending = new ArrayDeque<>();
    private Utterance speaking;
    private long generation;
    private boolean enabled;
    private String lastText;
    private Instant lastTextAt;

    public AnnouncementQueue(SpeechOutput output) {
        this(output, AnnouncementConfig.defaults(), Clock.systemUTC());
    }

    public AnnouncementQueue(SpeechOutput output, AnnouncementConfig config, Clock clock) {
        this.output = Objects.requireNonNull(output, "output");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.enabled = config.isEnabledInitially();
    }

    /**
     * Submits one announcement.
     *
     * @param text utterance.
     * @param priority interrupt and flush current speech.
     * @param force bypass duplicate suppression.
     * @return whether the announcement was accepted.
     */
    public synchronized boolean speak(String text, boolean priority, boolean force) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (!enabled) {
            log.debug("Voice disabled, dropping '{}'", text);
            return false;
        }
        Instant now = clock.instant();
        if (!force && text.equals(lastText) && lastTextAt != null
                && Duration.between(lastTextAt, now).compareTo(config.getDedupCooldown()) < 0) {
            log.debug("Suppressing duplicate announcement '{}'", text);
            return false;
        }
        lastText = text;
        lastTextAt = now;

        Utterance utterance = new Utterance(text, 0);
        if (priority) {
            pending.clear();
            if (speaking != null) {
                stopCurrentLocked();
            }
            startLocked(utterance);
        } else if (speaking == null) {
            startLocked(utterance);
        } else {
            pending.addLast(utterance);
        }
        return true;
    }

    /**
     * Flushes queued announcements and stops the current one.
     */
    public synchronized void cancelAll() {
        int dropped = pending.size();
        pending.clear();
        if (speaking != null) {
            stopCurrentLocked();
            dropped++;
        }
        if (dropped > 0) {
            log.debug("Cancelled {} announcement(s)", dropped);
        }
    }

    /**
     * Mutes or unmutes the queue. Muting also flushes it.
     */
    public synchronized void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            cancelAll();
        }
        log.info("Voice guidance {}", enabled ? "enabled" : "disabled");
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized boolean isSpeaking() {
        return speaking != null;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void stopCurrentLocked() {
        speaking = null;
        generation++;
        output.cancel();
    }

    private void startLocked(Utterance utterance) {
        long started = ++generation;
        speaking = utterance;
        try {
            output.speak(utterance.text(), new Callback(started));
        } catch (RuntimeException ex) {
            failed(started, String.valueOf(ex.getMessage()));
        }
    }

    private void startNextLocked() {
        Utterance next = pending.pollFirst();
        if (next != null) {
            startLocked(next);
        }
    }

    private synchronized void finished(long utteranceGeneration) {
        if (utteranceGeneration != generation || speaking == null) {
            return;
        }
        speaking = null;
        startNextLocked();
    }

    private synchronized void failed(long utteranceGeneration, String reason) {
        if (utteranceGeneration != generation || speaking == null) {
            return;
        }
        Utterance current = speaking;
        speaking = null;
        if (current.retries() < config.getMaxRetries()) {
            log.warn("Speech failed ({}), retry {}/{}: '{}'",
                    reason, current.retries() + 1, config.getMaxRetries(), current.text());
            startLocked(new Utterance(current.text(), current.retries() + 1));
            return;
        }
        log.warn("Speech failed ({}) after {} retries, skipping '{}'", reason, current.retries(), current.text());
        startNextLocked();
    }

    private record Utterance(String text, int retries) {
    }

    private final class Callback implements SpeechCallback {
        private final long utteranceGeneration;

        private Callback(long utteranceGeneration) {
            this.utteranceGeneration = utteranceGeneration;
        }

        @Override
        public void onFinished() {
            finished(utteranceGeneration);
        }

        @Override
        public void onFailed(String reason) {
            failed(utteranceGeneration, reason);
        }
    }
}
