package org.walknav.navigation.voice;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Announcement pacing.
 */
@Value
@Builder
public class AnnouncementConfig {
    /** Identical unforced text within this window is dropped. */
    @Builder.Default
    Duration dedupCooldown = Duration.ofSeconds(3);

    /** Retries of a failed utterance before it is skipped. */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    boolean enabledInitially = true;

    public static AnnouncementConfig defaults() {
        return AnnouncementConfig.builder().build();
    }

    public AnnouncementConfig validate() {
        if (dedupCooldown == null || dedupCooldown.isNegative()) {
            throw new IllegalArgumentException("dedupCooldown must be non-null and non-negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        return this;
    }
}
