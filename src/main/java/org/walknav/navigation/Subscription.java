package org.walknav.navigation;

/**
 * Handle returned by subscribe operations; detaches the subscriber.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
