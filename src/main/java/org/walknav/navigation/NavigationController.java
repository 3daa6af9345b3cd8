package org.walknav.navigation;

import lombok.extern.slf4j.Slf4j;
import org.walknav.navigation.event.AnnouncementEvent;
import org.walknav.navigation.event.PositionSourceErrorEvent;
import org.walknav.navigation.event.SessionEvent;
import org.walknav.navigation.event.SessionEventBus;
import org.walknav.navigation.voice.AnnouncementQueue;
import org.walknav.routing.core.Route;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs guidance sessions against a live {@link PositionSource}.
 *
 * <p>Position callbacks are handed to a single-threaded scheduler and processed under one
 * mutex shared with every public operation, so the effects of an update never interleave with
 * another update or with cancellation. Each session gets a generation number; callbacks and
 * timers of an older generation are dropped. Once {@link #clearRoute()} returns, the cleared
 * session produces no further speech or events.</p>
 */
@Slf4j
public final class NavigationController implements AutoCloseable {
    private final PositionSource positionSource;
    private final AnnouncementQueue announcements;
    private final SessionEventBus eventBus;
    private final GuidanceConfig config;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final NavigationStateMachine machine;

    private final Object lock = new Object();
    private long generation;
    private Subscription positionSubscription;
    private ScheduledFuture<?> teardown;
    private boolean closed;

    public NavigationController(PositionSource positionSource, AnnouncementQueue announcements, SessionEventBus eventBus) {
        this(positionSource, announcements, eventBus, GuidanceConfig.defaults(), Clock.systemUTC());
    }

    public NavigationController(
            PositionSource positionSource,
            AnnouncementQueue announcements,
            SessionEventBus eventBus,
            GuidanceConfig config,
            Clock clock
    ) {
        this.positionSource = Objects.requireNonNull(positionSource, "positionSource");
        this.announcements = Objects.requireNonNull(announcements, "announcements");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "walknav-guidance");
            thread.setDaemon(true);
            return thread;
        });
        this.machine = new NavigationStateMachine(config, this::dispatch, clock);
    }

    /**
     * Starts guidance on {@code route}, replacing any active session.
     */
    public void startGuidance(Route route) {
        Objects.requireNonNull(route, "route");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("controller is closed");
            }
            long sessionGeneration = ++generation;
            detachLocked();
            announcements.cancelAll();
            machine.start(route);
            positionSubscription = positionSource.subscribe(new SessionListener(sessionGeneration));
        }
    }

    /**
     * Cancels the active session. A no-op when idle.
     */
    public void clearRoute() {
        synchronized (lock) {
            generation++;
            detachLocked();
            announcements.cancelAll();
            machine.cancel();
        }
    }

    public boolean repeatCurrentInstruction() {
        synchronized (lock) {
            return machine.repeatCurrentInstruction();
        }
    }

    public NavigationState state() {
        synchronized (lock) {
            return machine.state();
        }
    }

    /**
     * Index of the current instruction, or {@code -1} when idle.
     */
    public int currentInstructionIndex() {
        synchronized (lock) {
            return machine.session().map(NavigationSession::getCurrentInstructionIndex).orElse(-1);
        }
    }

    public SessionEventBus events() {
        return eventBus;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        clearRoute();
        executor.shutdownNow();
    }

    /**
     * Waits until every task queued so far on the guidance thread has run.
     */
    void awaitQueuedUpdates(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            executor.submit(() -> { }).get(timeout, unit);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("guidance barrier failed", ex.getCause());
        }
    }

    private void handlePosition(long sessionGeneration, PositionUpdate update) {
        synchronized (lock) {
            if (sessionGeneration != generation) {
                return;
            }
            try {
                machine.onPositionUpdate(update);
            } catch (RuntimeException ex) {
                log.warn("Dropping position update {} after processing failure", update, ex);
                return;
            }
            if (machine.state() == NavigationState.ARRIVED && teardown == null) {
                teardown = executor.schedule(
                        () -> finishArrival(sessionGeneration),
                        config.getArrivalGrace().toMillis(),
                        TimeUnit.MILLISECONDS
                );
            }
        }
    }

    private void handleError(long sessionGeneration, PositionError error) {
        synchronized (lock) {
            if (sessionGeneration != generation) {
                return;
            }
            log.warn("Position source error {}: {}", error.kind(), error.detail());
            eventBus.publish(new PositionSourceErrorEvent(clock.instant(), error.kind(), error.kind().userMessage()));
        }
    }

    private void finishArrival(long sessionGeneration) {
        synchronized (lock) {
            if (sessionGeneration != generation) {
                return;
            }
            generation++;
            detachLocked();
            machine.onArrivalGraceElapsed();
        }
    }

    private void detachLocked() {
        if (teardown != null) {
            teardown.cancel(false);
            teardown = null;
        }
        if (positionSubscription != null) {
            positionSubscription.unsubscribe();
            positionSubscription = null;
        }
    }

    // Runs under lock, called synchronously by the state machine.
    private void dispatch(SessionEvent event) {
        if (event instanceof AnnouncementEvent) {
            AnnouncementEvent announcement = (AnnouncementEvent) event;
            announcements.speak(announcement.text(), announcement.priority(), announcement.force());
        }
        eventBus.publish(event);
    }

    private void submit(long sessionGeneration, Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.debug("Guidance executor closed, dropping callback of session {}", sessionGeneration);
        }
    }

    private final class SessionListener implements PositionListener {
        private final long sessionGeneration;

        private SessionListener(long sessionGeneration) {
            this.sessionGeneration = sessionGeneration;
        }

        @Override
        public void onPosition(PositionUpdate update) {
            submit(sessionGeneration, () -> handlePosition(sessionGeneration, update));
        }

        @Override
        public void onError(PositionError error) {
            submit(sessionGeneration, () -> handleError(sessionGeneration, error));
        }
    }
}
