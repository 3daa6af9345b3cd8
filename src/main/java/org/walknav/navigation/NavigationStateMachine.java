package org.walknav.navigation;

import lombok.extern.slf4j.Slf4j;
import org.walknav.navigation.event.AnnouncementEvent;
import org.walknav.navigation.event.ArrivedEvent;
import org.walknav.navigation.event.CancelledEvent;
import org.walknav.navigation.event.SessionEvent;
import org.walknav.navigation.event.StateChangedEvent;
import org.walknav.routing.core.Route;
import org.walknav.routing.geo.Coordinate;
import org.walknav.routing.geo.GeoUtils;
import org.walknav.routing.instruction.Instruction;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Live guidance over one route.
 *
 * <p>Each position update measures the minimum distance to any route vertex and the distance
 * traveled along the route, then applies, in order: proximity lock, off-route entry or exit,
 * and (while guiding) advance warning and instruction advancement. Arrival is checked on the
 * final instruction whether or not the user is off route. All side effects
 * are emitted as {@link SessionEvent}s to the sink.</p>
 *
 * <p>Not thread-safe. {@link NavigationController} serializes every call.</p>
 */
@Slf4j
public final class NavigationStateMachine {
    public static final String OFF_ROUTE_TEXT = "You are off route. Please return to the marked path.";
    public static final String BACK_ON_ROUTE_TEXT = "Back on route.";
    public static final String ARRIVAL_TEXT = "You have arrived at your destination.";

    private final GuidanceThresholds thresholds;
    private final Consumer<SessionEvent> sink;
    private final Clock clock;

    private NavigationState state = NavigationState.IDLE;
    private NavigationSession session;

    public NavigationStateMachine(GuidanceConfig config, Consumer<SessionEvent> sink) {
        this(config, sink, Clock.systemUTC());
    }

    public NavigationStateMachine(GuidanceConfig config, Consumer<SessionEvent> sink, Clock clock) {
        this.thresholds = new GuidanceThresholds(config);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public NavigationState state() {
        return state;
    }

    public Optional<NavigationSession> session() {
        return Optional.ofNullable(session);
    }

    /**
     * Starts guidance on {@code route}. A running session is cancelled first.
     * Announces the route summary (priority) followed by the first instruction.
     */
    public void start(Route route) {
        Objects.requireNonNull(route, "route");
        if (route.getInstructions().isEmpty()) {
            throw new IllegalArgumentException("route has no instructions");
        }
        if (session != null) {
            log.info("Replacing active guidance session in state {}", state);
            sink.accept(new CancelledEvent(clock.instant()));
        }
        session = new NavigationSession(route);
        state = NavigationState.GUIDING;
        log.info("Guidance started: {} m, {} instructions",
                Math.round(route.getTotalDistanceMeters()), route.getInstructions().size());

        announce("Route ready! " + DistanceFormatter.spoken(route.getTotalDistanceMeters())
                + " to your destination.", true, false);
        announce(session.currentInstruction().getText(), false, false);
        publishState();
    }

    /**
     * Processes one fix. Ignored when no session is guiding; malformed fixes are dropped.
     */
    public void onPositionUpdate(PositionUpdate update) {
        if (session == null || !state.isActive()) {
            log.debug("Position update ignored in state {}", state);
            return;
        }
        if (update == null || !update.isWellFormed()) {
            log.warn("Discarding malformed position update {}", update);
            return;
        }

        Coordinate position = update.coordinate();
        double accuracy = update.getAccuracyMeters();
        RouteProgress progress = session.getProgress();
        double minDistance = progress.minVertexDistance(position);
        session.setDistanceTraveled(progress.distanceTraveled(position));
        log.debug("Fix {} acc={}m: {}m from route, {}m traveled",
                position, accuracy, Math.round(minDistance), Math.round(session.getDistanceTraveled()));

        if (!session.isProximityLocked() && thresholds.locksProximity(minDistance, accuracy)) {
            session.setProximityLocked(true);
            log.info("Proximity lock acquired at {} m from route", Math.round(minDistance));
        }

        if (session.isProximityLocked() && thresholds.isUsableAccuracy(accuracy)) {
            boolean beyond = thresholds.isOffRoute(minDistance, accuracy);
            if (!session.isOffRoute() && beyond) {
                session.setOffRoute(true);
                state = NavigationState.OFF_ROUTE;
                log.info("Off route: {} m from route (threshold {} m)",
                        Math.round(minDistance), thresholds.offRouteThreshold(accuracy));
                announce(OFF_ROUTE_TEXT, true, true);
            } else if (session.isOffRoute() && !beyond) {
                session.setOffRoute(false);
                state = NavigationState.GUIDING;
                log.info("Back on route at {} m from route", Math.round(minDistance));
                announce(BACK_ON_ROUTE_TEXT, true, true);
            }
        }

        if (state == NavigationState.GUIDING) {
            evaluateProgress(position);
        } else if (session.isOnLastInstruction()) {
            checkArrival(position);
        }
        publishState();
    }

    /**
     * Repeats the current instruction, forced and with priority.
     *
     * @return whether anything was announced.
     */
    public boolean repeatCurrentInstruction() {
        if (session == null || !state.isActive()) {
            return false;
        }
        announce(session.currentInstruction().getText(), true, true);
        return true;
    }

    /**
     * Ends an arrived session once the grace delay has elapsed.
     *
     * @return whether a session was torn down.
     */
    public boolean onArrivalGraceElapsed() {
        if (state != NavigationState.ARRIVED) {
            return false;
        }
        session = null;
        state = NavigationState.IDLE;
        log.info("Guidance session finished");
        publishState();
        return true;
    }

    /**
     * Stops guidance from any state.
     *
     * @return whether a session was cancelled.
     */
    public boolean cancel() {
        if (session == null) {
            return false;
        }
        log.info("Guidance cancelled in state {}", state);
        session = null;
        state = NavigationState.IDLE;
        sink.accept(new CancelledEvent(clock.instant()));
        publishState();
        return true;
    }

    private void evaluateProgress(Coordinate position) {
        List<Instruction> instructions = session.getRoute().getInstructions();
        if (session.isOnLastInstruction()) {
            checkArrival(position);
            return;
        }

        Instruction next = instructions.get(session.getCurrentInstructionIndex() + 1);
        double toNext = GeoUtils.distance(position, next.getLocation());
        if (thresholds.shouldAdvance(toNext)) {
            session.setCurrentInstructionIndex(session.getCurrentInstructionIndex() + 1);
            session.setAdvanceWarningGiven(false);
            log.debug("Advanced to instruction {} at {} m from its anchor",
                    session.getCurrentInstructionIndex(), Math.round(toNext));
            announce(next.getText(), true, true);
            if (session.isOnLastInstruction()) {
                checkArrival(position);
            }
            return;
        }
        if (!session.isAdvanceWarningGiven() && thresholds.inAdvanceWarningBand(toNext)) {
            session.setAdvanceWarningGiven(true);
            announce("In " + DistanceFormatter.spoken(toNext) + ", " + next.getText(), true, false);
        }
    }

    private void checkArrival(Coordinate position) {
        Coordinate destination = session.getRoute().destination();
        if (thresholds.hasArrived(GeoUtils.distance(position, destination))) {
            state = NavigationState.ARRIVED;
            session.setOffRoute(false);
            log.info("Arrived at destination {}", destination);
            announce(ARRIVAL_TEXT, true, true);
            sink.accept(new ArrivedEvent(clock.instant(), destination));
        }
    }

    private void announce(String text, boolean priority, boolean force) {
        session.setLastSpokenText(text);
        sink.accept(new AnnouncementEvent(clock.instant(), text, priority, force));
    }

    private void publishState() {
        if (session == null) {
            sink.accept(new StateChangedEvent(clock.instant(), state, 0, 0.0d, false));
            return;
        }
        sink.accept(new StateChangedEvent(
                clock.instant(),
                state,
                session.getCurrentInstructionIndex(),
                session.getDistanceTraveled(),
                session.isOffRoute()
        ));
    }
}
