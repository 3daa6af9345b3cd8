package org.walknav.navigation;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.walknav.routing.core.Route;
import org.walknav.routing.instruction.Instruction;

/**
 * Mutable progress of one guidance run. Owned by {@link NavigationStateMachine}.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public final class NavigationSession {
    private final Route route;
    @Getter(AccessLevel.PACKAGE)
    private final RouteProgress progress;
    private int currentInstructionIndex;
    private double distanceTraveled;
    private boolean offRoute;
    private boolean advanceWarningGiven;
    private String lastSpokenText;
    // Off-route detection stays disarmed until the user first comes near the route.
    private boolean proximityLocked;

    NavigationSession(Route route) {
        this.route = route;
        this.progress = new RouteProgress(route);
    }

    public Instruction currentInstruction() {
        return route.getInstructions().get(currentInstructionIndex);
    }

    public boolean isOnLastInstruction() {
        return currentInstructionIndex >= route.getInstructions().size() - 1;
    }
}
