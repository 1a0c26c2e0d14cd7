package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating BountyStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *            +------------------+
 *            |                  | (accepted hunter removed)
 *            v                  |
 *          OPEN ---------> IN_PROGRESS ---+ (revision requested)
 *           |  \              |  |  ^     |
 *           |   \             |  |  +-----+
 *           |    \            |  v
 *           |     \           | COMPLETED
 *           v      v          v
 *      CANCELLED  ARCHIVED <--+--> CANCELLED
 * </pre>
 *
 * <p>COMPLETED, CANCELLED and ARCHIVED are final.
 */
@Component
public class BountyStatusStateMachine {

    private static final Map<BountyStatus, Set<BountyStatus>> ALLOWED_TRANSITIONS = Map.of(
            BountyStatus.OPEN, EnumSet.of(
                    BountyStatus.IN_PROGRESS,
                    BountyStatus.CANCELLED,
                    BountyStatus.ARCHIVED
            ),
            BountyStatus.IN_PROGRESS, EnumSet.of(
                    BountyStatus.IN_PROGRESS,
                    BountyStatus.OPEN,
                    BountyStatus.COMPLETED,
                    BountyStatus.CANCELLED,
                    BountyStatus.ARCHIVED
            )
    );

    /**
     * Validates if a status transition is allowed.
     * Unlike most states, IN_PROGRESS to itself is an explicit transition (the revision loop).
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(BountyStatus fromStatus, BountyStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        Set<BountyStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(BountyStatus fromStatus, BountyStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid bounty status transition: %s -> %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    public boolean isFinalState(BountyStatus status) {
        return status != null && status.isTerminal();
    }

    public Set<BountyStatus> getAllowedTransitions(BountyStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
