package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BountyStatusStateMachineTest {

    private final BountyStatusStateMachine stateMachine = new BountyStatusStateMachine();

    @Test
    void openMovesForwardOnly() {
        assertThat(stateMachine.getAllowedTransitions(BountyStatus.OPEN))
                .containsExactlyInAnyOrder(BountyStatus.IN_PROGRESS, BountyStatus.CANCELLED, BountyStatus.ARCHIVED);
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.OPEN, BountyStatus.COMPLETED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.OPEN, BountyStatus.OPEN)).isFalse();
    }

    @Test
    void inProgressAllowsRevisionLoopAndReopen() {
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.IN_PROGRESS, BountyStatus.IN_PROGRESS)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.IN_PROGRESS, BountyStatus.OPEN)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.IN_PROGRESS, BountyStatus.COMPLETED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = BountyStatus.class, names = {"COMPLETED", "CANCELLED", "ARCHIVED"})
    void finalStatesHaveNoExits(BountyStatus status) {
        assertThat(stateMachine.isFinalState(status)).isTrue();
        assertThat(stateMachine.getAllowedTransitions(status)).isEmpty();
        for (BountyStatus target : BountyStatus.values()) {
            assertThat(stateMachine.isTransitionAllowed(status, target)).isFalse();
        }
    }

    @Test
    void validateTransitionRejectsIllegalMove() {
        assertThatThrownBy(() -> stateMachine.validateTransition(BountyStatus.COMPLETED, BountyStatus.CANCELLED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED -> CANCELLED");
    }

    @Test
    void nullStatusIsNeverAllowed() {
        assertThat(stateMachine.isTransitionAllowed(null, BountyStatus.OPEN)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(BountyStatus.OPEN, null)).isFalse();
        assertThat(stateMachine.isFinalState(null)).isFalse();
    }
}
