package com.ruach.formation.application.service;

import static com.ruach.formation.support.Events.T0;
import static com.ruach.formation.support.Events.USER;
import static com.ruach.formation.support.Events.completed;
import static com.ruach.formation.support.Events.covenant;
import static com.ruach.formation.support.Events.phaseStarted;
import static com.ruach.formation.support.Events.reached;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ruach.formation.domain.catalog.PhaseCatalog;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.PhaseCompleted;
import com.ruach.formation.domain.event.PhaseStarted;
import com.ruach.formation.domain.valueobject.FormationPhase;

@DisplayName("PhaseProgressionPolicy")
class PhaseProgressionPolicyTest {

    private final FormationStateReducer reducer = new FormationStateReducer();
    private final PhaseProgressionPolicy policy = new PhaseProgressionPolicy(PhaseCatalog.defaults());

    private static Instant day(int n) {
        return T0.plus(Duration.ofDays(n));
    }

    private FormationState awakeningDone(int checkpoints) {
        FormationState state = reducer.rebuildState(USER, List.of(covenant(T0)));
        for (int i = 1; i <= checkpoints; i++) {
            state = reducer.applyEvent(state, reached(day(1), i));
            state = reducer.applyEvent(state, completed(day(1).plusSeconds(600), i, 600));
        }
        return state;
    }

    @Test
    @DisplayName("holds the gate until the minimum days have passed")
    void minimumDays() {
        FormationState state = awakeningDone(3);

        assertThat(policy.evaluateAdvance(state, day(29)).canAdvance()).isFalse();
        PhaseAdvanceDecision decision = policy.evaluateAdvance(state, day(30));
        assertThat(decision.canAdvance()).isTrue();
        assertThat(decision.nextPhase()).isEqualTo(FormationPhase.SEPARATION);
        assertThat(decision.daysInPhase()).isEqualTo(30);
        assertThat(decision.requiredCheckpoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("holds the gate until enough checkpoints are completed")
    void requiredCheckpoints() {
        PhaseAdvanceDecision decision = policy.evaluateAdvance(awakeningDone(2), day(60));

        assertThat(decision.canAdvance()).isFalse();
        assertThat(decision.checkpointsCompleted()).isEqualTo(2);
    }

    @Test
    @DisplayName("emits PhaseCompleted followed by PhaseStarted")
    void advancePayloads() {
        FormationState state = awakeningDone(3);
        PhaseAdvanceDecision decision = policy.evaluateAdvance(state, day(30));

        List<EventPayload> payloads = policy.advancePayloads(state, decision);

        assertThat(payloads).hasSize(2);
        PhaseCompleted completed = (PhaseCompleted) payloads.get(0);
        assertThat(completed.getPhase()).isEqualTo(FormationPhase.AWAKENING);
        assertThat(completed.getCheckpointsCompleted()).isEqualTo(3);
        PhaseStarted started = (PhaseStarted) payloads.get(1);
        assertThat(started.getPhase()).isEqualTo(FormationPhase.SEPARATION);
        assertThat(started.getPreviousPhase()).isEqualTo(FormationPhase.AWAKENING);
    }

    @Test
    @DisplayName("refuses to build payloads for a closed gate")
    void closedGate() {
        FormationState state = awakeningDone(1);
        PhaseAdvanceDecision decision = policy.evaluateAdvance(state, day(1));

        assertThatThrownBy(() -> policy.advancePayloads(state, decision))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("stewardship is terminal")
    void terminal() {
        FormationState state = reducer.rebuildState(USER, List.of(
                covenant(T0),
                phaseStarted(day(30), FormationPhase.SEPARATION, FormationPhase.AWAKENING),
                phaseStarted(day(60), FormationPhase.DISCERNMENT, FormationPhase.SEPARATION),
                phaseStarted(day(105), FormationPhase.COMMISSION, FormationPhase.DISCERNMENT),
                phaseStarted(day(150), FormationPhase.STEWARDSHIP, FormationPhase.COMMISSION)));

        PhaseAdvanceDecision decision = policy.evaluateAdvance(state, day(400));

        assertThat(state.getCurrentPhase()).isEqualTo(FormationPhase.STEWARDSHIP);
        assertThat(decision.nextPhase()).isNull();
        assertThat(decision.canAdvance()).isFalse();
    }
}
