package com.ruach.formation.application.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationGap;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.event.CanonDefinitionViewed;
import com.ruach.formation.domain.event.CheckpointCompleted;
import com.ruach.formation.domain.event.CheckpointReached;
import com.ruach.formation.domain.event.ContentUnlocked;
import com.ruach.formation.domain.event.CovenantEntered;
import com.ruach.formation.domain.event.FormationGapDetected;
import com.ruach.formation.domain.event.PauseTriggered;
import com.ruach.formation.domain.event.PhaseStarted;
import com.ruach.formation.domain.event.ReadinessLevelChanged;
import com.ruach.formation.domain.event.SectionViewed;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.PaceStatus;
import com.ruach.formation.domain.valueobject.ReadinessLevel;
import com.ruach.formation.domain.valueobject.RedFlag;

/**
 * Folds the event log into a {@link FormationState}.
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 * <p>
 * <b>Deterministic:</b> only event timestamps are read, never the clock, so
 * replaying the same events always yields the same state.
 * </p>
 */
public class FormationStateReducer {

    /**
     * Empty journey: Awakening, no progress, baseline readiness. Timestamps
     * sit at the epoch until the first event moves them.
     */
    public FormationState createInitialState(String userId) {
        return FormationState.initial(userId, Instant.EPOCH);
    }

    /**
     * Applies one event. Total over well-formed events: variants that do not
     * change the projection only record activity.
     */
    public FormationState applyEvent(FormationState state, FormationEvent event) {
        FormationState next = switch (event.getEventType()) {
            case COVENANT_ENTERED -> {
                CovenantEntered covenant = event.payloadAs(CovenantEntered.class);
                yield state.enterCovenant(covenant.getCovenantType(), event.getTimestamp());
            }

            case PHASE_STARTED -> applyPhaseStarted(state, event);

            case SECTION_VIEWED -> state.withSectionViewed(event.payloadAs(SectionViewed.class).getSectionId());

            case CHECKPOINT_REACHED -> state.withCheckpointReached(
                    event.payloadAs(CheckpointReached.class).getCheckpointId(), event.getTimestamp());

            case CHECKPOINT_COMPLETED -> state.withCheckpointCompleted(
                    event.payloadAs(CheckpointCompleted.class).getCheckpointId(), event.getTimestamp());

            case REFLECTION_SUBMITTED -> state.withReflectionSubmitted();

            case CANON_DEFINITION_VIEWED -> state.withCanonDefinitionViewed(
                    event.payloadAs(CanonDefinitionViewed.class).getAxiomId());

            case CANON_AXIOM_CITED -> state.withCanonAxiomCited();

            case CONTENT_UNLOCKED -> {
                ContentUnlocked unlocked = event.payloadAs(ContentUnlocked.class);
                yield state.withUnlockedContent(unlocked.getContentType(), unlocked.getContentId());
            }

            case FORMATION_GAP_DETECTED -> {
                FormationGapDetected gap = event.payloadAs(FormationGapDetected.class);
                yield state.withFormationGap(new FormationGap(
                        gap.getGapType(), gap.getArea(), gap.getSeverity(), gap.getRecommendation()));
            }

            case PAUSE_TRIGGERED -> {
                RedFlag flag = event.payloadAs(PauseTriggered.class).getReason().toRedFlag();
                yield flag != null ? state.withReadiness(state.getReadiness().withRedFlag(flag)) : state;
            }

            case READINESS_LEVEL_CHANGED -> applyReadinessChange(state,
                    event.payloadAs(ReadinessLevelChanged.class));

            // Analytics and audit-only variants
            case PHASE_COMPLETED, SECTION_COMPLETED, REFLECTION_ANALYZED, RECOMMENDATION_ISSUED,
                    CONTENT_GATED -> state;
        };
        return next.touch(event.getTimestamp());
    }

    /**
     * The only sanctioned way to obtain state: sort by replay order and fold
     * from the initial state. The first event's timestamp becomes the origin.
     */
    public FormationState rebuildState(String userId, List<FormationEvent> events) {
        if (events == null || events.isEmpty()) {
            return createInitialState(userId);
        }
        List<FormationEvent> ordered = new ArrayList<>(events);
        ordered.sort(FormationEvent.REPLAY_ORDER);

        FormationState state = FormationState.initial(userId, ordered.get(0).getTimestamp());
        for (FormationEvent event : ordered) {
            state = applyEvent(state, event);
        }
        return state;
    }

    // ─────────────────── Private Helpers ───────────────────

    /**
     * Forward one step only. Repeats and jumps leave the phase unchanged.
     */
    private FormationState applyPhaseStarted(FormationState state, FormationEvent event) {
        FormationPhase target = event.payloadAs(PhaseStarted.class).getPhase();
        if (state.getCurrentPhase().next() != target) {
            return state;
        }
        return state.advanceTo(target, event.getTimestamp());
    }

    private FormationState applyReadinessChange(FormationState state, ReadinessLevelChanged change) {
        ReadinessIndicators readiness = state.getReadiness();
        try {
            ReadinessIndicators updated = switch (change.getDimension()) {
                case REFLECTION_DEPTH -> readiness.withReflectionDepth(ReadinessLevel.valueOf(change.getNewLevel().toUpperCase()));
                case CANON_ENGAGEMENT -> readiness.withCanonEngagement(ReadinessLevel.valueOf(change.getNewLevel().toUpperCase()));
                case PACE -> readiness.withPace(PaceStatus.valueOf(change.getNewLevel().toUpperCase()));
            };
            return state.withReadiness(updated);
        } catch (IllegalArgumentException e) {
            // Level names from older producers degrade to a touch
            return state;
        }
    }
}
