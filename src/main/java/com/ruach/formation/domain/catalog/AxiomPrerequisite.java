package com.ruach.formation.domain.catalog;

import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.PaceStatus;
import com.ruach.formation.domain.valueobject.ReadinessLevel;

/**
 * One gating condition on an axiom, drawn from a small closed set of kinds.
 * <p>
 * Prerequisites are data: new axioms combine existing kinds rather than
 * adding new evaluation code.
 * </p>
 */
public final class AxiomPrerequisite {

    public enum Kind {
        /** A specific checkpoint has been completed */
        CHECKPOINT,
        /** The user has reached the phase (or a later one) */
        PHASE,
        /** The user has spent at least N days in the phase */
        PHASE_DURATION,
        /** Reflection depth or canon engagement has reached the level */
        READINESS,
        /** Current pace matches */
        PACE
    }

    private final Kind kind;
    private final String checkpointId;
    private final FormationPhase phase;
    private final int minimumDays;
    private final ReadinessLevel level;
    private final PaceStatus pace;

    private AxiomPrerequisite(Kind kind, String checkpointId, FormationPhase phase,
            int minimumDays, ReadinessLevel level, PaceStatus pace) {
        this.kind = kind;
        this.checkpointId = checkpointId;
        this.phase = phase;
        this.minimumDays = minimumDays;
        this.level = level;
        this.pace = pace;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static AxiomPrerequisite checkpoint(String checkpointId) {
        if (checkpointId == null || checkpointId.isBlank()) {
            throw new IllegalArgumentException("checkpointId cannot be null or blank");
        }
        return new AxiomPrerequisite(Kind.CHECKPOINT, checkpointId, null, 0, null, null);
    }

    public static AxiomPrerequisite phase(FormationPhase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        return new AxiomPrerequisite(Kind.PHASE, null, phase, 0, null, null);
    }

    public static AxiomPrerequisite phaseDuration(FormationPhase phase, int minimumDays) {
        if (phase == null || minimumDays < 0) {
            throw new IllegalArgumentException("phase cannot be null and minimumDays must be >= 0");
        }
        return new AxiomPrerequisite(Kind.PHASE_DURATION, null, phase, minimumDays, null, null);
    }

    public static AxiomPrerequisite readiness(ReadinessLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        return new AxiomPrerequisite(Kind.READINESS, null, null, 0, level, null);
    }

    public static AxiomPrerequisite pace(PaceStatus pace) {
        if (pace == null) {
            throw new IllegalArgumentException("pace cannot be null");
        }
        return new AxiomPrerequisite(Kind.PACE, null, null, 0, null, pace);
    }

    // ─────────────────── Evaluation ───────────────────

    /**
     * Evaluates this condition against a projected state.
     */
    public boolean isSatisfiedBy(FormationState state) {
        return switch (kind) {
            case CHECKPOINT -> state.isCheckpointCompleted(checkpointId);
            case PHASE -> state.getCurrentPhase().isAtLeast(phase);
            // Time already served in a phase the user has moved past still counts
            case PHASE_DURATION -> state.getCurrentPhase() == phase
                    ? state.getDaysInPhase() >= minimumDays
                    : state.getCurrentPhase().isAtLeast(phase);
            case READINESS -> state.getReadiness().getReflectionDepth().isAtLeast(level)
                    || state.getReadiness().getCanonEngagement().isAtLeast(level);
            case PACE -> state.getReadiness().getPace() == pace;
        };
    }

    /**
     * Human-readable description, including current progress where useful.
     */
    public String describe(FormationState state) {
        return switch (kind) {
            case CHECKPOINT -> "Complete checkpoint " + checkpointId;
            case PHASE -> "Reach phase: " + phase.slug();
            case PHASE_DURATION -> "Spend " + minimumDays + " days in " + phase.slug()
                    + " phase (currently: " + (state.getCurrentPhase() == phase ? state.getDaysInPhase() : 0)
                    + " days)";
            case READINESS -> "Achieve " + level.name().toLowerCase() + " readiness level";
            case PACE -> "Maintain " + pace.name().toLowerCase() + " pace";
        };
    }

    public Kind getKind() {
        return kind;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public int getMinimumDays() {
        return minimumDays;
    }

    public ReadinessLevel getLevel() {
        return level;
    }

    public PaceStatus getPace() {
        return pace;
    }

    @Override
    public String toString() {
        return "AxiomPrerequisite{kind=" + kind + "}";
    }
}
