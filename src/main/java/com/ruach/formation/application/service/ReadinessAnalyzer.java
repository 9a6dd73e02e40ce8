package com.ruach.formation.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.catalog.PhaseCatalog;
import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.entity.Reflection;
import com.ruach.formation.domain.valueobject.PaceStatus;
import com.ruach.formation.domain.valueobject.ReadinessLevel;
import com.ruach.formation.domain.valueobject.RedFlag;

/**
 * Derives readiness indicators from projected state and reflection history.
 * <p>
 * <b>Pure:</b> "now" is passed in, nothing is mutated and no events are
 * produced here; see {@link ReadinessRecommender} for that step.
 * </p>
 */
public class ReadinessAnalyzer {

    private static final double SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final ReadinessThresholds thresholds;
    private final PhaseCatalog phaseCatalog;
    private final CheckpointCatalog checkpointCatalog;

    public ReadinessAnalyzer(ReadinessThresholds thresholds, PhaseCatalog phaseCatalog,
            CheckpointCatalog checkpointCatalog) {
        if (thresholds == null || phaseCatalog == null || checkpointCatalog == null)
            throw new IllegalArgumentException("thresholds and catalogs cannot be null");
        this.thresholds = thresholds;
        this.phaseCatalog = phaseCatalog;
        this.checkpointCatalog = checkpointCatalog;
    }

    /**
     * @param state       projected state
     * @param reflections reflection history of the same user
     * @param now         evaluation time
     * @return derived indicators; red flags already recorded in state are kept
     */
    public ReadinessIndicators analyze(FormationState state, ReflectionLog reflections, Instant now) {
        if (!state.hasActivity()) {
            return ReadinessIndicators.baseline();
        }

        Set<RedFlag> flags = EnumSet.noneOf(RedFlag.class);
        flags.addAll(state.getReadiness().getRedFlags());

        if (isSpeedRunning(state)) {
            flags.add(RedFlag.SPEED_RUNNING);
        }
        if (hasMissingReflections(state, now)) {
            flags.add(RedFlag.MISSING_REFLECTIONS);
        }
        if (isSurfaceEngagement(reflections)) {
            flags.add(RedFlag.SURFACE_ENGAGEMENT);
        }
        if (daysSince(state.getLastActivityAt(), now) >= thresholds.getDisengagedAfterDays()) {
            flags.add(RedFlag.DISENGAGED);
        }

        return new ReadinessIndicators(
                reflectionDepth(reflections),
                pace(state, now),
                canonEngagement(state),
                flags);
    }

    // ─────────────────── Dimensions ───────────────────

    /**
     * Stalled wins over too fast: an idle user is not speeding.
     */
    PaceStatus pace(FormationState state, Instant now) {
        if (daysSince(state.getLastActivityAt(), now) >= thresholds.getStalledAfterDays()) {
            return PaceStatus.STALLED;
        }

        long minimumDays = phaseCatalog.get(state.getCurrentPhase()).getMinimumDays();
        double elapsedDays = Math.max(1.0,
                Duration.between(state.getPhaseEnteredAt(), now).getSeconds() / SECONDS_PER_DAY);
        double velocity = state.countCompletedInPhase(state.getCurrentPhase()) / elapsedDays;

        if (daysSince(state.getPhaseEnteredAt(), now) < minimumDays
                && velocity > thresholds.getMaxCheckpointsPerDay()) {
            return PaceStatus.TOO_FAST;
        }
        return PaceStatus.APPROPRIATE;
    }

    ReadinessLevel reflectionDepth(ReflectionLog reflections) {
        int count = reflections.size();
        double average = reflections.averageWordCount();
        if (meets(thresholds.getDepthEstablished(), count, average)) {
            return ReadinessLevel.ESTABLISHED;
        }
        if (meets(thresholds.getDepthMaturing(), count, average)) {
            return ReadinessLevel.MATURING;
        }
        if (meets(thresholds.getDepthDeveloping(), count, average)) {
            return ReadinessLevel.DEVELOPING;
        }
        return ReadinessLevel.EMERGING;
    }

    /**
     * Citations weigh double: using an axiom shows more than reading it.
     */
    ReadinessLevel canonEngagement(FormationState state) {
        int score = state.getCanonDefinitionsViewed() + 2 * state.getCanonAxiomsCited();
        if (score >= thresholds.getCanonEstablished()) {
            return ReadinessLevel.ESTABLISHED;
        }
        if (score >= thresholds.getCanonMaturing()) {
            return ReadinessLevel.MATURING;
        }
        if (score >= thresholds.getCanonDeveloping()) {
            return ReadinessLevel.DEVELOPING;
        }
        return ReadinessLevel.EMERGING;
    }

    // ─────────────────── Red Flags ───────────────────

    private boolean isSpeedRunning(FormationState state) {
        Map<String, Instant> reachedAt = state.getCheckpointReachedAt();
        for (Map.Entry<String, Instant> completed : state.getCheckpointCompletedAt().entrySet()) {
            Optional<Checkpoint> checkpoint = checkpointCatalog.find(completed.getKey());
            Instant reached = reachedAt.get(completed.getKey());
            if (checkpoint.isEmpty() || reached == null) {
                continue;
            }
            long dwellSeconds = Duration.between(reached, completed.getValue()).getSeconds();
            if (dwellSeconds <= checkpoint.get().getMinimumDwellSeconds() * thresholds.getSpeedRunDwellRatio()) {
                return true;
            }
        }
        return false;
    }

    private boolean hasMissingReflections(FormationState state, Instant now) {
        Duration grace = Duration.ofHours(thresholds.getMissingReflectionGraceHours());
        for (Map.Entry<String, Instant> reached : state.getCheckpointReachedAt().entrySet()) {
            if (!state.isCheckpointCompleted(reached.getKey())
                    && !reached.getValue().plus(grace).isAfter(now)) {
                return true;
            }
        }
        return false;
    }

    private boolean isSurfaceEngagement(ReflectionLog reflections) {
        if (reflections.size() < thresholds.getSurfaceMinimumReflections()) {
            return false;
        }
        long surface = reflections.getReflections().stream()
                .filter(r -> r.getWordCount() <= thresholds.getSurfaceWordCeiling() || r.isFlaggedRegurgitation())
                .count();
        return (double) surface / reflections.size() >= thresholds.getSurfaceShare();
    }

    // ─────────────────── Private Helpers ───────────────────

    private static boolean meets(ReadinessThresholds.DepthThreshold threshold, int count, double average) {
        return count >= threshold.reflections() && average >= threshold.averageWords();
    }

    private static long daysSince(Instant from, Instant now) {
        return Math.max(0, Duration.between(from, now).toDays());
    }
}
