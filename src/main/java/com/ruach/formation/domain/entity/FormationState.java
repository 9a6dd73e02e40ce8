package com.ruach.formation.domain.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Projection of a user's formation journey, rebuilt from the event log.
 * <p>
 * <b>IMMUTABLE:</b> every transition returns a NEW instance. This is not
 * the source of truth: the event log is. Transitions only ever add to the
 * collections, so the unlock sets never shrink and a completed checkpoint
 * is always also a reached one.
 * </p>
 *
 * <pre>
 * Phase flow (forward only, one step at a time):
 *   AWAKENING → SEPARATION → DISCERNMENT → COMMISSION → STEWARDSHIP
 * </pre>
 */
public final class FormationState {

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final String userId;
    private final CovenantType covenantType;
    private final FormationPhase currentPhase;
    private final Instant phaseEnteredAt;
    private final long daysInPhase;
    private final List<String> sectionsViewed;
    private final List<String> checkpointsReached;
    private final List<String> checkpointsCompleted;
    private final Map<String, Instant> checkpointReachedAt;
    private final Map<String, Instant> checkpointCompletedAt;
    private final int reflectionsSubmitted;
    private final int canonDefinitionsViewed;
    private final int canonAxiomsCited;
    private final ReadinessIndicators readiness;
    private final List<String> unlockedCanonAxioms;
    private final List<String> unlockedCourses;
    private final List<String> unlockedCannonReleases;
    private final List<FormationGap> formationGaps;
    private final long eventsApplied;
    private final Instant lastActivityAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    // ─────────────────── Private Constructor ───────────────────

    private FormationState(Builder b) {
        if (b.userId == null || b.userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (b.currentPhase == null) {
            throw new IllegalArgumentException("currentPhase cannot be null");
        }
        if (b.phaseEnteredAt == null || b.createdAt == null) {
            throw new IllegalArgumentException("phaseEnteredAt and createdAt cannot be null");
        }

        this.userId = b.userId;
        this.covenantType = b.covenantType;
        this.currentPhase = b.currentPhase;
        this.phaseEnteredAt = b.phaseEnteredAt;
        this.daysInPhase = Math.max(0, b.daysInPhase);
        this.sectionsViewed = Collections.unmodifiableList(new ArrayList<>(b.sectionsViewed));
        this.checkpointsReached = Collections.unmodifiableList(new ArrayList<>(b.checkpointsReached));
        this.checkpointsCompleted = Collections.unmodifiableList(new ArrayList<>(b.checkpointsCompleted));
        this.checkpointReachedAt = Collections.unmodifiableMap(new LinkedHashMap<>(b.checkpointReachedAt));
        this.checkpointCompletedAt = Collections.unmodifiableMap(new LinkedHashMap<>(b.checkpointCompletedAt));
        this.reflectionsSubmitted = b.reflectionsSubmitted;
        this.canonDefinitionsViewed = b.canonDefinitionsViewed;
        this.canonAxiomsCited = b.canonAxiomsCited;
        this.readiness = b.readiness != null ? b.readiness : ReadinessIndicators.baseline();
        this.unlockedCanonAxioms = Collections.unmodifiableList(new ArrayList<>(b.unlockedCanonAxioms));
        this.unlockedCourses = Collections.unmodifiableList(new ArrayList<>(b.unlockedCourses));
        this.unlockedCannonReleases = Collections.unmodifiableList(new ArrayList<>(b.unlockedCannonReleases));
        this.formationGaps = Collections.unmodifiableList(new ArrayList<>(b.formationGaps));
        this.eventsApplied = b.eventsApplied;
        this.lastActivityAt = b.lastActivityAt != null ? b.lastActivityAt : b.createdAt;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt != null ? b.updatedAt : b.createdAt;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Creates the empty starting state: first phase, empty collections,
     * baseline readiness, all timestamps at {@code origin}.
     *
     * @param userId user the journey belongs to
     * @param origin instant used for every timestamp field
     */
    public static FormationState initial(String userId, Instant origin) {
        Builder b = new Builder();
        b.userId = userId;
        b.currentPhase = FormationPhase.AWAKENING;
        b.phaseEnteredAt = origin;
        b.lastActivityAt = origin;
        b.createdAt = origin;
        b.updatedAt = origin;
        b.readiness = ReadinessIndicators.baseline();
        return new FormationState(b);
    }

    // ─────────────────── Transitions ───────────────────

    /**
     * Records activity at {@code at}: bumps lastActivityAt/updatedAt, counts
     * the applied event and recomputes daysInPhase from the event time.
     */
    public FormationState touch(Instant at) {
        Builder b = toBuilder();
        b.lastActivityAt = at;
        b.updatedAt = at;
        b.eventsApplied = eventsApplied + 1;
        b.daysInPhase = daysBetween(phaseEnteredAt, at);
        return new FormationState(b);
    }

    public FormationState enterCovenant(CovenantType type, Instant at) {
        Builder b = toBuilder();
        b.covenantType = type;
        b.createdAt = at;
        b.phaseEnteredAt = at;
        b.daysInPhase = 0;
        return new FormationState(b);
    }

    /**
     * Moves to the next phase. Only the immediate successor is accepted.
     *
     * @throws IllegalStateException if {@code phase} is not the next phase
     */
    public FormationState advanceTo(FormationPhase phase, Instant at) {
        if (currentPhase.next() != phase) {
            throw new IllegalStateException(
                    "Invalid transition: " + currentPhase + " → " + phase + " for user " + userId);
        }
        Builder b = toBuilder();
        b.currentPhase = phase;
        b.phaseEnteredAt = at;
        b.daysInPhase = 0;
        return new FormationState(b);
    }

    public FormationState withSectionViewed(String sectionId) {
        if (sectionsViewed.contains(sectionId)) {
            return this;
        }
        Builder b = toBuilder();
        b.sectionsViewed.add(sectionId);
        return new FormationState(b);
    }

    public FormationState withCheckpointReached(String checkpointId, Instant at) {
        if (checkpointsReached.contains(checkpointId)) {
            return this;
        }
        Builder b = toBuilder();
        b.checkpointsReached.add(checkpointId);
        b.checkpointReachedAt.put(checkpointId, at);
        return new FormationState(b);
    }

    /**
     * Marks a checkpoint completed. A checkpoint that was never reached is
     * marked reached at the same instant.
     */
    public FormationState withCheckpointCompleted(String checkpointId, Instant at) {
        FormationState reached = withCheckpointReached(checkpointId, at);
        if (reached.checkpointsCompleted.contains(checkpointId)) {
            return reached;
        }
        Builder b = reached.toBuilder();
        b.checkpointsCompleted.add(checkpointId);
        b.checkpointCompletedAt.put(checkpointId, at);
        return new FormationState(b);
    }

    public FormationState withReflectionSubmitted() {
        Builder b = toBuilder();
        b.reflectionsSubmitted = reflectionsSubmitted + 1;
        return new FormationState(b);
    }

    public FormationState withCanonDefinitionViewed(String axiomId) {
        Builder b = toBuilder();
        b.canonDefinitionsViewed = canonDefinitionsViewed + 1;
        addOnce(b.unlockedCanonAxioms, axiomId);
        return new FormationState(b);
    }

    public FormationState withCanonAxiomCited() {
        Builder b = toBuilder();
        b.canonAxiomsCited = canonAxiomsCited + 1;
        return new FormationState(b);
    }

    /**
     * Adds unlocked content to the set for its type. Sections count as viewed.
     */
    public FormationState withUnlockedContent(ContentType contentType, String contentId) {
        Builder b = toBuilder();
        switch (contentType) {
            case CANON -> addOnce(b.unlockedCanonAxioms, contentId);
            case COURSE -> addOnce(b.unlockedCourses, contentId);
            case CANNON -> addOnce(b.unlockedCannonReleases, contentId);
            case SECTION -> addOnce(b.sectionsViewed, contentId);
        }
        return new FormationState(b);
    }

    public FormationState withFormationGap(FormationGap gap) {
        Builder b = toBuilder();
        b.formationGaps.add(gap);
        return new FormationState(b);
    }

    public FormationState withReadiness(ReadinessIndicators indicators) {
        if (readiness.equals(indicators)) {
            return this;
        }
        Builder b = toBuilder();
        b.readiness = indicators;
        return new FormationState(b);
    }

    /**
     * Recomputes daysInPhase against an externally supplied instant. Used
     * by read paths; the reducer relies on event timestamps instead.
     */
    public FormationState withDaysInPhaseAt(Instant now) {
        long days = daysBetween(phaseEnteredAt, now);
        if (days == daysInPhase) {
            return this;
        }
        Builder b = toBuilder();
        b.daysInPhase = days;
        return new FormationState(b);
    }

    // ─────────────────── Query Methods ───────────────────

    public boolean isCheckpointReached(String checkpointId) {
        return checkpointsReached.contains(checkpointId);
    }

    public boolean isCheckpointCompleted(String checkpointId) {
        return checkpointsCompleted.contains(checkpointId);
    }

    /**
     * @return true once at least one event has been folded into this state
     */
    public boolean hasActivity() {
        return eventsApplied > 0;
    }

    /**
     * Counts completed checkpoints whose id carries the given phase slug
     * ({@code checkpoint-<phase>-<n>}).
     */
    public int countCompletedInPhase(FormationPhase phase) {
        String prefix = "checkpoint-" + phase.slug() + "-";
        return (int) checkpointsCompleted.stream()
                .filter(id -> id.startsWith(prefix))
                .count();
    }

    // ─────────────────── Getters ───────────────────

    public String getUserId() {
        return userId;
    }

    public CovenantType getCovenantType() {
        return covenantType;
    }

    public FormationPhase getCurrentPhase() {
        return currentPhase;
    }

    public Instant getPhaseEnteredAt() {
        return phaseEnteredAt;
    }

    public long getDaysInPhase() {
        return daysInPhase;
    }

    public List<String> getSectionsViewed() {
        return sectionsViewed;
    }

    public List<String> getCheckpointsReached() {
        return checkpointsReached;
    }

    public List<String> getCheckpointsCompleted() {
        return checkpointsCompleted;
    }

    public Map<String, Instant> getCheckpointReachedAt() {
        return checkpointReachedAt;
    }

    public Map<String, Instant> getCheckpointCompletedAt() {
        return checkpointCompletedAt;
    }

    public int getReflectionsSubmitted() {
        return reflectionsSubmitted;
    }

    public int getCanonDefinitionsViewed() {
        return canonDefinitionsViewed;
    }

    public int getCanonAxiomsCited() {
        return canonAxiomsCited;
    }

    public ReadinessIndicators getReadiness() {
        return readiness;
    }

    public List<String> getUnlockedCanonAxioms() {
        return unlockedCanonAxioms;
    }

    public List<String> getUnlockedCourses() {
        return unlockedCourses;
    }

    public List<String> getUnlockedCannonReleases() {
        return unlockedCannonReleases;
    }

    public List<FormationGap> getFormationGaps() {
        return formationGaps;
    }

    public long getEventsApplied() {
        return eventsApplied;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ─────────────────── Helpers ───────────────────

    private static long daysBetween(Instant from, Instant to) {
        long seconds = Duration.between(from, to).getSeconds();
        return seconds <= 0 ? 0 : seconds / SECONDS_PER_DAY;
    }

    private static void addOnce(List<String> values, String value) {
        if (!values.contains(value)) {
            values.add(value);
        }
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.userId = userId;
        b.covenantType = covenantType;
        b.currentPhase = currentPhase;
        b.phaseEnteredAt = phaseEnteredAt;
        b.daysInPhase = daysInPhase;
        b.sectionsViewed.addAll(sectionsViewed);
        b.checkpointsReached.addAll(checkpointsReached);
        b.checkpointsCompleted.addAll(checkpointsCompleted);
        b.checkpointReachedAt.putAll(checkpointReachedAt);
        b.checkpointCompletedAt.putAll(checkpointCompletedAt);
        b.reflectionsSubmitted = reflectionsSubmitted;
        b.canonDefinitionsViewed = canonDefinitionsViewed;
        b.canonAxiomsCited = canonAxiomsCited;
        b.readiness = readiness;
        b.unlockedCanonAxioms.addAll(unlockedCanonAxioms);
        b.unlockedCourses.addAll(unlockedCourses);
        b.unlockedCannonReleases.addAll(unlockedCannonReleases);
        b.formationGaps.addAll(formationGaps);
        b.eventsApplied = eventsApplied;
        b.lastActivityAt = lastActivityAt;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        return b;
    }

    private static final class Builder {
        private String userId;
        private CovenantType covenantType;
        private FormationPhase currentPhase;
        private Instant phaseEnteredAt;
        private long daysInPhase;
        private final List<String> sectionsViewed = new ArrayList<>();
        private final List<String> checkpointsReached = new ArrayList<>();
        private final List<String> checkpointsCompleted = new ArrayList<>();
        private final Map<String, Instant> checkpointReachedAt = new LinkedHashMap<>();
        private final Map<String, Instant> checkpointCompletedAt = new LinkedHashMap<>();
        private int reflectionsSubmitted;
        private int canonDefinitionsViewed;
        private int canonAxiomsCited;
        private ReadinessIndicators readiness;
        private final List<String> unlockedCanonAxioms = new ArrayList<>();
        private final List<String> unlockedCourses = new ArrayList<>();
        private final List<String> unlockedCannonReleases = new ArrayList<>();
        private final List<FormationGap> formationGaps = new ArrayList<>();
        private long eventsApplied;
        private Instant lastActivityAt;
        private Instant createdAt;
        private Instant updatedAt;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FormationState that = (FormationState) o;
        return daysInPhase == that.daysInPhase
                && reflectionsSubmitted == that.reflectionsSubmitted
                && canonDefinitionsViewed == that.canonDefinitionsViewed
                && canonAxiomsCited == that.canonAxiomsCited
                && eventsApplied == that.eventsApplied
                && Objects.equals(userId, that.userId)
                && covenantType == that.covenantType
                && currentPhase == that.currentPhase
                && Objects.equals(phaseEnteredAt, that.phaseEnteredAt)
                && sectionsViewed.equals(that.sectionsViewed)
                && checkpointsReached.equals(that.checkpointsReached)
                && checkpointsCompleted.equals(that.checkpointsCompleted)
                && checkpointReachedAt.equals(that.checkpointReachedAt)
                && checkpointCompletedAt.equals(that.checkpointCompletedAt)
                && readiness.equals(that.readiness)
                && unlockedCanonAxioms.equals(that.unlockedCanonAxioms)
                && unlockedCourses.equals(that.unlockedCourses)
                && unlockedCannonReleases.equals(that.unlockedCannonReleases)
                && formationGaps.equals(that.formationGaps)
                && Objects.equals(lastActivityAt, that.lastActivityAt)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, currentPhase, phaseEnteredAt, checkpointsCompleted,
                reflectionsSubmitted, eventsApplied, updatedAt);
    }

    @Override
    public String toString() {
        return "FormationState{userId='" + userId
                + "', currentPhase=" + currentPhase
                + ", daysInPhase=" + daysInPhase
                + ", checkpointsCompleted=" + checkpointsCompleted
                + ", reflectionsSubmitted=" + reflectionsSubmitted
                + ", readiness=" + readiness + "}";
    }
}
