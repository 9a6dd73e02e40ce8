package com.ruach.formation.application.service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.ruach.formation.application.guard.ValidationError;

/**
 * Outcome of a reflection submission.
 * <ul>
 * <li>ACCEPTED: events recorded</li>
 * <li>REPLAYED: same key within the cooldown, the first outcome is returned
 * and nothing is recorded again</li>
 * <li>REJECTED: a rule was not met, nothing recorded</li>
 * </ul>
 */
public final class SubmissionResult {

    public enum Status {
        ACCEPTED,
        REPLAYED,
        REJECTED
    }

    private final Status status;
    private final String checkpointId;
    private final String reflectionId;
    private final List<String> eventIds;
    private final List<String> newlyUnlockedAxioms;
    private final int reflectionsSubmitted;
    private final Instant submittedAt;
    private final List<ValidationError> errors;

    public SubmissionResult(Status status, String checkpointId, String reflectionId, List<String> eventIds,
            List<String> newlyUnlockedAxioms, int reflectionsSubmitted, Instant submittedAt,
            List<ValidationError> errors) {
        if (status == null)
            throw new IllegalArgumentException("status cannot be null");
        this.status = status;
        this.checkpointId = checkpointId;
        this.reflectionId = reflectionId;
        this.eventIds = eventIds != null ? List.copyOf(eventIds) : List.of();
        this.newlyUnlockedAxioms = newlyUnlockedAxioms != null ? List.copyOf(newlyUnlockedAxioms) : List.of();
        this.reflectionsSubmitted = reflectionsSubmitted;
        this.submittedAt = submittedAt;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static SubmissionResult accepted(String checkpointId, String reflectionId, List<String> eventIds,
            List<String> newlyUnlockedAxioms, int reflectionsSubmitted, Instant submittedAt) {
        return new SubmissionResult(Status.ACCEPTED, checkpointId, reflectionId, eventIds,
                newlyUnlockedAxioms, reflectionsSubmitted, submittedAt, null);
    }

    public static SubmissionResult rejected(String checkpointId, List<ValidationError> errors) {
        return new SubmissionResult(Status.REJECTED, checkpointId, null, null, null, 0, null, errors);
    }

    /**
     * @return a copy marked as replayed, otherwise identical
     */
    public SubmissionResult asReplay() {
        return new SubmissionResult(Status.REPLAYED, checkpointId, reflectionId, eventIds,
                newlyUnlockedAxioms, reflectionsSubmitted, submittedAt, errors);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    public Status getStatus() {
        return status;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public String getReflectionId() {
        return reflectionId;
    }

    public List<String> getEventIds() {
        return eventIds;
    }

    public List<String> getNewlyUnlockedAxioms() {
        return newlyUnlockedAxioms;
    }

    public int getReflectionsSubmitted() {
        return reflectionsSubmitted;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SubmissionResult that = (SubmissionResult) o;
        return reflectionsSubmitted == that.reflectionsSubmitted && status == that.status
                && Objects.equals(checkpointId, that.checkpointId)
                && Objects.equals(reflectionId, that.reflectionId)
                && eventIds.equals(that.eventIds)
                && newlyUnlockedAxioms.equals(that.newlyUnlockedAxioms)
                && Objects.equals(submittedAt, that.submittedAt)
                && errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, checkpointId, reflectionId, eventIds, newlyUnlockedAxioms,
                reflectionsSubmitted, submittedAt, errors);
    }

    @Override
    public String toString() {
        return "SubmissionResult{status=" + status + ", checkpointId='" + checkpointId
                + "', reflectionId='" + reflectionId + "'}";
    }
}
