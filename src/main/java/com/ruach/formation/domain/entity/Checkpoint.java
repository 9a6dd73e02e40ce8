package com.ruach.formation.domain.entity;

import java.util.Objects;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * A gate within a section requiring a timed pause and, optionally, a
 * reflection before the user may proceed.
 */
public final class Checkpoint {

    private final String id;
    private final String sectionId;
    private final FormationPhase phase;
    private final int order;
    private final String prompt;
    private final long minimumDwellSeconds;
    private final boolean requiresReflection;

    public Checkpoint(String id, String sectionId, FormationPhase phase, int order,
            String prompt, long minimumDwellSeconds, boolean requiresReflection) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (sectionId == null || sectionId.isBlank()) {
            throw new IllegalArgumentException("sectionId cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (minimumDwellSeconds < 0) {
            throw new IllegalArgumentException("minimumDwellSeconds must be >= 0, got: " + minimumDwellSeconds);
        }
        this.id = id;
        this.sectionId = sectionId;
        this.phase = phase;
        this.order = order;
        this.prompt = prompt != null ? prompt : "";
        this.minimumDwellSeconds = minimumDwellSeconds;
        this.requiresReflection = requiresReflection;
    }

    public String getId() {
        return id;
    }

    public String getSectionId() {
        return sectionId;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public int getOrder() {
        return order;
    }

    public String getPrompt() {
        return prompt;
    }

    public long getMinimumDwellSeconds() {
        return minimumDwellSeconds;
    }

    public boolean isRequiresReflection() {
        return requiresReflection;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(id, ((Checkpoint) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Checkpoint{id='" + id + "', phase=" + phase
                + ", minimumDwellSeconds=" + minimumDwellSeconds + "}";
    }
}
