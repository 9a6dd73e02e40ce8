package com.ruach.formation.application.service;

import java.util.List;
import java.util.stream.Collectors;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Unlock status of one axiom, with every prerequisite's result so partial
 * progress can be shown.
 */
public final class AxiomUnlockResult {

    private final String axiomId;
    private final String title;
    private final FormationPhase phase;
    private final boolean unlocked;
    private final List<PrerequisiteStatus> prerequisites;

    public AxiomUnlockResult(String axiomId, String title, FormationPhase phase, boolean unlocked,
            List<PrerequisiteStatus> prerequisites) {
        this.axiomId = axiomId;
        this.title = title;
        this.phase = phase;
        this.unlocked = unlocked;
        this.prerequisites = List.copyOf(prerequisites);
    }

    public String getAxiomId() {
        return axiomId;
    }

    public String getTitle() {
        return title;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public boolean isUnlocked() {
        return unlocked;
    }

    public List<PrerequisiteStatus> getPrerequisites() {
        return prerequisites;
    }

    /**
     * @return descriptions of the prerequisites still unmet
     */
    public List<String> getUnmetRequirements() {
        return prerequisites.stream()
                .filter(p -> !p.satisfied())
                .map(PrerequisiteStatus::description)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "AxiomUnlockResult{axiomId='" + axiomId + "', unlocked=" + unlocked + "}";
    }
}
