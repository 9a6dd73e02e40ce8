package com.ruach.formation.application.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.ruach.formation.domain.catalog.AxiomCatalog;
import com.ruach.formation.domain.catalog.AxiomPrerequisite;
import com.ruach.formation.domain.catalog.CanonAxiom;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Prerequisite-based content gate over the axiom catalog.
 * <p>
 * <b>Conjunctive:</b> an axiom unlocks only when every prerequisite holds.
 * All prerequisites are evaluated, none are skipped, so callers always see
 * the full picture.
 * </p>
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 */
public class AxiomUnlockService {

    private static final Comparator<AxiomUnlockResult> BY_TITLE = Comparator
            .comparing(AxiomUnlockResult::getTitle)
            .thenComparing(AxiomUnlockResult::getAxiomId);

    private final AxiomCatalog catalog;

    public AxiomUnlockService(AxiomCatalog catalog) {
        if (catalog == null)
            throw new IllegalArgumentException("catalog cannot be null");
        this.catalog = catalog;
    }

    /**
     * @return the axiom's status, or null if the id is not in the catalog
     */
    public AxiomUnlockResult checkAxiomUnlock(String axiomId, FormationState state) {
        return catalog.find(axiomId)
                .map(axiom -> evaluate(axiom, state))
                .orElse(null);
    }

    /**
     * @return status of every catalog axiom, ordered by title
     */
    public List<AxiomUnlockResult> getAllAxiomsWithStatus(FormationState state) {
        List<AxiomUnlockResult> results = new ArrayList<>();
        for (CanonAxiom axiom : catalog.all()) {
            results.add(evaluate(axiom, state));
        }
        results.sort(BY_TITLE);
        return results;
    }

    /**
     * Static filter, independent of any user.
     */
    public List<CanonAxiom> getAxiomsByPhase(FormationPhase phase) {
        return catalog.byPhase(phase);
    }

    /**
     * @return the catalog entry, or null if unknown
     */
    public CanonAxiom getAxiomDetails(String axiomId) {
        return catalog.find(axiomId).orElse(null);
    }

    /**
     * Ids whose prerequisites currently hold, in catalog order.
     */
    public List<String> getUnlockedAxiomIds(FormationState state) {
        List<String> ids = new ArrayList<>();
        for (CanonAxiom axiom : catalog.all()) {
            if (evaluate(axiom, state).isUnlocked()) {
                ids.add(axiom.getId());
            }
        }
        return ids;
    }

    /**
     * Set difference {@code current \ previous}, keeping the order of
     * {@code current} and dropping repeats.
     */
    public List<String> getNewlyUnlockedAxioms(List<String> current, Collection<String> previous) {
        Set<String> before = new HashSet<>(previous);
        Set<String> added = new LinkedHashSet<>();
        for (String id : current) {
            if (!before.contains(id)) {
                added.add(id);
            }
        }
        return new ArrayList<>(added);
    }

    // ─────────────────── Private Helpers ───────────────────

    private AxiomUnlockResult evaluate(CanonAxiom axiom, FormationState state) {
        List<PrerequisiteStatus> statuses = new ArrayList<>();
        boolean unlocked = true;
        for (AxiomPrerequisite prerequisite : axiom.getPrerequisites()) {
            boolean satisfied = prerequisite.isSatisfiedBy(state);
            statuses.add(new PrerequisiteStatus(prerequisite.getKind(), prerequisite.describe(state), satisfied));
            unlocked &= satisfied;
        }
        return new AxiomUnlockResult(axiom.getId(), axiom.getTitle(), axiom.getPhase(), unlocked, statuses);
    }
}
