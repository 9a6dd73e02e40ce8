package com.ruach.formation.domain.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Gating data for every phase. Every phase must be defined.
 */
public final class PhaseCatalog {

    private final Map<FormationPhase, PhaseDefinition> definitions;

    public PhaseCatalog(Collection<PhaseDefinition> definitions) {
        Map<FormationPhase, PhaseDefinition> byPhase = new EnumMap<>(FormationPhase.class);
        for (PhaseDefinition definition : definitions) {
            byPhase.put(definition.getPhase(), definition);
        }
        for (FormationPhase phase : FormationPhase.values()) {
            if (!byPhase.containsKey(phase)) {
                throw new IllegalArgumentException("Missing phase definition for " + phase);
            }
        }
        this.definitions = Collections.unmodifiableMap(byPhase);
    }

    /**
     * The shipped curriculum. Stewardship is terminal, so its gate is never
     * evaluated.
     */
    public static PhaseCatalog defaults() {
        return new PhaseCatalog(List.of(
                new PhaseDefinition(FormationPhase.AWAKENING, "Awakening", 30, 3),
                new PhaseDefinition(FormationPhase.SEPARATION, "Separation", 30, 3),
                new PhaseDefinition(FormationPhase.DISCERNMENT, "Discernment", 45, 4),
                new PhaseDefinition(FormationPhase.COMMISSION, "Commission", 45, 4),
                new PhaseDefinition(FormationPhase.STEWARDSHIP, "Stewardship", 0, 0)));
    }

    public PhaseDefinition get(FormationPhase phase) {
        return definitions.get(phase);
    }
}
