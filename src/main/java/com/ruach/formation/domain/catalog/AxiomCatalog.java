package com.ruach.formation.domain.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.ReadinessLevel;

/**
 * Static table of canon axioms keyed by id, in declaration order.
 */
public final class AxiomCatalog {

    private static final String AUTHOR = "Ruach Ministries";

    private final Map<String, CanonAxiom> axioms;

    public AxiomCatalog(Collection<CanonAxiom> axioms) {
        Map<String, CanonAxiom> byId = new LinkedHashMap<>();
        for (CanonAxiom axiom : axioms) {
            if (byId.put(axiom.getId(), axiom) != null) {
                throw new IllegalArgumentException("Duplicate axiom id: " + axiom.getId());
            }
        }
        this.axioms = Collections.unmodifiableMap(byId);
    }

    public static AxiomCatalog defaults() {
        return new AxiomCatalog(List.of(
                new CanonAxiom("axiom-awakening-identity", "Identity in Christ",
                        "Your true identity is found not in accomplishments, status, or relationships, "
                                + "but in who you are as a beloved child of God in Christ.",
                        FormationPhase.AWAKENING, AUTHOR,
                        List.of(AxiomPrerequisite.phase(FormationPhase.AWAKENING),
                                AxiomPrerequisite.checkpoint("checkpoint-awakening-1")),
                        List.of("identity", "christology", "foundational")),
                new CanonAxiom("axiom-awakening-authority", "God's Authority Over All",
                        "God exercises sovereign authority over all creation. His reign is characterized "
                                + "by wisdom, justice, and mercy. Submitting to His authority brings freedom, "
                                + "not bondage.",
                        FormationPhase.AWAKENING, AUTHOR,
                        List.of(AxiomPrerequisite.checkpoint("checkpoint-awakening-2"),
                                AxiomPrerequisite.phaseDuration(FormationPhase.AWAKENING, 3)),
                        List.of("authority", "sovereignty", "submission")),
                new CanonAxiom("axiom-awakening-invitation", "The Invitation to Formation",
                        "Formation is not a program to complete but an invitation to join God in "
                                + "transforming your life. It requires patience, honesty, and openness to "
                                + "the Spirit's work.",
                        FormationPhase.AWAKENING, null,
                        List.of(AxiomPrerequisite.checkpoint("checkpoint-awakening-3")),
                        List.of("formation", "invitation", "journey")),
                new CanonAxiom("axiom-separation-discernment", "Distinguishing God's Voice",
                        "Learning to discern God's voice from other voices requires regular practice, "
                                + "biblical grounding, and trusted community reflection.",
                        FormationPhase.SEPARATION, null,
                        List.of(AxiomPrerequisite.phase(FormationPhase.SEPARATION),
                                AxiomPrerequisite.readiness(ReadinessLevel.DEVELOPING)),
                        List.of("discernment", "vocation", "guidance"))));
    }

    public Optional<CanonAxiom> find(String axiomId) {
        return Optional.ofNullable(axioms.get(axiomId));
    }

    public Collection<CanonAxiom> all() {
        return axioms.values();
    }

    public List<CanonAxiom> byPhase(FormationPhase phase) {
        List<CanonAxiom> result = new ArrayList<>();
        for (CanonAxiom axiom : axioms.values()) {
            if (axiom.getPhase() == phase) {
                result.add(axiom);
            }
        }
        return result;
    }
}
