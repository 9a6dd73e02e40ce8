package com.ruach.formation.domain.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Lookup table of checkpoint definitions keyed by id.
 */
public final class CheckpointCatalog {

    private final Map<String, Checkpoint> checkpoints;

    public CheckpointCatalog(Collection<Checkpoint> checkpoints) {
        Map<String, Checkpoint> byId = new LinkedHashMap<>();
        for (Checkpoint checkpoint : checkpoints) {
            if (byId.put(checkpoint.getId(), checkpoint) != null) {
                throw new IllegalArgumentException("Duplicate checkpoint id: " + checkpoint.getId());
            }
        }
        this.checkpoints = Collections.unmodifiableMap(byId);
    }

    /**
     * The Awakening checkpoints, one per section.
     */
    public static CheckpointCatalog defaults() {
        return new CheckpointCatalog(List.of(
                new Checkpoint("checkpoint-awakening-1", "awakening-1", FormationPhase.AWAKENING, 1,
                        "Where did you first learn what you believe about God, and who taught you? "
                                + "Have you ever tested those beliefs against Scripture for yourself?",
                        180, true),
                new Checkpoint("checkpoint-awakening-2", "awakening-2", FormationPhase.AWAKENING, 2,
                        "Which authority do you actually consult first when you need to know what is true?",
                        240, true),
                new Checkpoint("checkpoint-awakening-3", "awakening-3", FormationPhase.AWAKENING, 3,
                        "What would it cost you to submit to a pace you did not set?",
                        300, true)));
    }

    public Optional<Checkpoint> find(String checkpointId) {
        return Optional.ofNullable(checkpoints.get(checkpointId));
    }

    public List<Checkpoint> byPhase(FormationPhase phase) {
        List<Checkpoint> result = new ArrayList<>();
        for (Checkpoint checkpoint : checkpoints.values()) {
            if (checkpoint.getPhase() == phase) {
                result.add(checkpoint);
            }
        }
        return result;
    }
}
