package com.ruach.formation.domain.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.valueobject.FormationPhase;

@DisplayName("Curriculum catalogs")
class CatalogTest {

    @Test
    @DisplayName("the shipped phases gate on days and checkpoints, stewardship last")
    void phases() {
        PhaseCatalog catalog = PhaseCatalog.defaults();

        assertThat(catalog.get(FormationPhase.AWAKENING).getMinimumDays()).isEqualTo(30);
        assertThat(catalog.get(FormationPhase.DISCERNMENT).getRequiredCheckpoints()).isEqualTo(4);
        assertThat(FormationPhase.STEWARDSHIP.next()).isNull();
        assertThat(FormationPhase.AWAKENING.next()).isEqualTo(FormationPhase.SEPARATION);
    }

    @Test
    @DisplayName("every phase needs a definition")
    void missingPhase() {
        assertThatThrownBy(() -> new PhaseCatalog(List.of(
                new PhaseDefinition(FormationPhase.AWAKENING, "Awakening", 30, 3))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SEPARATION");
    }

    @Test
    @DisplayName("checkpoint ids are unique")
    void duplicateCheckpoint() {
        Checkpoint checkpoint = new Checkpoint("checkpoint-awakening-1", "awakening-1", FormationPhase.AWAKENING,
                1, "", 60, true);

        assertThatThrownBy(() -> new CheckpointCatalog(List.of(checkpoint, checkpoint)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("the awakening checkpoints carry increasing pauses")
    void awakeningCheckpoints() {
        List<Checkpoint> awakening = CheckpointCatalog.defaults().byPhase(FormationPhase.AWAKENING);

        assertThat(awakening).extracting(Checkpoint::getMinimumDwellSeconds).containsExactly(180L, 240L, 300L);
        assertThat(CheckpointCatalog.defaults().find("checkpoint-awakening-9")).isEmpty();
    }

    @Test
    @DisplayName("axiom prerequisites describe themselves against a state")
    void prerequisites() {
        FormationState state = FormationState.initial("user-1", Instant.EPOCH);
        AxiomPrerequisite checkpoint = AxiomPrerequisite.checkpoint("checkpoint-awakening-1");
        AxiomPrerequisite phase = AxiomPrerequisite.phase(FormationPhase.AWAKENING);

        assertThat(checkpoint.isSatisfiedBy(state)).isFalse();
        assertThat(checkpoint.describe(state)).isEqualTo("Complete checkpoint checkpoint-awakening-1");
        assertThat(phase.isSatisfiedBy(state)).isTrue();
        assertThat(AxiomCatalog.defaults().all()).hasSize(4);
    }
}
