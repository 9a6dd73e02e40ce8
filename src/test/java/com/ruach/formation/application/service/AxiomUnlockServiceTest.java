package com.ruach.formation.application.service;

import static com.ruach.formation.support.Events.T0;
import static com.ruach.formation.support.Events.USER;
import static com.ruach.formation.support.Events.at;
import static com.ruach.formation.support.Events.completed;
import static com.ruach.formation.support.Events.covenant;
import static com.ruach.formation.support.Events.phaseStarted;
import static com.ruach.formation.support.Events.reached;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ruach.formation.domain.catalog.AxiomCatalog;
import com.ruach.formation.domain.catalog.AxiomPrerequisite;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.event.ReadinessLevelChanged;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.ReadinessDimension;

@DisplayName("AxiomUnlockService")
class AxiomUnlockServiceTest {

    private static final String IDENTITY = "axiom-awakening-identity";
    private static final String AUTHORITY = "axiom-awakening-authority";
    private static final String DISCERNMENT = "axiom-separation-discernment";

    private final FormationStateReducer reducer = new FormationStateReducer();
    private final AxiomUnlockService service = new AxiomUnlockService(AxiomCatalog.defaults());

    private static Instant day(int n) {
        return T0.plus(Duration.ofDays(n));
    }

    private FormationState state(FormationEvent... events) {
        return reducer.rebuildState(USER, List.of(events));
    }

    @Nested
    @DisplayName("checkAxiomUnlock")
    class CheckAxiomUnlock {

        @Test
        @DisplayName("stays locked until its checkpoint is completed")
        void lockedUntilCheckpoint() {
            AxiomUnlockResult result = service.checkAxiomUnlock(IDENTITY, state(covenant(T0), reached(T0, 1)));

            assertThat(result.isUnlocked()).isFalse();
            assertThat(result.getUnmetRequirements()).containsExactly("Complete checkpoint checkpoint-awakening-1");
            assertThat(result.getPrerequisites())
                    .extracting(PrerequisiteStatus::kind)
                    .containsExactly(AxiomPrerequisite.Kind.PHASE, AxiomPrerequisite.Kind.CHECKPOINT);
        }

        @Test
        @DisplayName("unlocks once every prerequisite holds")
        void unlocksWhenAllHold() {
            AxiomUnlockResult result = service.checkAxiomUnlock(IDENTITY,
                    state(covenant(T0), reached(T0, 1), completed(T0.plusSeconds(300), 1, 300)));

            assertThat(result.isUnlocked()).isTrue();
            assertThat(result.getUnmetRequirements()).isEmpty();
        }

        @Test
        @DisplayName("counts days in phase for a duration prerequisite")
        void phaseDuration() {
            FormationState early = state(covenant(T0), reached(day(1), 2), completed(day(1).plusSeconds(300), 2, 300));
            FormationState later = reducer.applyEvent(early, reached(day(3), 1));

            assertThat(service.checkAxiomUnlock(AUTHORITY, early).isUnlocked()).isFalse();
            assertThat(service.checkAxiomUnlock(AUTHORITY, early).getUnmetRequirements())
                    .containsExactly("Spend 3 days in awakening phase (currently: 1 days)");
            assertThat(service.checkAxiomUnlock(AUTHORITY, later).isUnlocked()).isTrue();
        }

        @Test
        @DisplayName("needs both the later phase and readiness")
        void phaseAndReadiness() {
            FormationState separation = state(covenant(T0),
                    phaseStarted(day(30), FormationPhase.SEPARATION, FormationPhase.AWAKENING));
            FormationState ready = reducer.applyEvent(separation, at(day(31), new ReadinessLevelChanged(
                    ReadinessDimension.CANON_ENGAGEMENT, "EMERGING", "DEVELOPING", "test")));

            assertThat(service.checkAxiomUnlock(DISCERNMENT, separation).isUnlocked()).isFalse();
            assertThat(service.checkAxiomUnlock(DISCERNMENT, ready).isUnlocked()).isTrue();
        }

        @Test
        @DisplayName("returns null for an unknown axiom")
        void unknownAxiom() {
            assertThat(service.checkAxiomUnlock("axiom-missing", state(covenant(T0)))).isNull();
            assertThat(service.getAxiomDetails("axiom-missing")).isNull();
        }
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("orders every axiom by title")
        void orderedByTitle() {
            List<String> titles = service.getAllAxiomsWithStatus(state(covenant(T0))).stream()
                    .map(AxiomUnlockResult::getTitle)
                    .collect(Collectors.toList());

            assertThat(titles).containsExactly(
                    "Distinguishing God's Voice",
                    "God's Authority Over All",
                    "Identity in Christ",
                    "The Invitation to Formation");
        }

        @Test
        @DisplayName("filters the catalog by phase")
        void byPhase() {
            assertThat(service.getAxiomsByPhase(FormationPhase.AWAKENING)).hasSize(3);
            assertThat(service.getAxiomsByPhase(FormationPhase.SEPARATION)).hasSize(1);
            assertThat(service.getAxiomsByPhase(FormationPhase.STEWARDSHIP)).isEmpty();
        }

        @Test
        @DisplayName("lists unlocked ids in catalog order")
        void unlockedIds() {
            FormationState state = state(covenant(T0), reached(T0, 1), completed(T0.plusSeconds(300), 1, 300));

            assertThat(service.getUnlockedAxiomIds(state)).containsExactly(IDENTITY);
        }
    }

    @Nested
    @DisplayName("getNewlyUnlockedAxioms")
    class NewlyUnlocked {

        @Test
        @DisplayName("keeps the order of the current list and drops previous ids")
        void setDifference() {
            assertThat(service.getNewlyUnlockedAxioms(List.of("c", "a", "b"), List.of("a")))
                    .containsExactly("c", "b");
        }

        @Test
        @DisplayName("drops repeats")
        void dropsRepeats() {
            assertThat(service.getNewlyUnlockedAxioms(List.of("a", "b", "a"), List.of())).containsExactly("a", "b");
        }

        @Test
        @DisplayName("is empty when nothing new opened")
        void nothingNew() {
            assertThat(service.getNewlyUnlockedAxioms(List.of("a"), List.of("a", "b"))).isEmpty();
        }
    }
}
