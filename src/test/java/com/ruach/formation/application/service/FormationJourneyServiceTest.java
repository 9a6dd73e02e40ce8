package com.ruach.formation.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.ruach.formation.adapters.out.memory.InMemoryFormationEventStore;
import com.ruach.formation.application.guard.FormationDataCache;
import com.ruach.formation.application.port.out.FormationNotificationPublisher;
import com.ruach.formation.domain.catalog.AxiomCatalog;
import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.catalog.PhaseCatalog;
import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationGap;
import com.ruach.formation.domain.event.CanonAxiomCited;
import com.ruach.formation.domain.event.CanonDefinitionViewed;
import com.ruach.formation.domain.event.CheckpointReached;
import com.ruach.formation.domain.event.ContentGated;
import com.ruach.formation.domain.event.ContentUnlocked;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.ReflectionAnalyzed;
import com.ruach.formation.domain.event.SectionViewed;
import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.DoctrinalSoundness;
import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.RedFlag;
import com.ruach.formation.support.Events;
import com.ruach.formation.support.MutableClock;

@DisplayName("FormationJourneyService")
class FormationJourneyServiceTest {

    private static final String USER = Events.USER;

    private MutableClock clock;
    private InMemoryFormationEventStore eventStore;
    private FormationNotificationPublisher publisher;
    private FormationJourneyService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Events.T0);
        eventStore = spy(new InMemoryFormationEventStore());
        publisher = mock(FormationNotificationPublisher.class);

        CheckpointCatalog checkpoints = new CheckpointCatalog(List.of(
                new Checkpoint("checkpoint-awakening-1", "awakening-1", FormationPhase.AWAKENING, 1, "", 60, true),
                new Checkpoint("checkpoint-awakening-2", "awakening-2", FormationPhase.AWAKENING, 2, "", 60, true),
                new Checkpoint("checkpoint-awakening-3", "awakening-3", FormationPhase.AWAKENING, 3, "", 60, true),
                new Checkpoint("checkpoint-separation-1", "separation-1", FormationPhase.SEPARATION, 1, "", 60,
                        true)));
        PhaseCatalog phases = PhaseCatalog.defaults();

        service = new FormationJourneyService(eventStore, new FormationStateReducer(),
                new FormationEventFactory(clock), checkpoints, new AxiomUnlockService(AxiomCatalog.defaults()),
                new ReadinessAnalyzer(ReadinessThresholds.builder().build(), phases, checkpoints),
                new ReadinessRecommender(), new PhaseProgressionPolicy(phases), publisher,
                new FormationDataCache<>(clock, 100), 30_000, clock);
    }

    private void enter() {
        service.enterCovenant(USER, CovenantType.FORMATION_JOURNEY, EventMetadata.empty());
    }

    private List<EventType> recordedTypes() {
        return eventStore.findByUserId(USER).stream()
                .map(FormationEvent::getEventType)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("covenant")
    class Covenant {

        @Test
        @DisplayName("records the covenant and starts the first phase")
        void startsJourney() {
            FormationEvent event = service.enterCovenant(USER, CovenantType.FORMATION_JOURNEY,
                    new EventMetadata(null, "test-agent", "session-1", null));

            assertThat(event.getEventType()).isEqualTo(EventType.COVENANT_ENTERED);
            assertThat(event.getMetadata().toMap()).containsEntry("sessionId", "session-1");
            assertThat(recordedTypes()).containsExactly(EventType.COVENANT_ENTERED, EventType.PHASE_STARTED);
            assertThat(service.getState(USER).getCovenantType()).isEqualTo(CovenantType.FORMATION_JOURNEY);
        }

        @Test
        @DisplayName("cannot be entered twice")
        void onlyOnce() {
            enter();

            assertThatThrownBy(() -> service.enterCovenant(USER, CovenantType.FORMATION_JOURNEY, null))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(eventStore.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("checkpoints")
    class Checkpoints {

        @Test
        @DisplayName("reaching a checkpoint of the current phase is recorded")
        void reach() {
            enter();

            service.reachCheckpoint(USER, "checkpoint-awakening-1", EventMetadata.empty());

            assertThat(service.getState(USER).isCheckpointReached("checkpoint-awakening-1")).isTrue();
        }

        @Test
        @DisplayName("an unknown checkpoint is rejected")
        void unknown() {
            assertThatThrownBy(() -> service.reachCheckpoint(USER, "checkpoint-nowhere-1", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a checkpoint of a later phase is out of order")
        void laterPhase() {
            enter();

            assertThatThrownBy(() -> service.reachCheckpoint(USER, "checkpoint-separation-1", null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("SEPARATION");
        }
    }

    @Nested
    @DisplayName("canon")
    class Canon {

        @Test
        @DisplayName("a locked axiom records ContentGated with what is missing")
        void gated() {
            enter();

            FormationEvent event = service.viewCanonDefinition(USER, "axiom-awakening-authority", null, null,
                    EventMetadata.empty());

            assertThat(event.getEventType()).isEqualTo(EventType.CONTENT_GATED);
            assertThat(event.payloadAs(ContentGated.class).getContentId()).isEqualTo("axiom-awakening-authority");
            assertThat(service.getState(USER).getCanonDefinitionsViewed()).isZero();
        }

        @Test
        @DisplayName("an open axiom records the view, defaulting the term to its title")
        void viewed() {
            eventStore.append(List.of(
                    Events.covenant(Events.T0),
                    Events.phaseStarted(Events.T0, FormationPhase.AWAKENING, null),
                    Events.reached(Events.T0.plusSeconds(60), 1),
                    Events.completed(Events.T0.plusSeconds(600), 1, 540)));
            clock.advance(Duration.ofHours(1));

            FormationEvent event = service.viewCanonDefinition(USER, "axiom-awakening-identity", " ",
                    "sidebar", EventMetadata.empty());

            assertThat(event.getEventType()).isEqualTo(EventType.CANON_DEFINITION_VIEWED);
            assertThat(event.payloadAs(CanonDefinitionViewed.class).getTerm()).isEqualTo("Identity in Christ");
            assertThat(service.getState(USER).getCanonDefinitionsViewed()).isEqualTo(1);
        }

        @Test
        @DisplayName("viewing or citing an unknown axiom is rejected")
        void unknownAxiom() {
            assertThatThrownBy(() -> service.viewCanonDefinition(USER, "axiom-missing", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.citeAxiom(USER, "axiom-missing", "essay", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an unknown axiom status is null")
        void unknownStatus() {
            assertThat(service.getAxiomStatus(USER, "axiom-missing")).isNull();
            assertThat(service.getAxiomStatus(USER, "axiom-awakening-identity").isUnlocked()).isFalse();
        }

        @Test
        @DisplayName("statuses are cached until the log grows")
        void statusCache() {
            enter();

            List<AxiomUnlockResult> first = service.getAxiomStatuses(USER);
            List<AxiomUnlockResult> second = service.getAxiomStatuses(USER);
            service.reachCheckpoint(USER, "checkpoint-awakening-1", EventMetadata.empty());
            List<AxiomUnlockResult> third = service.getAxiomStatuses(USER);

            assertThat(second).isSameAs(first);
            assertThat(third).isNotSameAs(first);
            assertThat(first).hasSize(4);
        }
    }

    @Nested
    @DisplayName("phase advance")
    class PhaseAdvance {

        private void completeAwakening() {
            eventStore.append(List.of(
                    Events.covenant(Events.T0),
                    Events.phaseStarted(Events.T0, FormationPhase.AWAKENING, null),
                    Events.completed(Events.T0.plus(Duration.ofDays(2)), 1, 600),
                    Events.completed(Events.T0.plus(Duration.ofDays(9)), 2, 600),
                    Events.completed(Events.T0.plus(Duration.ofDays(16)), 3, 600)));
        }

        @Test
        @DisplayName("moves to the next phase once days and checkpoints are met")
        void advances() {
            completeAwakening();
            clock.set(Events.T0.plus(Duration.ofDays(31)));

            assertThat(service.advancePhase(USER)).isTrue();

            assertThat(service.getState(USER).getCurrentPhase()).isEqualTo(FormationPhase.SEPARATION);
            assertThat(recordedTypes()).contains(EventType.PHASE_COMPLETED);
            ArgumentCaptor<FormationNotification> captor = ArgumentCaptor.forClass(FormationNotification.class);
            verify(publisher).publish(captor.capture());
            assertThat(captor.getValue().kind()).isEqualTo(FormationNotification.Kind.PHASE_STARTED);
        }

        @Test
        @DisplayName("stays put while the phase is too young")
        void tooEarly() {
            completeAwakening();
            clock.set(Events.T0.plus(Duration.ofDays(20)));

            assertThat(service.advancePhase(USER)).isFalse();

            assertThat(service.getState(USER).getCurrentPhase()).isEqualTo(FormationPhase.AWAKENING);
            verify(publisher, never()).publish(any());
            PhaseAdvanceDecision decision = service.getPhaseStatus(USER);
            assertThat(decision.daysInPhase()).isEqualTo(20);
            assertThat(decision.checkpointsCompleted()).isEqualTo(3);
        }

        @Test
        @DisplayName("a failing notification still advances")
        void notificationFailure() {
            completeAwakening();
            clock.set(Events.T0.plus(Duration.ofDays(31)));
            doThrow(new RuntimeException("broker down")).when(publisher).publish(any());

            assertThat(service.advancePhase(USER)).isTrue();
            assertThat(service.getState(USER).getCurrentPhase()).isEqualTo(FormationPhase.SEPARATION);
        }
    }

    @Nested
    @DisplayName("readiness")
    class Readiness {

        @Test
        @DisplayName("an idle user is flagged and a gap is recorded")
        void idleUser() {
            eventStore.append(List.of(
                    Events.covenant(Events.T0),
                    Events.phaseStarted(Events.T0, FormationPhase.AWAKENING, null)));
            clock.set(Events.T0.plus(Duration.ofDays(22)));

            assertThat(service.getReadiness(USER).getRedFlags())
                    .contains(RedFlag.DISENGAGED);

            int recorded = service.refreshReadiness(USER);

            assertThat(recorded).isGreaterThanOrEqualTo(2);
            assertThat(recordedTypes()).contains(EventType.READINESS_LEVEL_CHANGED,
                    EventType.FORMATION_GAP_DETECTED);
            assertThat(service.getState(USER).getFormationGaps())
                    .extracting(FormationGap::getArea)
                    .contains("engagement");
        }

        @Test
        @DisplayName("a user with no history derives the baseline and records nothing")
        void noHistory() {
            assertThat(service.refreshReadiness(USER)).isZero();
            verify(eventStore, never()).append(any());
        }
    }

    @Nested
    @DisplayName("activity feed")
    class ActivityFeed {

        private FormationEvent incoming(String id, EventPayload payload) {
            return new FormationEvent(id, USER, Events.T0.plusSeconds(120), payload,
                    new EventMetadata(null, null, "session-9", null));
        }

        @Test
        @DisplayName("a section view is stored once under its own id, in the user's current phase")
        void sectionViewOnce() {
            enter();
            FormationEvent event = incoming("evt-section",
                    new SectionViewed("awakening-1", FormationPhase.COMMISSION, 45));

            service.record(event);
            service.record(event);

            List<FormationEvent> views = eventStore.findByUserId(USER).stream()
                    .filter(e -> e.getEventType() == EventType.SECTION_VIEWED)
                    .collect(Collectors.toList());
            assertThat(views).hasSize(1);
            assertThat(views.get(0).getId()).isEqualTo("evt-section");
            assertThat(views.get(0).getTimestamp()).isEqualTo(Events.T0.plusSeconds(120));
            assertThat(views.get(0).payloadAs(SectionViewed.class).getPhase()).isEqualTo(FormationPhase.AWAKENING);
        }

        @Test
        @DisplayName("viewing a locked axiom is gated, not unlocked")
        void lockedCanonView() {
            enter();

            FormationEvent stored = service.record(incoming("evt-canon",
                    new CanonDefinitionViewed("axiom-separation-discernment", "discernment", null)));

            assertThat(stored.getEventType()).isEqualTo(EventType.CONTENT_GATED);
            assertThat(stored.getId()).isEqualTo("evt-canon");
            assertThat(service.getState(USER).getUnlockedCanonAxioms()).isEmpty();
            assertThat(service.getState(USER).getCanonDefinitionsViewed()).isZero();
            assertThat(service.getAxiomStatus(USER, "axiom-separation-discernment").isUnlocked()).isFalse();
        }

        @Test
        @DisplayName("a checkpoint of a later phase is out of order")
        void laterCheckpoint() {
            enter();

            assertThatThrownBy(() -> service.record(incoming("evt-cp",
                    new CheckpointReached("checkpoint-separation-1", "separation-1", FormationPhase.SEPARATION))))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(eventStore.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("citing an unknown axiom is rejected")
        void unknownCitation() {
            assertThatThrownBy(() -> service.record(incoming("evt-cite",
                    new CanonAxiomCited("axiom-missing", "essay"))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("analyzer results are stored as delivered")
        void analyzerResult() {
            FormationEvent event = incoming("evt-analysis",
                    new ReflectionAnalyzed("reflection-1", 0.7, false, true, DoctrinalSoundness.SOUND, null));

            assertThat(service.record(event)).isEqualTo(event);
            assertThat(eventStore.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("engine-issued, completion and covenant events are refused")
        void refused() {
            enter();

            assertThatThrownBy(() -> service.record(incoming("evt-unlock",
                    new ContentUnlocked(ContentType.CANON, "axiom-separation-discernment", "forged"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("content_unlocked");
            assertThatThrownBy(() -> service.record(Events.completed(Events.T0.plusSeconds(60), 1, 540)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("checkpoint_completed");
            assertThatThrownBy(() -> service.record(Events.covenant(Events.T0)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(eventStore.size()).isEqualTo(2);
        }
    }
}
