package com.ruach.formation.application.service;

import static com.ruach.formation.support.Events.T0;
import static com.ruach.formation.support.Events.USER;
import static com.ruach.formation.support.Events.at;
import static com.ruach.formation.support.Events.completed;
import static com.ruach.formation.support.Events.covenant;
import static com.ruach.formation.support.Events.reached;
import static com.ruach.formation.support.Events.reflection;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.catalog.PhaseCatalog;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.event.CanonAxiomCited;
import com.ruach.formation.domain.event.CanonDefinitionViewed;
import com.ruach.formation.domain.event.ReflectionAnalyzed;
import com.ruach.formation.domain.valueobject.DoctrinalSoundness;
import com.ruach.formation.domain.valueobject.PaceStatus;
import com.ruach.formation.domain.valueobject.ReadinessLevel;
import com.ruach.formation.domain.valueobject.RedFlag;

@DisplayName("ReadinessAnalyzer")
class ReadinessAnalyzerTest {

    private final FormationStateReducer reducer = new FormationStateReducer();
    private final ReadinessAnalyzer analyzer = new ReadinessAnalyzer(ReadinessThresholds.defaults(),
            PhaseCatalog.defaults(), CheckpointCatalog.defaults());

    private static Instant hours(long h) {
        return T0.plus(Duration.ofHours(h));
    }

    private ReadinessIndicators analyze(List<FormationEvent> events, Instant now) {
        FormationState state = reducer.rebuildState(USER, events);
        return analyzer.analyze(state, ReflectionLog.fromEvents(events), now);
    }

    @Test
    @DisplayName("a user with no activity gets the baseline")
    void baselineWithoutActivity() {
        ReadinessIndicators indicators = analyzer.analyze(reducer.createInitialState(USER), ReflectionLog.empty(),
                T0);

        assertThat(indicators).isEqualTo(ReadinessIndicators.baseline());
    }

    @Nested
    @DisplayName("pace")
    class Pace {

        @Test
        @DisplayName("three checkpoints on the first day is too fast")
        void tooFast() {
            List<FormationEvent> events = List.of(
                    covenant(T0),
                    reached(hours(1), 1), completed(hours(2), 1, 3600),
                    reached(hours(3), 2), completed(hours(4), 2, 3600),
                    reached(hours(5), 3), completed(hours(6), 3, 3600));

            assertThat(analyze(events, hours(12)).getPace()).isEqualTo(PaceStatus.TOO_FAST);
        }

        @Test
        @DisplayName("one checkpoint over two days is appropriate")
        void appropriate() {
            List<FormationEvent> events = List.of(
                    covenant(T0),
                    reached(hours(1), 1), completed(hours(2), 1, 3600));

            assertThat(analyze(events, hours(48)).getPace()).isEqualTo(PaceStatus.APPROPRIATE);
        }

        @Test
        @DisplayName("a week without activity is stalled, even after a fast start")
        void stalled() {
            List<FormationEvent> events = List.of(
                    covenant(T0),
                    reached(hours(1), 1), completed(hours(2), 1, 3600),
                    reached(hours(3), 2), completed(hours(4), 2, 3600));

            assertThat(analyze(events, hours(4 + 7 * 24)).getPace()).isEqualTo(PaceStatus.STALLED);
        }
    }

    @Nested
    @DisplayName("reflection depth")
    class Depth {

        @Test
        @DisplayName("two reflections averaging 60 words are developing")
        void developing() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reflection(hours(1), 1, 50), reflection(hours(2), 2, 70));

            assertThat(analyze(events, hours(3)).getReflectionDepth()).isEqualTo(ReadinessLevel.DEVELOPING);
        }

        @Test
        @DisplayName("falls back to emerging just under the average")
        void emerging() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reflection(hours(1), 1, 59), reflection(hours(2), 2, 59));

            assertThat(analyze(events, hours(3)).getReflectionDepth()).isEqualTo(ReadinessLevel.EMERGING);
        }

        @Test
        @DisplayName("six long reflections are maturing")
        void maturing() {
            List<FormationEvent> events = new ArrayList<>();
            events.add(covenant(T0));
            for (int i = 1; i <= 6; i++) {
                events.add(reflection(hours(i), i, 150));
            }

            assertThat(analyze(events, hours(7)).getReflectionDepth()).isEqualTo(ReadinessLevel.MATURING);
        }
    }

    @Nested
    @DisplayName("canon engagement")
    class CanonEngagement {

        @Test
        @DisplayName("citations count double")
        void citationsWeighDouble() {
            List<FormationEvent> events = List.of(covenant(T0),
                    at(hours(1), new CanonDefinitionViewed("axiom-awakening-identity", "Identity", null)),
                    at(hours(2), new CanonAxiomCited("axiom-awakening-identity", "context")));

            assertThat(analyze(events, hours(3)).getCanonEngagement()).isEqualTo(ReadinessLevel.DEVELOPING);
        }

        @Test
        @DisplayName("a single view stays emerging")
        void singleView() {
            List<FormationEvent> events = List.of(covenant(T0),
                    at(hours(1), new CanonDefinitionViewed("axiom-awakening-identity", "Identity", null)));

            assertThat(analyze(events, hours(3)).getCanonEngagement()).isEqualTo(ReadinessLevel.EMERGING);
        }
    }

    @Nested
    @DisplayName("red flags")
    class RedFlags {

        @Test
        @DisplayName("completing faster than the checkpoint's pause is speed running")
        void speedRunning() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reached(T0.plusSeconds(10), 1), completed(T0.plusSeconds(100), 1, 90));

            assertThat(analyze(events, T0.plusSeconds(200)).getRedFlags()).contains(RedFlag.SPEED_RUNNING);
        }

        @Test
        @DisplayName("a full pause is not speed running")
        void fullPause() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reached(T0.plusSeconds(10), 1), completed(T0.plusSeconds(210), 1, 200));

            assertThat(analyze(events, T0.plusSeconds(300)).getRedFlags()).doesNotContain(RedFlag.SPEED_RUNNING);
        }

        @Test
        @DisplayName("a dwell of exactly the speed-run ratio still counts as speed running")
        void speedRunBoundary() {
            // checkpoint-awakening-1 pauses 180 s, so the line sits at 189 s
            List<FormationEvent> atLine = List.of(covenant(T0),
                    reached(T0.plusSeconds(10), 1), completed(T0.plusSeconds(199), 1, 189));
            List<FormationEvent> pastLine = List.of(covenant(T0),
                    reached(T0.plusSeconds(10), 1), completed(T0.plusSeconds(200), 1, 190));

            assertThat(analyze(atLine, T0.plusSeconds(300)).getRedFlags()).contains(RedFlag.SPEED_RUNNING);
            assertThat(analyze(pastLine, T0.plusSeconds(300)).getRedFlags()).doesNotContain(RedFlag.SPEED_RUNNING);
        }

        @Test
        @DisplayName("a reached checkpoint left open past the grace period is missing its reflection")
        void missingReflections() {
            List<FormationEvent> events = List.of(covenant(T0), reached(T0, 1));

            assertThat(analyze(events, hours(71)).getRedFlags()).doesNotContain(RedFlag.MISSING_REFLECTIONS);
            assertThat(analyze(events, hours(72)).getRedFlags()).contains(RedFlag.MISSING_REFLECTIONS);
        }

        @Test
        @DisplayName("mostly short reflections are surface engagement")
        void surfaceEngagement() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reflection(hours(1), 1, 50), reflection(hours(2), 2, 200));

            assertThat(analyze(events, hours(3)).getRedFlags()).contains(RedFlag.SURFACE_ENGAGEMENT);
        }

        @Test
        @DisplayName("a reflection at the word ceiling is still surface")
        void surfaceBoundary() {
            List<FormationEvent> atCeiling = List.of(covenant(T0),
                    reflection(hours(1), 1, 75), reflection(hours(2), 2, 200));
            List<FormationEvent> aboveCeiling = List.of(covenant(T0),
                    reflection(hours(1), 1, 76), reflection(hours(2), 2, 200));

            assertThat(analyze(atCeiling, hours(3)).getRedFlags()).contains(RedFlag.SURFACE_ENGAGEMENT);
            assertThat(analyze(aboveCeiling, hours(3)).getRedFlags()).doesNotContain(RedFlag.SURFACE_ENGAGEMENT);
        }

        @Test
        @DisplayName("regurgitated reflections count as surface even when long")
        void regurgitation() {
            List<FormationEvent> events = List.of(covenant(T0),
                    reflection(hours(1), 1, 200), reflection(hours(2), 2, 200),
                    at(hours(3), new ReflectionAnalyzed("reflection-1", 0.2, true, false,
                            DoctrinalSoundness.SOUND, "suggest_resource")));

            assertThat(analyze(events, hours(4)).getRedFlags()).contains(RedFlag.SURFACE_ENGAGEMENT);
        }

        @Test
        @DisplayName("a single reflection is not enough to judge engagement")
        void tooFewReflections() {
            List<FormationEvent> events = List.of(covenant(T0), reflection(hours(1), 1, 10));

            assertThat(analyze(events, hours(2)).getRedFlags()).doesNotContain(RedFlag.SURFACE_ENGAGEMENT);
        }

        @Test
        @DisplayName("three weeks of silence is disengaged")
        void disengaged() {
            List<FormationEvent> events = List.of(covenant(T0));

            assertThat(analyze(events, T0.plus(Duration.ofDays(21))).getRedFlags()).contains(RedFlag.DISENGAGED);
        }
    }
}
