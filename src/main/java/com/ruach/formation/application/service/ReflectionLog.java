package com.ruach.formation.application.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.Reflection;
import com.ruach.formation.domain.event.ReflectionAnalyzed;
import com.ruach.formation.domain.event.ReflectionSubmitted;
import com.ruach.formation.domain.valueobject.EventType;

/**
 * A user's reflections, rebuilt from ReflectionSubmitted and
 * ReflectionAnalyzed events in replay order.
 * <p>
 * Content is not part of the event log, so rebuilt reflections carry
 * structure and analysis only.
 * </p>
 */
public final class ReflectionLog {

    private final List<Reflection> reflections;

    private ReflectionLog(List<Reflection> reflections) {
        this.reflections = Collections.unmodifiableList(reflections);
    }

    public static ReflectionLog empty() {
        return new ReflectionLog(List.of());
    }

    public static ReflectionLog fromEvents(List<FormationEvent> events) {
        List<FormationEvent> ordered = new ArrayList<>(events);
        ordered.sort(FormationEvent.REPLAY_ORDER);

        Map<String, Reflection> byId = new LinkedHashMap<>();
        for (FormationEvent event : ordered) {
            if (event.getEventType() == EventType.REFLECTION_SUBMITTED) {
                ReflectionSubmitted submitted = event.payloadAs(ReflectionSubmitted.class);
                byId.putIfAbsent(submitted.getReflectionId(), new Reflection(
                        submitted.getReflectionId(),
                        submitted.getCheckpointId(),
                        submitted.getType(),
                        null,
                        submitted.getWordCount(),
                        event.getTimestamp(),
                        submitted.getTimeSinceCheckpointReached()));
            } else if (event.getEventType() == EventType.REFLECTION_ANALYZED) {
                ReflectionAnalyzed analyzed = event.payloadAs(ReflectionAnalyzed.class);
                // Analysis of an unknown reflection has nothing to attach to
                byId.computeIfPresent(analyzed.getReflectionId(),
                        (id, reflection) -> reflection.withAnalysis(analyzed));
            }
        }
        return new ReflectionLog(new ArrayList<>(byId.values()));
    }

    public List<Reflection> getReflections() {
        return reflections;
    }

    public int size() {
        return reflections.size();
    }

    public boolean isEmpty() {
        return reflections.isEmpty();
    }

    /**
     * @return mean word count, 0 when empty
     */
    public double averageWordCount() {
        return reflections.stream().mapToInt(Reflection::getWordCount).average().orElse(0.0);
    }
}
