package com.ruach.formation.adapters.codec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.event.CanonAxiomCited;
import com.ruach.formation.domain.event.CanonDefinitionViewed;
import com.ruach.formation.domain.event.CheckpointCompleted;
import com.ruach.formation.domain.event.CheckpointReached;
import com.ruach.formation.domain.event.ContentGated;
import com.ruach.formation.domain.event.ContentUnlocked;
import com.ruach.formation.domain.event.CovenantEntered;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.FormationGapDetected;
import com.ruach.formation.domain.event.PauseTriggered;
import com.ruach.formation.domain.event.PhaseCompleted;
import com.ruach.formation.domain.event.PhaseStarted;
import com.ruach.formation.domain.event.ReadinessLevelChanged;
import com.ruach.formation.domain.event.RecommendationIssued;
import com.ruach.formation.domain.event.ReflectionAnalyzed;
import com.ruach.formation.domain.event.ReflectionSubmitted;
import com.ruach.formation.domain.event.SectionCompleted;
import com.ruach.formation.domain.event.SectionViewed;
import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.DoctrinalSoundness;
import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.GapSeverity;
import com.ruach.formation.domain.valueobject.GapType;
import com.ruach.formation.domain.valueobject.PauseReason;
import com.ruach.formation.domain.valueobject.PauseSeverity;
import com.ruach.formation.domain.valueobject.ReadinessDimension;
import com.ruach.formation.domain.valueobject.RecommendationType;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * JSON mapping of formation events, shared by the PostgreSQL store and the
 * Kafka consumer.
 * <p>
 * Payloads are stored as flat camelCase objects. Enum values are written as
 * their names and read case-insensitively. A payload missing a required
 * field fails with IllegalArgumentException.
 * </p>
 */
@Component
public class FormationEventCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public FormationEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ─────────────────── JSON ───────────────────

    public String writePayload(EventPayload payload) {
        return writeJson(toMap(payload));
    }

    public EventPayload readPayload(EventType eventType, String json) throws JsonProcessingException {
        return fromMap(eventType, objectMapper.readValue(json, MAP_TYPE));
    }

    public String writeMetadata(EventMetadata metadata) {
        return writeJson(metadata.toMap());
    }

    public EventMetadata readMetadata(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return EventMetadata.empty();
        }
        return EventMetadata.fromMap(objectMapper.readValue(json, MAP_TYPE));
    }

    /**
     * Parses an event envelope as published on the activity topic. A missing
     * id or timestamp is taken from the caller, which derives them from the
     * delivery so a redelivered envelope decodes to the same event.
     *
     * @throws IllegalArgumentException if the envelope has no id and no
     *                                  default id is given
     */
    public FormationEvent readEvent(String json, String defaultId, Instant defaultTimestamp)
            throws JsonProcessingException {
        EventEnvelopeDto dto = objectMapper.readValue(json, EventEnvelopeDto.class);
        if (dto.eventType == null) {
            throw new IllegalArgumentException("event_type is required");
        }
        String id = dto.id != null ? dto.id : defaultId;
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        EventType type = EventType.fromWireName(dto.eventType);
        return new FormationEvent(
                id,
                dto.userId,
                dto.timestamp != null ? Instant.parse(dto.timestamp) : defaultTimestamp,
                fromMap(type, dto.payload != null ? dto.payload : Map.of()),
                EventMetadata.fromMap(dto.metadata));
    }

    public String writeEvent(FormationEvent event) {
        EventEnvelopeDto dto = new EventEnvelopeDto();
        dto.id = event.getId();
        dto.userId = event.getUserId();
        dto.eventType = event.getEventType().getWireName();
        dto.timestamp = event.getTimestamp().toString();
        dto.payload = toMap(event.getPayload());
        dto.metadata = new LinkedHashMap<>(event.getMetadata().toMap());
        return writeJson(dto);
    }

    // ─────────────────── Payload ↔ Map ───────────────────

    public Map<String, Object> toMap(EventPayload payload) {
        Map<String, Object> m = new LinkedHashMap<>();
        switch (payload.eventType()) {
            case COVENANT_ENTERED -> {
                CovenantEntered p = (CovenantEntered) payload;
                m.put("covenantType", p.getCovenantType().name());
                m.put("acknowledgedTerms", p.isAcknowledgedTerms());
            }
            case PHASE_STARTED -> {
                PhaseStarted p = (PhaseStarted) payload;
                m.put("phase", p.getPhase().name());
                m.put("previousPhase", p.getPreviousPhase() != null ? p.getPreviousPhase().name() : null);
            }
            case PHASE_COMPLETED -> {
                PhaseCompleted p = (PhaseCompleted) payload;
                m.put("phase", p.getPhase().name());
                m.put("daysInPhase", p.getDaysInPhase());
                m.put("checkpointsCompleted", p.getCheckpointsCompleted());
                m.put("reflectionsSubmitted", p.getReflectionsSubmitted());
            }
            case SECTION_VIEWED -> {
                SectionViewed p = (SectionViewed) payload;
                m.put("sectionId", p.getSectionId());
                m.put("phase", p.getPhase().name());
                m.put("dwellTimeSeconds", p.getDwellTimeSeconds());
            }
            case SECTION_COMPLETED -> {
                SectionCompleted p = (SectionCompleted) payload;
                m.put("sectionId", p.getSectionId());
                m.put("phase", p.getPhase().name());
                m.put("totalDwellTimeSeconds", p.getTotalDwellTimeSeconds());
            }
            case CHECKPOINT_REACHED -> {
                CheckpointReached p = (CheckpointReached) payload;
                m.put("checkpointId", p.getCheckpointId());
                m.put("sectionId", p.getSectionId());
                m.put("phase", p.getPhase().name());
            }
            case CHECKPOINT_COMPLETED -> {
                CheckpointCompleted p = (CheckpointCompleted) payload;
                m.put("checkpointId", p.getCheckpointId());
                m.put("sectionId", p.getSectionId());
                m.put("phase", p.getPhase().name());
                m.put("reflectionId", p.getReflectionId());
                m.put("timeSinceReached", p.getTimeSinceReached());
            }
            case REFLECTION_SUBMITTED -> {
                ReflectionSubmitted p = (ReflectionSubmitted) payload;
                m.put("reflectionId", p.getReflectionId());
                m.put("checkpointId", p.getCheckpointId());
                m.put("type", p.getType().name());
                m.put("wordCount", p.getWordCount());
                m.put("timeSinceCheckpointReached", p.getTimeSinceCheckpointReached());
            }
            case REFLECTION_ANALYZED -> {
                ReflectionAnalyzed p = (ReflectionAnalyzed) payload;
                m.put("reflectionId", p.getReflectionId());
                m.put("depthScore", p.getDepthScore());
                m.put("isRegurgitation", p.isRegurgitation());
                m.put("showsWrestling", p.isShowsWrestling());
                m.put("doctrinalSoundness", p.getDoctrinalSoundness().name());
                m.put("recommendedAction", p.getRecommendedAction());
            }
            case CANON_DEFINITION_VIEWED -> {
                CanonDefinitionViewed p = (CanonDefinitionViewed) payload;
                m.put("axiomId", p.getAxiomId());
                m.put("term", p.getTerm());
                m.put("context", p.getContext());
            }
            case CANON_AXIOM_CITED -> {
                CanonAxiomCited p = (CanonAxiomCited) payload;
                m.put("axiomId", p.getAxiomId());
                m.put("citationContext", p.getCitationContext());
            }
            case PAUSE_TRIGGERED -> {
                PauseTriggered p = (PauseTriggered) payload;
                m.put("reason", p.getReason().name());
                m.put("context", p.getContext());
                m.put("severity", p.getSeverity().name());
            }
            case RECOMMENDATION_ISSUED -> {
                RecommendationIssued p = (RecommendationIssued) payload;
                m.put("recommendationType", p.getRecommendationType().name());
                m.put("targetId", p.getTargetId());
                m.put("reason", p.getReason());
            }
            case CONTENT_UNLOCKED -> {
                ContentUnlocked p = (ContentUnlocked) payload;
                m.put("contentType", p.getContentType().name());
                m.put("contentId", p.getContentId());
                m.put("reason", p.getReason());
            }
            case CONTENT_GATED -> {
                ContentGated p = (ContentGated) payload;
                m.put("contentType", p.getContentType().name());
                m.put("contentId", p.getContentId());
                m.put("reason", p.getReason());
                m.put("requirementsNeeded", p.getRequirementsNeeded());
            }
            case READINESS_LEVEL_CHANGED -> {
                ReadinessLevelChanged p = (ReadinessLevelChanged) payload;
                m.put("dimension", p.getDimension().name());
                m.put("previousLevel", p.getPreviousLevel());
                m.put("newLevel", p.getNewLevel());
                m.put("reason", p.getReason());
            }
            case FORMATION_GAP_DETECTED -> {
                FormationGapDetected p = (FormationGapDetected) payload;
                m.put("gapType", p.getGapType().name());
                m.put("area", p.getArea());
                m.put("severity", p.getSeverity().name());
                m.put("recommendation", p.getRecommendation());
            }
        }
        return m;
    }

    public EventPayload fromMap(EventType eventType, Map<String, ?> m) {
        return switch (eventType) {
            case COVENANT_ENTERED -> new CovenantEntered(
                    enumValue(CovenantType.class, m, "covenantType"), bool(m, "acknowledgedTerms"));
            case PHASE_STARTED -> new PhaseStarted(
                    enumValue(FormationPhase.class, m, "phase"), optionalEnum(FormationPhase.class, m, "previousPhase"));
            case PHASE_COMPLETED -> new PhaseCompleted(
                    enumValue(FormationPhase.class, m, "phase"), number(m, "daysInPhase").longValue(),
                    number(m, "checkpointsCompleted").intValue(), number(m, "reflectionsSubmitted").intValue());
            case SECTION_VIEWED -> new SectionViewed(
                    text(m, "sectionId"), enumValue(FormationPhase.class, m, "phase"),
                    number(m, "dwellTimeSeconds").longValue());
            case SECTION_COMPLETED -> new SectionCompleted(
                    text(m, "sectionId"), enumValue(FormationPhase.class, m, "phase"),
                    number(m, "totalDwellTimeSeconds").longValue());
            case CHECKPOINT_REACHED -> new CheckpointReached(
                    text(m, "checkpointId"), text(m, "sectionId"), enumValue(FormationPhase.class, m, "phase"));
            case CHECKPOINT_COMPLETED -> new CheckpointCompleted(
                    text(m, "checkpointId"), text(m, "sectionId"), enumValue(FormationPhase.class, m, "phase"),
                    text(m, "reflectionId"), number(m, "timeSinceReached").longValue());
            case REFLECTION_SUBMITTED -> new ReflectionSubmitted(
                    text(m, "reflectionId"), text(m, "checkpointId"), enumValue(ReflectionType.class, m, "type"),
                    number(m, "wordCount").intValue(), number(m, "timeSinceCheckpointReached").longValue());
            case REFLECTION_ANALYZED -> new ReflectionAnalyzed(
                    text(m, "reflectionId"), number(m, "depthScore").doubleValue(), bool(m, "isRegurgitation"),
                    bool(m, "showsWrestling"), enumValue(DoctrinalSoundness.class, m, "doctrinalSoundness"),
                    text(m, "recommendedAction"));
            case CANON_DEFINITION_VIEWED -> new CanonDefinitionViewed(
                    text(m, "axiomId"), text(m, "term"), text(m, "context"));
            case CANON_AXIOM_CITED -> new CanonAxiomCited(text(m, "axiomId"), text(m, "citationContext"));
            case PAUSE_TRIGGERED -> new PauseTriggered(
                    enumValue(PauseReason.class, m, "reason"), text(m, "context"),
                    enumValue(PauseSeverity.class, m, "severity"));
            case RECOMMENDATION_ISSUED -> new RecommendationIssued(
                    enumValue(RecommendationType.class, m, "recommendationType"), text(m, "targetId"),
                    text(m, "reason"));
            case CONTENT_UNLOCKED -> new ContentUnlocked(
                    enumValue(ContentType.class, m, "contentType"), text(m, "contentId"), text(m, "reason"));
            case CONTENT_GATED -> new ContentGated(
                    enumValue(ContentType.class, m, "contentType"), text(m, "contentId"), text(m, "reason"),
                    textList(m, "requirementsNeeded"));
            case READINESS_LEVEL_CHANGED -> new ReadinessLevelChanged(
                    enumValue(ReadinessDimension.class, m, "dimension"), text(m, "previousLevel"),
                    text(m, "newLevel"), text(m, "reason"));
            case FORMATION_GAP_DETECTED -> new FormationGapDetected(
                    enumValue(GapType.class, m, "gapType"), text(m, "area"),
                    enumValue(GapSeverity.class, m, "severity"), text(m, "recommendation"));
        };
    }

    // ─────────────────── Private Helpers ───────────────────

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String text(Map<String, ?> m, String field) {
        Object value = m.get(field);
        return value != null ? value.toString() : null;
    }

    private static Number number(Map<String, ?> m, String field) {
        Object value = m.get(field);
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Double.valueOf((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not a number: " + value, e);
            }
        }
        throw new IllegalArgumentException(field + " is required");
    }

    private static boolean bool(Map<String, ?> m, String field) {
        Object value = m.get(field);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, Map<String, ?> m, String field) {
        E value = optionalEnum(type, m, field);
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static <E extends Enum<E>> E optionalEnum(Class<E> type, Map<String, ?> m, String field) {
        String raw = text(m, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Enum.valueOf(type, raw.trim().toUpperCase());
    }

    private static List<String> textList(Map<String, ?> m, String field) {
        Object value = m.get(field);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    // ─────────────────── Inner DTO Classes ───────────────────

    /**
     * Wire envelope of an event on the activity topic.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventEnvelopeDto {

        @JsonProperty("id")
        private String id;

        @JsonProperty("user_id")
        private String userId;

        @JsonProperty("event_type")
        private String eventType;

        @JsonProperty("timestamp")
        private String timestamp;

        @JsonProperty("payload")
        private Map<String, Object> payload;

        @JsonProperty("metadata")
        private Map<String, Object> metadata;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getEventType() {
            return eventType;
        }

        public void setEventType(String eventType) {
            this.eventType = eventType;
        }

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }

        public Map<String, Object> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }
    }
}
