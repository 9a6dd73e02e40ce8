package com.ruach.formation.adapters.in.rest;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ruach.formation.adapters.codec.FormationEventCodec;
import com.ruach.formation.application.guard.ValidationError;
import com.ruach.formation.application.port.in.FormationQueryUseCase;
import com.ruach.formation.application.port.in.RecordActivityUseCase;
import com.ruach.formation.application.port.in.ReflectionSubmission;
import com.ruach.formation.application.port.in.SubmitReflectionUseCase;
import com.ruach.formation.application.service.AxiomUnlockResult;
import com.ruach.formation.application.service.PhaseAdvanceDecision;
import com.ruach.formation.application.service.SubmissionResult;
import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * REST inbound adapter for a single user's formation journey.
 * <p>
 * Activity endpoints append events; query endpoints rebuild state from the
 * log. Error mapping lives in {@link FormationExceptionHandler}.
 * </p>
 */
@RestController
@RequestMapping("/api/formation/users/{userId}")
public class FormationController {

    private static final Logger log = LoggerFactory.getLogger(FormationController.class);

    private final RecordActivityUseCase recordActivityUseCase;
    private final SubmitReflectionUseCase submitReflectionUseCase;
    private final FormationQueryUseCase formationQueryUseCase;
    private final FormationEventCodec codec;

    public FormationController(RecordActivityUseCase recordActivityUseCase,
            SubmitReflectionUseCase submitReflectionUseCase,
            FormationQueryUseCase formationQueryUseCase,
            FormationEventCodec codec) {
        this.recordActivityUseCase = recordActivityUseCase;
        this.submitReflectionUseCase = submitReflectionUseCase;
        this.formationQueryUseCase = formationQueryUseCase;
        this.codec = codec;
    }

    // ─────────────────── Activity ───────────────────

    @PostMapping("/covenant")
    public ResponseEntity<Map<String, Object>> enterCovenant(
            @PathVariable String userId,
            @RequestBody(required = false) CovenantRequest request,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) {
        CovenantType type = request != null && request.covenantType() != null
                ? CovenantType.valueOf(request.covenantType().trim().toUpperCase())
                : CovenantType.FORMATION_JOURNEY;
        FormationEvent event = recordActivityUseCase.enterCovenant(userId, type, metadata(userAgent, sessionId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toEventView(event));
    }

    @PostMapping("/checkpoints/{checkpointId}/reach")
    public ResponseEntity<Map<String, Object>> reachCheckpoint(
            @PathVariable String userId,
            @PathVariable String checkpointId,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) {
        FormationEvent event = recordActivityUseCase.reachCheckpoint(userId, checkpointId,
                metadata(userAgent, sessionId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toEventView(event));
    }

    @PostMapping("/sections/{sectionId}/view")
    public ResponseEntity<Map<String, Object>> viewSection(
            @PathVariable String userId,
            @PathVariable String sectionId,
            @RequestBody(required = false) SectionViewRequest request,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) {
        long dwell = request != null && request.dwellTimeSeconds() != null ? request.dwellTimeSeconds() : 0L;
        FormationEvent event = recordActivityUseCase.viewSection(userId, sectionId, dwell,
                metadata(userAgent, sessionId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toEventView(event));
    }

    /**
     * Responds 201 with the view event, or 403 with the unmet requirements
     * when the axiom is still gated.
     */
    @PostMapping("/canon/{axiomId}/view")
    public ResponseEntity<Map<String, Object>> viewCanonDefinition(
            @PathVariable String userId,
            @PathVariable String axiomId,
            @RequestBody(required = false) CanonViewRequest request,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) {
        FormationEvent event = recordActivityUseCase.viewCanonDefinition(userId, axiomId,
                request != null ? request.term() : null,
                request != null ? request.context() : null,
                metadata(userAgent, sessionId));
        HttpStatus status = event.getEventType() == EventType.CONTENT_GATED
                ? HttpStatus.FORBIDDEN
                : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(toEventView(event));
    }

    @PostMapping("/canon/{axiomId}/cite")
    public ResponseEntity<Map<String, Object>> citeAxiom(
            @PathVariable String userId,
            @PathVariable String axiomId,
            @RequestBody CitationRequest request,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) {
        FormationEvent event = recordActivityUseCase.citeAxiom(userId, axiomId, request.citationContext(),
                metadata(userAgent, sessionId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toEventView(event));
    }

    /**
     * 201 when accepted, 200 when the first outcome is replayed, 422 with the
     * error list when rejected.
     */
    @PostMapping("/reflections")
    public ResponseEntity<Map<String, Object>> submitReflection(
            @PathVariable String userId,
            @RequestBody ReflectionRequest request,
            @RequestHeader(name = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestHeader(name = "User-Agent", required = false) String userAgent,
            @RequestHeader(name = "X-Session-Id", required = false) String sessionId) throws Exception {
        ReflectionType type = request.type() != null
                ? ReflectionType.valueOf(request.type().trim().toUpperCase())
                : ReflectionType.TEXT;
        String key = idempotencyKey != null ? idempotencyKey : request.idempotencyKey();

        SubmissionResult result = submitReflectionUseCase.submitReflection(new ReflectionSubmission(
                userId, request.checkpointId(), request.content(), type, key, metadata(userAgent, sessionId)));

        log.info("action=reflection_request userId={} checkpointId={} status={}",
                userId, request.checkpointId(), result.getStatus());

        HttpStatus status = switch (result.getStatus()) {
            case ACCEPTED -> HttpStatus.CREATED;
            case REPLAYED -> HttpStatus.OK;
            case REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return ResponseEntity.status(status).body(toSubmissionView(result));
    }

    @PostMapping("/phase/advance")
    public ResponseEntity<Map<String, Object>> advancePhase(@PathVariable String userId) {
        boolean advanced = recordActivityUseCase.advancePhase(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("advanced", advanced);
        body.put("phase", toPhaseView(formationQueryUseCase.getPhaseStatus(userId)));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/readiness/refresh")
    public ResponseEntity<Map<String, Object>> refreshReadiness(@PathVariable String userId) {
        int recorded = recordActivityUseCase.refreshReadiness(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventsRecorded", recorded);
        body.put("readiness", toReadinessView(formationQueryUseCase.getReadiness(userId)));
        return ResponseEntity.ok(body);
    }

    // ─────────────────── Queries ───────────────────

    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> getState(@PathVariable String userId) {
        return ResponseEntity.ok(toStateView(formationQueryUseCase.getState(userId)));
    }

    @GetMapping("/readiness")
    public ResponseEntity<Map<String, Object>> getReadiness(@PathVariable String userId) {
        return ResponseEntity.ok(toReadinessView(formationQueryUseCase.getReadiness(userId)));
    }

    @GetMapping("/axioms")
    public ResponseEntity<List<Map<String, Object>>> getAxioms(@PathVariable String userId) {
        List<Map<String, Object>> axioms = formationQueryUseCase.getAxiomStatuses(userId).stream()
                .map(this::toAxiomView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(axioms);
    }

    @GetMapping("/axioms/{axiomId}")
    public ResponseEntity<Map<String, Object>> getAxiom(@PathVariable String userId,
            @PathVariable String axiomId) {
        AxiomUnlockResult status = formationQueryUseCase.getAxiomStatus(userId, axiomId);
        if (status == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Unknown axiom: " + axiomId));
        }
        return ResponseEntity.ok(toAxiomView(status));
    }

    @GetMapping("/phase")
    public ResponseEntity<Map<String, Object>> getPhase(@PathVariable String userId) {
        return ResponseEntity.ok(toPhaseView(formationQueryUseCase.getPhaseStatus(userId)));
    }

    // ─────────────────── Views ───────────────────

    private EventMetadata metadata(String userAgent, String sessionId) {
        Map<String, Object> values = new HashMap<>();
        values.put("userAgent", userAgent);
        values.put("sessionId", sessionId);
        return EventMetadata.fromMap(values);
    }

    private Map<String, Object> toEventView(FormationEvent event) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("eventId", event.getId());
        view.put("userId", event.getUserId());
        view.put("eventType", event.getEventType().getWireName());
        view.put("timestamp", event.getTimestamp().toString());
        view.put("payload", codec.toMap(event.getPayload()));
        return view;
    }

    private Map<String, Object> toSubmissionView(SubmissionResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", result.getStatus().name());
        view.put("checkpointId", result.getCheckpointId());
        if (result.isRejected()) {
            view.put("errors", result.getErrors().stream().map(this::toErrorView).collect(Collectors.toList()));
            return view;
        }
        view.put("reflectionId", result.getReflectionId());
        view.put("eventIds", result.getEventIds());
        view.put("newlyUnlockedAxioms", result.getNewlyUnlockedAxioms());
        view.put("reflectionsSubmitted", result.getReflectionsSubmitted());
        view.put("submittedAt", result.getSubmittedAt() != null ? result.getSubmittedAt().toString() : null);
        return view;
    }

    private Map<String, Object> toErrorView(ValidationError error) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("field", error.getField());
        view.put("code", error.getCode());
        view.put("message", error.getMessage());
        view.put("details", error.getDetails());
        return view;
    }

    private Map<String, Object> toStateView(FormationState state) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("userId", state.getUserId());
        view.put("covenantType", state.getCovenantType() != null ? state.getCovenantType().name() : null);
        view.put("currentPhase", state.getCurrentPhase().name());
        view.put("phaseEnteredAt", state.getPhaseEnteredAt().toString());
        view.put("daysInPhase", state.getDaysInPhase());
        view.put("sectionsViewed", state.getSectionsViewed());
        view.put("checkpointsReached", state.getCheckpointsReached());
        view.put("checkpointsCompleted", state.getCheckpointsCompleted());
        view.put("reflectionsSubmitted", state.getReflectionsSubmitted());
        view.put("canonDefinitionsViewed", state.getCanonDefinitionsViewed());
        view.put("canonAxiomsCited", state.getCanonAxiomsCited());
        view.put("readiness", toReadinessView(state.getReadiness()));
        view.put("unlockedCanonAxioms", state.getUnlockedCanonAxioms());
        view.put("unlockedCourses", state.getUnlockedCourses());
        view.put("unlockedCannonReleases", state.getUnlockedCannonReleases());
        view.put("formationGaps", state.getFormationGaps().stream().map(gap -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", gap.getType().name());
            item.put("area", gap.getArea());
            item.put("severity", gap.getSeverity().name());
            item.put("recommendation", gap.getRecommendation());
            return item;
        }).collect(Collectors.toList()));
        view.put("lastActivityAt", state.getLastActivityAt().toString());
        view.put("createdAt", state.getCreatedAt().toString());
        view.put("updatedAt", state.getUpdatedAt().toString());
        return view;
    }

    private Map<String, Object> toReadinessView(ReadinessIndicators indicators) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("reflectionDepth", indicators.getReflectionDepth().name());
        view.put("pace", indicators.getPace().name());
        view.put("canonEngagement", indicators.getCanonEngagement().name());
        view.put("redFlags", indicators.getRedFlags().stream().map(Enum::name).sorted().collect(Collectors.toList()));
        return view;
    }

    private Map<String, Object> toAxiomView(AxiomUnlockResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("axiomId", result.getAxiomId());
        view.put("title", result.getTitle());
        view.put("phase", result.getPhase().name());
        view.put("unlocked", result.isUnlocked());
        view.put("prerequisites", result.getPrerequisites().stream().map(p -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("kind", p.kind().name());
            item.put("description", p.description());
            item.put("satisfied", p.satisfied());
            return item;
        }).collect(Collectors.toList()));
        view.put("unmetRequirements", result.getUnmetRequirements());
        return view;
    }

    private Map<String, Object> toPhaseView(PhaseAdvanceDecision decision) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("currentPhase", decision.currentPhase().name());
        view.put("nextPhase", decision.nextPhase() != null ? decision.nextPhase().name() : null);
        view.put("daysInPhase", decision.daysInPhase());
        view.put("requiredDays", decision.requiredDays());
        view.put("checkpointsCompleted", decision.checkpointsCompleted());
        view.put("requiredCheckpoints", decision.requiredCheckpoints());
        view.put("canAdvance", decision.canAdvance());
        return view;
    }

    // ─────────────────── Request Bodies ───────────────────

    public record CovenantRequest(String covenantType) {
    }

    public record SectionViewRequest(Long dwellTimeSeconds) {
    }

    public record CanonViewRequest(String term, String context) {
    }

    public record CitationRequest(String citationContext) {
    }

    public record ReflectionRequest(String checkpointId, String content, String type, String idempotencyKey) {
    }
}
