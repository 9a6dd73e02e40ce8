package com.ruach.formation.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.ruach.formation.application.guard.FormationDataCache;
import com.ruach.formation.application.port.in.FormationQueryUseCase;
import com.ruach.formation.application.port.in.RecordActivityUseCase;
import com.ruach.formation.application.port.out.FormationEventStore;
import com.ruach.formation.application.port.out.FormationNotificationPublisher;
import com.ruach.formation.domain.catalog.CanonAxiom;
import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;
import com.ruach.formation.domain.event.CanonAxiomCited;
import com.ruach.formation.domain.event.CanonDefinitionViewed;
import com.ruach.formation.domain.event.CheckpointReached;
import com.ruach.formation.domain.event.ContentGated;
import com.ruach.formation.domain.event.CovenantEntered;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.PhaseStarted;
import com.ruach.formation.domain.event.SectionViewed;
import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Activity recording and read side of a formation journey.
 * <p>
 * Every operation rebuilds state from the log; nothing is patched in place.
 * Axiom statuses are memoized per user and log length, so a new event
 * always produces a fresh entry.
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>Unknown checkpoint/axiom → IllegalArgumentException</li>
 * <li>Out-of-order activity (second covenant, later-phase checkpoint) →
 * IllegalStateException</li>
 * <li>Event store errors → rethrow</li>
 * <li>Notification errors → log + continue</li>
 * </ul>
 */
public class FormationJourneyService implements RecordActivityUseCase, FormationQueryUseCase {

    private static final Logger log = Logger.getLogger(FormationJourneyService.class.getName());

    private final FormationEventStore eventStore;
    private final FormationStateReducer reducer;
    private final FormationEventFactory eventFactory;
    private final CheckpointCatalog checkpointCatalog;
    private final AxiomUnlockService axiomUnlockService;
    private final ReadinessAnalyzer readinessAnalyzer;
    private final ReadinessRecommender readinessRecommender;
    private final PhaseProgressionPolicy phaseProgressionPolicy;
    private final FormationNotificationPublisher notificationPublisher;
    private final FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache;
    private final long axiomStatusTtlMs;
    private final Clock clock;

    public FormationJourneyService(FormationEventStore eventStore,
            FormationStateReducer reducer,
            FormationEventFactory eventFactory,
            CheckpointCatalog checkpointCatalog,
            AxiomUnlockService axiomUnlockService,
            ReadinessAnalyzer readinessAnalyzer,
            ReadinessRecommender readinessRecommender,
            PhaseProgressionPolicy phaseProgressionPolicy,
            FormationNotificationPublisher notificationPublisher,
            FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache,
            long axiomStatusTtlMs,
            Clock clock) {
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (reducer == null || eventFactory == null)
            throw new IllegalArgumentException("reducer and eventFactory cannot be null");
        if (checkpointCatalog == null || axiomUnlockService == null)
            throw new IllegalArgumentException("checkpointCatalog and axiomUnlockService cannot be null");
        if (readinessAnalyzer == null || readinessRecommender == null || phaseProgressionPolicy == null)
            throw new IllegalArgumentException("readiness and phase services cannot be null");
        if (notificationPublisher == null || axiomStatusCache == null || clock == null)
            throw new IllegalArgumentException("notificationPublisher, axiomStatusCache and clock cannot be null");

        this.eventStore = eventStore;
        this.reducer = reducer;
        this.eventFactory = eventFactory;
        this.checkpointCatalog = checkpointCatalog;
        this.axiomUnlockService = axiomUnlockService;
        this.readinessAnalyzer = readinessAnalyzer;
        this.readinessRecommender = readinessRecommender;
        this.phaseProgressionPolicy = phaseProgressionPolicy;
        this.notificationPublisher = notificationPublisher;
        this.axiomStatusCache = axiomStatusCache;
        this.axiomStatusTtlMs = axiomStatusTtlMs;
        this.clock = clock;
    }

    // ─────────────────── Activity ───────────────────

    @Override
    public FormationEvent enterCovenant(String userId, CovenantType covenantType, EventMetadata metadata) {
        FormationState state = loadState(userId);
        if (state.getCovenantType() != null) {
            throw new IllegalStateException("Covenant already entered for user " + userId);
        }
        FormationEvent covenant = eventFactory.createEvent(userId, new CovenantEntered(covenantType, true), metadata);
        FormationEvent phase = eventFactory.createEvent(userId,
                new PhaseStarted(FormationPhase.AWAKENING, null), metadata);
        append(userId, List.of(covenant, phase));
        return covenant;
    }

    @Override
    public FormationEvent reachCheckpoint(String userId, String checkpointId, EventMetadata metadata) {
        return appendOne(userId, checkpointReached(userId, checkpointId), metadata);
    }

    @Override
    public FormationEvent viewSection(String userId, String sectionId, long dwellTimeSeconds,
            EventMetadata metadata) {
        return appendOne(userId, sectionViewed(userId, sectionId, dwellTimeSeconds), metadata);
    }

    /**
     * Records a definition view when the axiom is open to the user, otherwise
     * records a ContentGated event listing what is still missing.
     *
     * @return the CanonDefinitionViewed or ContentGated event
     */
    @Override
    public FormationEvent viewCanonDefinition(String userId, String axiomId, String term, String context,
            EventMetadata metadata) {
        return appendOne(userId, canonViewed(userId, axiomId, term, context), metadata);
    }

    @Override
    public FormationEvent citeAxiom(String userId, String axiomId, String citationContext, EventMetadata metadata) {
        requireAxiom(axiomId);
        return appendOne(userId, new CanonAxiomCited(axiomId, citationContext), metadata);
    }

    /**
     * Replays an externally produced activity through the same checks as the
     * direct operations. The stored event keeps the incoming id, timestamp
     * and metadata, so a redelivered event is absorbed by the store.
     */
    @Override
    public FormationEvent record(FormationEvent event) {
        String userId = event.getUserId();
        EventPayload payload;
        switch (event.getEventType()) {
            case SECTION_VIEWED -> {
                SectionViewed viewed = event.payloadAs(SectionViewed.class);
                payload = sectionViewed(userId, viewed.getSectionId(), viewed.getDwellTimeSeconds());
            }
            case CHECKPOINT_REACHED -> payload = checkpointReached(userId,
                    event.payloadAs(CheckpointReached.class).getCheckpointId());
            case CANON_DEFINITION_VIEWED -> {
                CanonDefinitionViewed viewed = event.payloadAs(CanonDefinitionViewed.class);
                payload = canonViewed(userId, viewed.getAxiomId(), viewed.getTerm(), viewed.getContext());
            }
            case CANON_AXIOM_CITED -> {
                requireAxiom(event.payloadAs(CanonAxiomCited.class).getAxiomId());
                payload = event.getPayload();
            }
            // produced by the external reflection analyzer
            case REFLECTION_ANALYZED -> payload = event.getPayload();
            default -> throw new IllegalArgumentException(String.format(
                    "Event type %s cannot be recorded from the activity feed (%s)",
                    event.getEventType().getWireName(),
                    event.getEventType().isSystemIssued() ? "issued by the engine" : "has its own operation"));
        }

        FormationEvent accepted = new FormationEvent(event.getId(), userId, event.getTimestamp(), payload,
                event.getMetadata());
        append(userId, List.of(accepted));
        return accepted;
    }

    @Override
    public boolean advancePhase(String userId) {
        FormationState state = loadState(userId);
        Instant now = clock.instant();
        PhaseAdvanceDecision decision = phaseProgressionPolicy.evaluateAdvance(state, now);
        if (!decision.canAdvance()) {
            log.info(String.format(
                    "action=phase_gate_closed userId=%s phase=%s days=%d/%d checkpoints=%d/%d",
                    userId, decision.currentPhase(), decision.daysInPhase(), decision.requiredDays(),
                    decision.checkpointsCompleted(), decision.requiredCheckpoints()));
            return false;
        }

        List<FormationEvent> events = new ArrayList<>();
        for (EventPayload payload : phaseProgressionPolicy.advancePayloads(state, decision)) {
            events.add(eventFactory.createEvent(userId, payload));
        }
        append(userId, events);
        log.info(String.format("action=phase_advanced userId=%s from=%s to=%s",
                userId, decision.currentPhase(), decision.nextPhase()));

        try {
            notificationPublisher.publish(FormationNotification.of(userId, FormationNotification.Kind.PHASE_STARTED,
                    decision.nextPhase().slug(), "You have entered the " + decision.nextPhase().slug() + " phase",
                    now));
        } catch (Exception e) {
            log.log(Level.WARNING, String.format("action=notify_failed userId=%s phase=%s error=%s",
                    userId, decision.nextPhase(), e.getMessage()), e);
        }
        return true;
    }

    @Override
    public int refreshReadiness(String userId) {
        List<FormationEvent> history = eventStore.findByUserId(userId);
        FormationState state = reducer.rebuildState(userId, history);
        ReadinessIndicators indicators = readinessAnalyzer.analyze(state, ReflectionLog.fromEvents(history),
                clock.instant());

        List<FormationEvent> events = new ArrayList<>();
        for (EventPayload payload : readinessRecommender.recommend(state, indicators)) {
            events.add(eventFactory.createEvent(userId, payload));
        }
        if (!events.isEmpty()) {
            append(userId, events);
        }
        log.info(String.format("action=readiness_refreshed userId=%s depth=%s pace=%s canon=%s flags=%s events=%d",
                userId, indicators.getReflectionDepth(), indicators.getPace(), indicators.getCanonEngagement(),
                indicators.getRedFlags(), events.size()));
        return events.size();
    }

    // ─────────────────── Queries ───────────────────

    @Override
    public FormationState getState(String userId) {
        FormationState state = loadState(userId);
        return state.hasActivity() ? state.withDaysInPhaseAt(clock.instant()) : state;
    }

    @Override
    public ReadinessIndicators getReadiness(String userId) {
        List<FormationEvent> history = eventStore.findByUserId(userId);
        FormationState state = reducer.rebuildState(userId, history);
        return readinessAnalyzer.analyze(state, ReflectionLog.fromEvents(history), clock.instant());
    }

    @Override
    public List<AxiomUnlockResult> getAxiomStatuses(String userId) {
        FormationState state = getState(userId);
        String key = "axioms:" + userId + ":" + state.getEventsApplied();
        List<AxiomUnlockResult> cached = axiomStatusCache.get(key);
        if (cached != null) {
            return cached;
        }
        List<AxiomUnlockResult> statuses = axiomUnlockService.getAllAxiomsWithStatus(state);
        axiomStatusCache.set(key, statuses, axiomStatusTtlMs);
        return statuses;
    }

    @Override
    public AxiomUnlockResult getAxiomStatus(String userId, String axiomId) {
        if (axiomUnlockService.getAxiomDetails(axiomId) == null) {
            return null;
        }
        return axiomUnlockService.checkAxiomUnlock(axiomId, getState(userId));
    }

    @Override
    public PhaseAdvanceDecision getPhaseStatus(String userId) {
        return phaseProgressionPolicy.evaluateAdvance(loadState(userId), clock.instant());
    }

    // ─────────────────── Private Helpers ───────────────────

    private CheckpointReached checkpointReached(String userId, String checkpointId) {
        Checkpoint checkpoint = checkpointCatalog.find(checkpointId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown checkpoint: " + checkpointId));
        FormationState state = loadState(userId);
        if (!state.getCurrentPhase().isAtLeast(checkpoint.getPhase())) {
            throw new IllegalStateException("Checkpoint " + checkpointId + " belongs to phase "
                    + checkpoint.getPhase() + ", user " + userId + " is in " + state.getCurrentPhase());
        }
        return new CheckpointReached(checkpoint.getId(), checkpoint.getSectionId(), checkpoint.getPhase());
    }

    private SectionViewed sectionViewed(String userId, String sectionId, long dwellTimeSeconds) {
        return new SectionViewed(sectionId, loadState(userId).getCurrentPhase(), dwellTimeSeconds);
    }

    private EventPayload canonViewed(String userId, String axiomId, String term, String context) {
        CanonAxiom axiom = requireAxiom(axiomId);
        FormationState state = loadState(userId).withDaysInPhaseAt(clock.instant());
        AxiomUnlockResult status = axiomUnlockService.checkAxiomUnlock(axiomId, state);

        if (!status.isUnlocked() && !state.getUnlockedCanonAxioms().contains(axiomId)) {
            log.info(String.format("action=content_gated userId=%s axiomId=%s unmet=%s",
                    userId, axiomId, status.getUnmetRequirements()));
            return new ContentGated(ContentType.CANON, axiomId, "Prerequisites not met",
                    status.getUnmetRequirements());
        }
        String viewedTerm = term != null && !term.isBlank() ? term : axiom.getTitle();
        return new CanonDefinitionViewed(axiomId, viewedTerm, context);
    }

    private FormationState loadState(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        return reducer.rebuildState(userId, eventStore.findByUserId(userId));
    }

    private CanonAxiom requireAxiom(String axiomId) {
        CanonAxiom axiom = axiomUnlockService.getAxiomDetails(axiomId);
        if (axiom == null) {
            throw new IllegalArgumentException("Unknown axiom: " + axiomId);
        }
        return axiom;
    }

    private FormationEvent appendOne(String userId, EventPayload payload, EventMetadata metadata) {
        FormationEvent event = eventFactory.createEvent(userId, payload, metadata);
        append(userId, List.of(event));
        return event;
    }

    private void append(String userId, List<FormationEvent> events) {
        eventStore.append(events);
        for (FormationEvent event : events) {
            log.fine(String.format("action=event_recorded userId=%s eventId=%s eventType=%s",
                    userId, event.getId(), event.getEventType()));
        }
    }
}
