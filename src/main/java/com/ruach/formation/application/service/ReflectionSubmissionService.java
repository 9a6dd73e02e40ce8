package com.ruach.formation.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.ruach.formation.application.guard.DeduplicationReservation;
import com.ruach.formation.application.guard.DeduplicationService;
import com.ruach.formation.application.guard.FormationValidation;
import com.ruach.formation.application.guard.RetryExecutor;
import com.ruach.formation.application.guard.RetryOptions;
import com.ruach.formation.application.guard.ValidationError;
import com.ruach.formation.application.guard.ValidationResult;
import com.ruach.formation.application.port.in.ReflectionSubmission;
import com.ruach.formation.application.port.in.SubmitReflectionUseCase;
import com.ruach.formation.application.port.out.FormationEventStore;
import com.ruach.formation.application.port.out.FormationNotificationPublisher;
import com.ruach.formation.domain.catalog.CanonAxiom;
import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.entity.Checkpoint;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.event.CheckpointCompleted;
import com.ruach.formation.domain.event.ContentUnlocked;
import com.ruach.formation.domain.event.ReflectionSubmitted;
import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * Reflection submission pipeline.
 * <ol>
 * <li><b>Validate</b>: content and checkpoint id, no I/O</li>
 * <li><b>Reserve</b>: claim the idempotency key; a completed duplicate is
 * replayed</li>
 * <li><b>Rebuild</b>: load the log (with retry) and fold it</li>
 * <li><b>Gate</b>: checkpoint reached and its pause respected</li>
 * <li><b>Record</b>: CheckpointCompleted, ReflectionSubmitted and any
 * ContentUnlocked, appended together (with retry)</li>
 * <li><b>Notify</b>: best-effort, per newly unlocked axiom</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>Rule violations → REJECTED result, nothing recorded</li>
 * <li>Same key in flight → DuplicateSubmissionException</li>
 * <li>Storage errors → retried, then the last one is rethrown and the key
 * released</li>
 * <li>Notification errors → log + continue (events already recorded)</li>
 * </ul>
 */
public class ReflectionSubmissionService implements SubmitReflectionUseCase {

    private static final Logger log = Logger.getLogger(ReflectionSubmissionService.class.getName());

    private final FormationEventStore eventStore;
    private final FormationStateReducer reducer;
    private final FormationEventFactory eventFactory;
    private final CheckpointCatalog checkpointCatalog;
    private final AxiomUnlockService axiomUnlockService;
    private final DeduplicationService<SubmissionResult> deduplicationService;
    private final RetryExecutor retryExecutor;
    private final RetryOptions retryOptions;
    private final FormationNotificationPublisher notificationPublisher;
    private final Clock clock;
    private final int minWords;
    private final long cooldownMs;

    public ReflectionSubmissionService(FormationEventStore eventStore,
            FormationStateReducer reducer,
            FormationEventFactory eventFactory,
            CheckpointCatalog checkpointCatalog,
            AxiomUnlockService axiomUnlockService,
            DeduplicationService<SubmissionResult> deduplicationService,
            RetryExecutor retryExecutor,
            RetryOptions retryOptions,
            FormationNotificationPublisher notificationPublisher,
            Clock clock,
            int minWords,
            long cooldownMs) {
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (reducer == null || eventFactory == null)
            throw new IllegalArgumentException("reducer and eventFactory cannot be null");
        if (checkpointCatalog == null || axiomUnlockService == null)
            throw new IllegalArgumentException("checkpointCatalog and axiomUnlockService cannot be null");
        if (deduplicationService == null)
            throw new IllegalArgumentException("deduplicationService cannot be null");
        if (retryExecutor == null || retryOptions == null)
            throw new IllegalArgumentException("retryExecutor and retryOptions cannot be null");
        if (notificationPublisher == null)
            throw new IllegalArgumentException("notificationPublisher cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.eventStore = eventStore;
        this.reducer = reducer;
        this.eventFactory = eventFactory;
        this.checkpointCatalog = checkpointCatalog;
        this.axiomUnlockService = axiomUnlockService;
        this.deduplicationService = deduplicationService;
        this.retryExecutor = retryExecutor;
        this.retryOptions = retryOptions;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
        this.minWords = minWords;
        this.cooldownMs = cooldownMs;
    }

    @Override
    public SubmissionResult submitReflection(ReflectionSubmission submission) throws Exception {
        Instant startTime = clock.instant();
        String userId = submission.userId();
        String checkpointId = submission.checkpointId();
        String key = submission.effectiveIdempotencyKey();

        log.info(String.format("action=submit_start userId=%s checkpointId=%s key=%s",
                userId, checkpointId, key));

        // ── Step 1: VALIDATE ──
        ValidationResult validation = validateRequest(submission);
        if (!validation.isValid()) {
            return reject(userId, checkpointId, validation);
        }

        // ── Step 2: RESERVE ──
        DeduplicationReservation<SubmissionResult> reservation = deduplicationService.tryBegin(key, cooldownMs);
        if (!reservation.isAcquired()) {
            log.info(String.format("action=submit_replayed userId=%s checkpointId=%s key=%s",
                    userId, checkpointId, key));
            return reservation.getPreviousResult().asReplay();
        }

        try {
            SubmissionResult result = process(submission, startTime);
            if (result.isRejected()) {
                deduplicationService.abandon(reservation);
            } else {
                deduplicationService.complete(reservation, result);
            }
            return result;

        } catch (Exception e) {
            deduplicationService.abandon(reservation);
            log.log(Level.SEVERE, String.format("action=submit_error userId=%s checkpointId=%s key=%s error=%s",
                    userId, checkpointId, key, e.getMessage()), e);
            throw e;
        }
    }

    // ─────────────────── Private Steps ───────────────────

    private SubmissionResult process(ReflectionSubmission submission, Instant startTime) throws Exception {
        String userId = submission.userId();
        Checkpoint checkpoint = checkpointCatalog.find(submission.checkpointId())
                .orElseThrow(() -> new IllegalStateException("Checkpoint vanished: " + submission.checkpointId()));

        // ── Step 3: REBUILD ──
        List<FormationEvent> history = retryExecutor.withRetry(() -> eventStore.findByUserId(userId), retryOptions);
        FormationState state = reducer.rebuildState(userId, history);
        Instant now = clock.instant();

        // ── Step 4: GATE ──
        Instant reachedAt = state.getCheckpointReachedAt().get(checkpoint.getId());
        if (reachedAt == null) {
            return reject(userId, checkpoint.getId(), ValidationResult.failure(new ValidationError(
                    "checkpointId", ValidationError.CHECKPOINT_NOT_REACHED,
                    "Checkpoint has not been reached yet: " + checkpoint.getId())));
        }
        long dwellSeconds = Math.max(0, Duration.between(reachedAt, now).getSeconds());
        ValidationResult dwell = FormationValidation.validateDwellTime(dwellSeconds, checkpoint.getMinimumDwellSeconds());
        if (!dwell.isValid()) {
            return reject(userId, checkpoint.getId(), dwell);
        }

        // ── Step 5: RECORD ──
        String reflectionId = UUID.randomUUID().toString();
        ReflectionType type = submission.type() != null ? submission.type() : ReflectionType.TEXT;
        List<FormationEvent> events = new ArrayList<>();
        events.add(eventFactory.createEvent(userId, new CheckpointCompleted(
                checkpoint.getId(), checkpoint.getSectionId(), checkpoint.getPhase(), reflectionId, dwellSeconds),
                submission.metadata()));
        events.add(eventFactory.createEvent(userId, new ReflectionSubmitted(
                reflectionId, checkpoint.getId(), type,
                FormationValidation.countWords(submission.content()), dwellSeconds),
                submission.metadata()));

        FormationState updated = applyAll(state, events);
        List<String> newlyUnlocked = axiomUnlockService.getNewlyUnlockedAxioms(
                axiomUnlockService.getUnlockedAxiomIds(updated), state.getUnlockedCanonAxioms());
        for (String axiomId : newlyUnlocked) {
            FormationEvent unlock = eventFactory.createEvent(userId, new ContentUnlocked(
                    ContentType.CANON, axiomId, "Prerequisites satisfied by " + checkpoint.getId()),
                    submission.metadata());
            events.add(unlock);
            updated = reducer.applyEvent(updated, unlock);
        }

        retryExecutor.withRetry(() -> {
            eventStore.append(events);
            return events.size();
        }, retryOptions);

        // ── Step 6: NOTIFY ──
        notifyUnlocks(userId, newlyUnlocked, now);

        long latencyMs = Duration.between(startTime, clock.instant()).toMillis();
        log.info(String.format(
                "action=submit_complete userId=%s checkpointId=%s reflectionId=%s events=%d unlocked=%s latency=%dms",
                userId, checkpoint.getId(), reflectionId, events.size(), newlyUnlocked, latencyMs));

        return SubmissionResult.accepted(checkpoint.getId(), reflectionId,
                events.stream().map(FormationEvent::getId).collect(Collectors.toList()),
                newlyUnlocked, updated.getReflectionsSubmitted(), now);
    }

    private ValidationResult validateRequest(ReflectionSubmission submission) {
        if (submission.userId() == null || submission.userId().isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        ValidationResult checkpointId = FormationValidation.validateCheckpointId(submission.checkpointId());
        if (checkpointId.isValid() && checkpointCatalog.find(submission.checkpointId()).isEmpty()) {
            checkpointId = ValidationResult.failure(new ValidationError("checkpointId",
                    ValidationError.UNKNOWN_CHECKPOINT, "Unknown checkpoint: " + submission.checkpointId()));
        }
        return checkpointId.and(FormationValidation.validateReflection(submission.content(), minWords));
    }

    private FormationState applyAll(FormationState state, List<FormationEvent> events) {
        FormationState current = state;
        for (FormationEvent event : events) {
            current = reducer.applyEvent(current, event);
        }
        return current;
    }

    private SubmissionResult reject(String userId, String checkpointId, ValidationResult validation) {
        log.info(String.format("action=submit_rejected userId=%s checkpointId=%s codes=%s",
                userId, checkpointId,
                validation.getErrors().stream().map(ValidationError::getCode).collect(Collectors.toList())));
        return SubmissionResult.rejected(checkpointId, validation.getErrors());
    }

    /**
     * Delivery is best-effort: the events are already recorded.
     */
    private void notifyUnlocks(String userId, List<String> axiomIds, Instant now) {
        for (String axiomId : axiomIds) {
            CanonAxiom axiom = axiomUnlockService.getAxiomDetails(axiomId);
            String title = axiom != null ? axiom.getTitle() : axiomId;
            try {
                notificationPublisher.publish(FormationNotification.of(userId,
                        FormationNotification.Kind.AXIOM_UNLOCKED, axiomId, "New axiom unlocked: " + title, now));
            } catch (Exception e) {
                log.log(Level.WARNING, String.format("action=notify_failed userId=%s axiomId=%s error=%s",
                        userId, axiomId, e.getMessage()), e);
            }
        }
    }
}
