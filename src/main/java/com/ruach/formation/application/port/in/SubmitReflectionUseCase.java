package com.ruach.formation.application.port.in;

import com.ruach.formation.application.guard.DuplicateSubmissionException;
import com.ruach.formation.application.service.SubmissionResult;

/**
 * Primary (inbound) port: reflection submission at a checkpoint.
 * <p>
 * Guards run before any event is created:
 * <ol>
 * <li><b>Validate</b>: content, checkpoint id, dwell time</li>
 * <li><b>Deduplicate</b>: one effective submission per idempotency key</li>
 * <li><b>Record</b>: append CheckpointCompleted + ReflectionSubmitted</li>
 * <li><b>Unlock</b>: emit ContentUnlocked for newly opened axioms</li>
 * </ol>
 * </p>
 */
public interface SubmitReflectionUseCase {

    /**
     * Submits a reflection.
     *
     * @param submission the submission request
     * @return accepted, replayed or rejected outcome; rejections carry the
     *         validation errors and never create events
     * @throws DuplicateSubmissionException if the same idempotency key is
     *                                      still being processed
     * @throws Exception                    the last storage failure once
     *                                      retries are exhausted
     */
    SubmissionResult submitReflection(ReflectionSubmission submission) throws Exception;
}
