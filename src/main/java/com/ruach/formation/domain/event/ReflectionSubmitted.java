package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * Records a reflection. Word count and dwell are fixed at submission time.
 */
public final class ReflectionSubmitted implements EventPayload {

    private final String reflectionId;
    private final String checkpointId;
    private final ReflectionType type;
    private final int wordCount;
    private final long timeSinceCheckpointReached;

    public ReflectionSubmitted(String reflectionId, String checkpointId, ReflectionType type,
            int wordCount, long timeSinceCheckpointReached) {
        this.reflectionId = PayloadChecks.requireText(reflectionId, "reflectionId");
        this.checkpointId = PayloadChecks.requireText(checkpointId, "checkpointId");
        this.type = PayloadChecks.requireValue(type, "type");
        this.wordCount = (int) PayloadChecks.requireNonNegative(wordCount, "wordCount");
        this.timeSinceCheckpointReached = PayloadChecks.requireNonNegative(timeSinceCheckpointReached,
                "timeSinceCheckpointReached");
    }

    @Override
    public EventType eventType() {
        return EventType.REFLECTION_SUBMITTED;
    }

    public String getReflectionId() {
        return reflectionId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public ReflectionType getType() {
        return type;
    }

    public int getWordCount() {
        return wordCount;
    }

    public long getTimeSinceCheckpointReached() {
        return timeSinceCheckpointReached;
    }
}
