package com.ruach.formation.domain.entity;

import java.time.Instant;
import java.util.Objects;

import com.ruach.formation.domain.event.ReflectionAnalyzed;
import com.ruach.formation.domain.valueobject.DoctrinalSoundness;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * A user's response at a checkpoint.
 * <p>
 * Word count and {@code timeSinceCheckpointReached} are computed once at
 * submission and never change. Analyzer indicators are optional and are
 * attached later through {@link #withAnalysis(ReflectionAnalyzed)}, which
 * returns a new instance. Content is absent when the reflection is
 * rebuilt from the event log.
 * </p>
 */
public final class Reflection {

    private final String reflectionId;
    private final String checkpointId;
    private final ReflectionType type;
    private final String content;
    private final int wordCount;
    private final Instant submittedAt;
    private final long timeSinceCheckpointReached;

    // Set by the external analyzer, null until then
    private final Double depthScore;
    private final Boolean regurgitation;
    private final Boolean showsWrestling;
    private final DoctrinalSoundness doctrinalSoundness;
    private final String recommendedAction;

    public Reflection(String reflectionId, String checkpointId, ReflectionType type, String content,
            int wordCount, Instant submittedAt, long timeSinceCheckpointReached) {
        this(reflectionId, checkpointId, type, content, wordCount, submittedAt,
                timeSinceCheckpointReached, null, null, null, null, null);
    }

    private Reflection(String reflectionId, String checkpointId, ReflectionType type, String content,
            int wordCount, Instant submittedAt, long timeSinceCheckpointReached,
            Double depthScore, Boolean regurgitation, Boolean showsWrestling,
            DoctrinalSoundness doctrinalSoundness, String recommendedAction) {
        if (reflectionId == null || reflectionId.isBlank()) {
            throw new IllegalArgumentException("reflectionId cannot be null or blank");
        }
        if (checkpointId == null || checkpointId.isBlank()) {
            throw new IllegalArgumentException("checkpointId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (submittedAt == null) {
            throw new IllegalArgumentException("submittedAt cannot be null");
        }
        if (wordCount < 0 || timeSinceCheckpointReached < 0) {
            throw new IllegalArgumentException("wordCount and timeSinceCheckpointReached must be >= 0");
        }
        this.reflectionId = reflectionId;
        this.checkpointId = checkpointId;
        this.type = type;
        this.content = content;
        this.wordCount = wordCount;
        this.submittedAt = submittedAt;
        this.timeSinceCheckpointReached = timeSinceCheckpointReached;
        this.depthScore = depthScore;
        this.regurgitation = regurgitation;
        this.showsWrestling = showsWrestling;
        this.doctrinalSoundness = doctrinalSoundness;
        this.recommendedAction = recommendedAction;
    }

    /**
     * Attaches analyzer output. The structural fields are carried over unchanged.
     */
    public Reflection withAnalysis(ReflectionAnalyzed analysis) {
        return new Reflection(reflectionId, checkpointId, type, content, wordCount, submittedAt,
                timeSinceCheckpointReached, analysis.getDepthScore(), analysis.isRegurgitation(),
                analysis.isShowsWrestling(), analysis.getDoctrinalSoundness(),
                analysis.getRecommendedAction());
    }

    public boolean isAnalyzed() {
        return doctrinalSoundness != null;
    }

    /**
     * @return true only if the analyzer explicitly flagged regurgitation
     */
    public boolean isFlaggedRegurgitation() {
        return Boolean.TRUE.equals(regurgitation);
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

    public String getContent() {
        return content;
    }

    public int getWordCount() {
        return wordCount;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public long getTimeSinceCheckpointReached() {
        return timeSinceCheckpointReached;
    }

    public Double getDepthScore() {
        return depthScore;
    }

    public Boolean getRegurgitation() {
        return regurgitation;
    }

    public Boolean getShowsWrestling() {
        return showsWrestling;
    }

    public DoctrinalSoundness getDoctrinalSoundness() {
        return doctrinalSoundness;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(reflectionId, ((Reflection) o).reflectionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reflectionId);
    }

    @Override
    public String toString() {
        return "Reflection{reflectionId='" + reflectionId
                + "', checkpointId='" + checkpointId
                + "', wordCount=" + wordCount
                + ", timeSinceCheckpointReached=" + timeSinceCheckpointReached + "}";
    }
}
