package com.ruach.formation.domain.entity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.ruach.formation.domain.valueobject.PaceStatus;
import com.ruach.formation.domain.valueobject.ReadinessLevel;
import com.ruach.formation.domain.valueobject.RedFlag;

/**
 * Derived behavioral signals: depth, pace, canon engagement and red flags.
 * <p>
 * Immutable. Red flags are kept in declaration order.
 * </p>
 */
public final class ReadinessIndicators {

    private static final ReadinessIndicators BASELINE = new ReadinessIndicators(
            ReadinessLevel.EMERGING, PaceStatus.APPROPRIATE, ReadinessLevel.EMERGING, Set.of());

    private final ReadinessLevel reflectionDepth;
    private final PaceStatus pace;
    private final ReadinessLevel canonEngagement;
    private final Set<RedFlag> redFlags;

    public ReadinessIndicators(ReadinessLevel reflectionDepth, PaceStatus pace,
            ReadinessLevel canonEngagement, Set<RedFlag> redFlags) {
        if (reflectionDepth == null || pace == null || canonEngagement == null) {
            throw new IllegalArgumentException("readiness levels cannot be null");
        }
        this.reflectionDepth = reflectionDepth;
        this.pace = pace;
        this.canonEngagement = canonEngagement;
        this.redFlags = redFlags == null || redFlags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(redFlags));
    }

    /**
     * Starting indicators: Emerging depth, Appropriate pace, Emerging
     * engagement, no red flags.
     */
    public static ReadinessIndicators baseline() {
        return BASELINE;
    }

    public ReadinessIndicators withReflectionDepth(ReadinessLevel level) {
        return new ReadinessIndicators(level, pace, canonEngagement, redFlags);
    }

    public ReadinessIndicators withPace(PaceStatus newPace) {
        return new ReadinessIndicators(reflectionDepth, newPace, canonEngagement, redFlags);
    }

    public ReadinessIndicators withCanonEngagement(ReadinessLevel level) {
        return new ReadinessIndicators(reflectionDepth, pace, level, redFlags);
    }

    public ReadinessIndicators withRedFlag(RedFlag flag) {
        if (redFlags.contains(flag)) {
            return this;
        }
        Set<RedFlag> flags = EnumSet.noneOf(RedFlag.class);
        flags.addAll(redFlags);
        flags.add(flag);
        return new ReadinessIndicators(reflectionDepth, pace, canonEngagement, flags);
    }

    public boolean hasRedFlag(RedFlag flag) {
        return redFlags.contains(flag);
    }

    public ReadinessLevel getReflectionDepth() {
        return reflectionDepth;
    }

    public PaceStatus getPace() {
        return pace;
    }

    public ReadinessLevel getCanonEngagement() {
        return canonEngagement;
    }

    public Set<RedFlag> getRedFlags() {
        return redFlags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ReadinessIndicators that = (ReadinessIndicators) o;
        return reflectionDepth == that.reflectionDepth
                && pace == that.pace
                && canonEngagement == that.canonEngagement
                && redFlags.equals(that.redFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reflectionDepth, pace, canonEngagement, redFlags);
    }

    @Override
    public String toString() {
        return "ReadinessIndicators{reflectionDepth=" + reflectionDepth
                + ", pace=" + pace
                + ", canonEngagement=" + canonEngagement
                + ", redFlags=" + redFlags + "}";
    }
}
