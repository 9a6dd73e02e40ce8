package com.ruach.formation.application.service;

/**
 * Numeric cut-offs used by {@link ReadinessAnalyzer}. Integrator
 * configuration; {@link #defaults()} holds the shipped values.
 */
public final class ReadinessThresholds {

    /**
     * Minimum reflection count and average word count for a depth level.
     */
    public record DepthThreshold(int reflections, int averageWords) {
    }

    private final long stalledAfterDays;
    private final long disengagedAfterDays;
    private final long missingReflectionGraceHours;
    private final double speedRunDwellRatio;
    private final double maxCheckpointsPerDay;
    private final int surfaceWordCeiling;
    private final double surfaceShare;
    private final int surfaceMinimumReflections;
    private final DepthThreshold depthDeveloping;
    private final DepthThreshold depthMaturing;
    private final DepthThreshold depthEstablished;
    private final int canonDeveloping;
    private final int canonMaturing;
    private final int canonEstablished;

    private ReadinessThresholds(Builder b) {
        if (b.disengagedAfterDays < b.stalledAfterDays) {
            throw new IllegalArgumentException("disengagedAfterDays must be >= stalledAfterDays");
        }
        this.stalledAfterDays = b.stalledAfterDays;
        this.disengagedAfterDays = b.disengagedAfterDays;
        this.missingReflectionGraceHours = b.missingReflectionGraceHours;
        this.speedRunDwellRatio = b.speedRunDwellRatio;
        this.maxCheckpointsPerDay = b.maxCheckpointsPerDay;
        this.surfaceWordCeiling = b.surfaceWordCeiling;
        this.surfaceShare = b.surfaceShare;
        this.surfaceMinimumReflections = b.surfaceMinimumReflections;
        this.depthDeveloping = b.depthDeveloping;
        this.depthMaturing = b.depthMaturing;
        this.depthEstablished = b.depthEstablished;
        this.canonDeveloping = b.canonDeveloping;
        this.canonMaturing = b.canonMaturing;
        this.canonEstablished = b.canonEstablished;
    }

    public static ReadinessThresholds defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getStalledAfterDays() {
        return stalledAfterDays;
    }

    public long getDisengagedAfterDays() {
        return disengagedAfterDays;
    }

    public long getMissingReflectionGraceHours() {
        return missingReflectionGraceHours;
    }

    public double getSpeedRunDwellRatio() {
        return speedRunDwellRatio;
    }

    public double getMaxCheckpointsPerDay() {
        return maxCheckpointsPerDay;
    }

    public int getSurfaceWordCeiling() {
        return surfaceWordCeiling;
    }

    public double getSurfaceShare() {
        return surfaceShare;
    }

    public int getSurfaceMinimumReflections() {
        return surfaceMinimumReflections;
    }

    public DepthThreshold getDepthDeveloping() {
        return depthDeveloping;
    }

    public DepthThreshold getDepthMaturing() {
        return depthMaturing;
    }

    public DepthThreshold getDepthEstablished() {
        return depthEstablished;
    }

    public int getCanonDeveloping() {
        return canonDeveloping;
    }

    public int getCanonMaturing() {
        return canonMaturing;
    }

    public int getCanonEstablished() {
        return canonEstablished;
    }

    public static final class Builder {
        private long stalledAfterDays = 7;
        private long disengagedAfterDays = 21;
        private long missingReflectionGraceHours = 72;
        private double speedRunDwellRatio = 1.05;
        private double maxCheckpointsPerDay = 1.0;
        private int surfaceWordCeiling = 75;
        private double surfaceShare = 0.5;
        private int surfaceMinimumReflections = 2;
        private DepthThreshold depthDeveloping = new DepthThreshold(2, 60);
        private DepthThreshold depthMaturing = new DepthThreshold(6, 120);
        private DepthThreshold depthEstablished = new DepthThreshold(12, 200);
        private int canonDeveloping = 3;
        private int canonMaturing = 10;
        private int canonEstablished = 25;

        private Builder() {
        }

        public Builder stalledAfterDays(long value) {
            this.stalledAfterDays = value;
            return this;
        }

        public Builder disengagedAfterDays(long value) {
            this.disengagedAfterDays = value;
            return this;
        }

        public Builder missingReflectionGraceHours(long value) {
            this.missingReflectionGraceHours = value;
            return this;
        }

        public Builder speedRunDwellRatio(double value) {
            this.speedRunDwellRatio = value;
            return this;
        }

        public Builder maxCheckpointsPerDay(double value) {
            this.maxCheckpointsPerDay = value;
            return this;
        }

        public Builder surfaceWordCeiling(int value) {
            this.surfaceWordCeiling = value;
            return this;
        }

        public Builder surfaceShare(double value) {
            this.surfaceShare = value;
            return this;
        }

        public Builder surfaceMinimumReflections(int value) {
            this.surfaceMinimumReflections = value;
            return this;
        }

        public Builder depthDeveloping(int reflections, int averageWords) {
            this.depthDeveloping = new DepthThreshold(reflections, averageWords);
            return this;
        }

        public Builder depthMaturing(int reflections, int averageWords) {
            this.depthMaturing = new DepthThreshold(reflections, averageWords);
            return this;
        }

        public Builder depthEstablished(int reflections, int averageWords) {
            this.depthEstablished = new DepthThreshold(reflections, averageWords);
            return this;
        }

        public Builder canonLevels(int developing, int maturing, int established) {
            this.canonDeveloping = developing;
            this.canonMaturing = maturing;
            this.canonEstablished = established;
            return this;
        }

        public ReadinessThresholds build() {
            return new ReadinessThresholds(this);
        }
    }
}
