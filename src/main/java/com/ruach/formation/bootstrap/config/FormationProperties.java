package com.ruach.formation.bootstrap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "formation")
public class FormationProperties {

    private String eventStore = "postgres";
    private final Reflection reflection = new Reflection();
    private final Dedup dedup = new Dedup();
    private final Cache cache = new Cache();
    private final Retry retry = new Retry();
    private final Readiness readiness = new Readiness();
    private final Kafka kafka = new Kafka();
    private final Notifications notifications = new Notifications();

    public String getEventStore() {
        return eventStore;
    }

    public void setEventStore(String eventStore) {
        this.eventStore = eventStore;
    }

    public Reflection getReflection() {
        return reflection;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public Cache getCache() {
        return cache;
    }

    public Retry getRetry() {
        return retry;
    }

    public Readiness getReadiness() {
        return readiness;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public static class Reflection {
        private int minWords = 50;

        public int getMinWords() {
            return minWords;
        }

        public void setMinWords(int minWords) {
            this.minWords = minWords;
        }
    }

    public static class Dedup {
        private String store = "memory";
        private String redisPrefix = "formation:dedup:";
        private long cooldownMs = 5000;
        private long retentionMs = 3_600_000;
        private long inFlightTimeoutMs = 300_000;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getRedisPrefix() {
            return redisPrefix;
        }

        public void setRedisPrefix(String redisPrefix) {
            this.redisPrefix = redisPrefix;
        }

        public long getCooldownMs() {
            return cooldownMs;
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }

        public long getRetentionMs() {
            return retentionMs;
        }

        public void setRetentionMs(long retentionMs) {
            this.retentionMs = retentionMs;
        }

        public long getInFlightTimeoutMs() {
            return inFlightTimeoutMs;
        }

        public void setInFlightTimeoutMs(long inFlightTimeoutMs) {
            this.inFlightTimeoutMs = inFlightTimeoutMs;
        }
    }

    public static class Cache {
        private long maximumSize = 10_000;
        private long axiomStatusTtlMs = 30_000;

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public long getAxiomStatusTtlMs() {
            return axiomStatusTtlMs;
        }

        public void setAxiomStatusTtlMs(long axiomStatusTtlMs) {
            this.axiomStatusTtlMs = axiomStatusTtlMs;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 1000;
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Readiness {
        private long stalledAfterDays = 7;
        private long disengagedAfterDays = 21;
        private long missingReflectionGraceHours = 72;
        private double speedRunDwellRatio = 1.05;
        private double maxCheckpointsPerDay = 1.0;
        private int surfaceWordCeiling = 75;
        private double surfaceShare = 0.5;
        private int surfaceMinimumReflections = 2;
        private int depthDevelopingReflections = 2;
        private int depthDevelopingWords = 60;
        private int depthMaturingReflections = 6;
        private int depthMaturingWords = 120;
        private int depthEstablishedReflections = 12;
        private int depthEstablishedWords = 200;
        private int canonDeveloping = 3;
        private int canonMaturing = 10;
        private int canonEstablished = 25;

        public long getStalledAfterDays() {
            return stalledAfterDays;
        }

        public void setStalledAfterDays(long stalledAfterDays) {
            this.stalledAfterDays = stalledAfterDays;
        }

        public long getDisengagedAfterDays() {
            return disengagedAfterDays;
        }

        public void setDisengagedAfterDays(long disengagedAfterDays) {
            this.disengagedAfterDays = disengagedAfterDays;
        }

        public long getMissingReflectionGraceHours() {
            return missingReflectionGraceHours;
        }

        public void setMissingReflectionGraceHours(long missingReflectionGraceHours) {
            this.missingReflectionGraceHours = missingReflectionGraceHours;
        }

        public double getSpeedRunDwellRatio() {
            return speedRunDwellRatio;
        }

        public void setSpeedRunDwellRatio(double speedRunDwellRatio) {
            this.speedRunDwellRatio = speedRunDwellRatio;
        }

        public double getMaxCheckpointsPerDay() {
            return maxCheckpointsPerDay;
        }

        public void setMaxCheckpointsPerDay(double maxCheckpointsPerDay) {
            this.maxCheckpointsPerDay = maxCheckpointsPerDay;
        }

        public int getSurfaceWordCeiling() {
            return surfaceWordCeiling;
        }

        public void setSurfaceWordCeiling(int surfaceWordCeiling) {
            this.surfaceWordCeiling = surfaceWordCeiling;
        }

        public double getSurfaceShare() {
            return surfaceShare;
        }

        public void setSurfaceShare(double surfaceShare) {
            this.surfaceShare = surfaceShare;
        }

        public int getSurfaceMinimumReflections() {
            return surfaceMinimumReflections;
        }

        public void setSurfaceMinimumReflections(int surfaceMinimumReflections) {
            this.surfaceMinimumReflections = surfaceMinimumReflections;
        }

        public int getDepthDevelopingReflections() {
            return depthDevelopingReflections;
        }

        public void setDepthDevelopingReflections(int depthDevelopingReflections) {
            this.depthDevelopingReflections = depthDevelopingReflections;
        }

        public int getDepthDevelopingWords() {
            return depthDevelopingWords;
        }

        public void setDepthDevelopingWords(int depthDevelopingWords) {
            this.depthDevelopingWords = depthDevelopingWords;
        }

        public int getDepthMaturingReflections() {
            return depthMaturingReflections;
        }

        public void setDepthMaturingReflections(int depthMaturingReflections) {
            this.depthMaturingReflections = depthMaturingReflections;
        }

        public int getDepthMaturingWords() {
            return depthMaturingWords;
        }

        public void setDepthMaturingWords(int depthMaturingWords) {
            this.depthMaturingWords = depthMaturingWords;
        }

        public int getDepthEstablishedReflections() {
            return depthEstablishedReflections;
        }

        public void setDepthEstablishedReflections(int depthEstablishedReflections) {
            this.depthEstablishedReflections = depthEstablishedReflections;
        }

        public int getDepthEstablishedWords() {
            return depthEstablishedWords;
        }

        public void setDepthEstablishedWords(int depthEstablishedWords) {
            this.depthEstablishedWords = depthEstablishedWords;
        }

        public int getCanonDeveloping() {
            return canonDeveloping;
        }

        public void setCanonDeveloping(int canonDeveloping) {
            this.canonDeveloping = canonDeveloping;
        }

        public int getCanonMaturing() {
            return canonMaturing;
        }

        public void setCanonMaturing(int canonMaturing) {
            this.canonMaturing = canonMaturing;
        }

        public int getCanonEstablished() {
            return canonEstablished;
        }

        public void setCanonEstablished(int canonEstablished) {
            this.canonEstablished = canonEstablished;
        }
    }

    public static class Kafka {
        private final Topics topics = new Topics();
        private long publishAckTimeoutMs = 3000;

        public Topics getTopics() {
            return topics;
        }

        public long getPublishAckTimeoutMs() {
            return publishAckTimeoutMs;
        }

        public void setPublishAckTimeoutMs(long publishAckTimeoutMs) {
            this.publishAckTimeoutMs = publishAckTimeoutMs;
        }
    }

    public static class Topics {
        private String activity = "formation-activity";
        private String notifications = "formation-notifications";
        private String dlq = "formation-activity-dlq";

        public String getActivity() {
            return activity;
        }

        public void setActivity(String activity) {
            this.activity = activity;
        }

        public String getNotifications() {
            return notifications;
        }

        public void setNotifications(String notifications) {
            this.notifications = notifications;
        }

        public String getDlq() {
            return dlq;
        }

        public void setDlq(String dlq) {
            this.dlq = dlq;
        }
    }

    public static class Notifications {
        private String redisPrefix = "formation:notification:";
        private long idempotencyTtlHours = 24;
        private long processingTtlMinutes = 5;

        public String getRedisPrefix() {
            return redisPrefix;
        }

        public void setRedisPrefix(String redisPrefix) {
            this.redisPrefix = redisPrefix;
        }

        public long getIdempotencyTtlHours() {
            return idempotencyTtlHours;
        }

        public void setIdempotencyTtlHours(long idempotencyTtlHours) {
            this.idempotencyTtlHours = idempotencyTtlHours;
        }

        public long getProcessingTtlMinutes() {
            return processingTtlMinutes;
        }

        public void setProcessingTtlMinutes(long processingTtlMinutes) {
            this.processingTtlMinutes = processingTtlMinutes;
        }
    }
}
