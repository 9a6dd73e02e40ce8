package com.ruach.formation.adapters.out.redis;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.application.guard.DeduplicationRecord;
import com.ruach.formation.application.port.out.DeduplicationStore;
import com.ruach.formation.application.service.SubmissionResult;

/**
 * Redis implementation of the DeduplicationStore outbound port, shared by
 * every instance of the service.
 * <p>
 * Key pattern: {@code formation:dedup:{idempotencyKey}}
 * TTL: retention for completed records, in-flight timeout for reservations
 * Serialization: JSON via Jackson
 * </p>
 * <p>
 * Reservation and release run as Lua scripts so that the check and the
 * write happen in one atomic step on the server.
 * </p>
 */
public class RedisDeduplicationStore implements DeduplicationStore<SubmissionResult> {

    private static final Logger log = LoggerFactory.getLogger(RedisDeduplicationStore.class);

    // Returns the blocking record, or nil after storing the reservation
    private static final RedisScript<String> RESERVE_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
                    + "if current then "
                    + "  local record = cjson.decode(current) "
                    + "  local now = tonumber(ARGV[2]) "
                    + "  if record.status == 'IN_FLIGHT' and now < record.expires_at then return current end "
                    + "  if record.status == 'DONE' and now - record.recorded_at < tonumber(ARGV[3]) then return current end "
                    + "end "
                    + "redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[4]) "
                    + "return false",
            String.class);

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
                    + "if current and cjson.decode(current).token == ARGV[1] then "
                    + "  return redis.call('DEL', KEYS[1]) "
                    + "end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisDeduplicationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public DeduplicationRecord<SubmissionResult> find(String key) {
        String json = redisTemplate.opsForValue().get(buildKey(key));
        if (json == null) {
            log.debug("action=dedup_not_found key={}", key);
            return null;
        }
        return parse(key, json);
    }

    @Override
    public DeduplicationRecord<SubmissionResult> reserve(String key, DeduplicationRecord<SubmissionResult> pending,
            long cooldownMs) {
        long ttlMs = Math.max(1, pending.getExpiresAt().toEpochMilli() - pending.getRecordedAt().toEpochMilli());
        String blocking = redisTemplate.execute(RESERVE_SCRIPT, List.of(buildKey(key)),
                serialize(key, pending),
                String.valueOf(pending.getRecordedAt().toEpochMilli()),
                String.valueOf(cooldownMs),
                String.valueOf(ttlMs));

        if (blocking == null) {
            log.debug("action=dedup_reserved key={} ttlMs={}", key, ttlMs);
            return null;
        }
        return parse(key, blocking);
    }

    @Override
    public void save(String key, DeduplicationRecord<SubmissionResult> record, long retentionMs) {
        redisTemplate.opsForValue().set(buildKey(key), serialize(key, record),
                Math.max(1, retentionMs), TimeUnit.MILLISECONDS);
        log.debug("action=dedup_saved key={} status={} retentionMs={}", key, record.getStatus(), retentionMs);
    }

    @Override
    public void release(String key, String token) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(buildKey(key)), token);
        log.debug("action=dedup_released key={} deleted={}", key, deleted);
    }

    /**
     * Nothing to do: Redis expires keys by their TTL.
     */
    @Override
    public int evictExpired(Instant now, long retentionMs) {
        return 0;
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    private String buildKey(String key) {
        return keyPrefix + key;
    }

    private String serialize(String key, DeduplicationRecord<SubmissionResult> record) {
        try {
            return objectMapper.writeValueAsString(RecordDto.fromDomain(record));
        } catch (JsonProcessingException e) {
            log.error("action=dedup_serialize_error key={} error={}", key, e.getMessage());
            throw new IllegalStateException("Failed to serialize dedup record for key: " + key, e);
        }
    }

    private DeduplicationRecord<SubmissionResult> parse(String key, String json) {
        try {
            return objectMapper.readValue(json, RecordDto.class).toDomain();
        } catch (JsonProcessingException e) {
            log.error("action=dedup_deserialize_error key={} error={}", key, e.getMessage());
            throw new IllegalStateException("Failed to deserialize dedup record for key: " + key, e);
        }
    }

    // ─────────────────── Inner DTOs ───────────────────

    /**
     * Serialization DTO for a dedup record. Timestamps are epoch millis so
     * the Lua scripts can compare them.
     */
    public static class RecordDto {

        @JsonProperty("status")
        private String status;

        @JsonProperty("token")
        private String token;

        @JsonProperty("recorded_at")
        private long recordedAt;

        @JsonProperty("expires_at")
        private long expiresAt;

        @JsonProperty("result")
        private ResultDto result;

        public RecordDto() {
        } // Jackson

        public static RecordDto fromDomain(DeduplicationRecord<SubmissionResult> record) {
            RecordDto dto = new RecordDto();
            dto.status = record.getStatus().name();
            dto.token = record.getToken();
            dto.recordedAt = record.getRecordedAt().toEpochMilli();
            dto.expiresAt = record.getExpiresAt().toEpochMilli();
            dto.result = record.getResult() != null ? ResultDto.fromDomain(record.getResult()) : null;
            return dto;
        }

        public DeduplicationRecord<SubmissionResult> toDomain() {
            return new DeduplicationRecord<>(
                    DeduplicationRecord.Status.valueOf(status),
                    token,
                    result != null ? result.toDomain() : null,
                    Instant.ofEpochMilli(recordedAt),
                    Instant.ofEpochMilli(expiresAt));
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public long getRecordedAt() {
            return recordedAt;
        }

        public void setRecordedAt(long recordedAt) {
            this.recordedAt = recordedAt;
        }

        public long getExpiresAt() {
            return expiresAt;
        }

        public void setExpiresAt(long expiresAt) {
            this.expiresAt = expiresAt;
        }

        public ResultDto getResult() {
            return result;
        }

        public void setResult(ResultDto result) {
            this.result = result;
        }
    }

    /**
     * Serialization DTO for an accepted submission result.
     */
    public static class ResultDto {

        @JsonProperty("status")
        private String status;

        @JsonProperty("checkpoint_id")
        private String checkpointId;

        @JsonProperty("reflection_id")
        private String reflectionId;

        @JsonProperty("event_ids")
        private List<String> eventIds;

        @JsonProperty("newly_unlocked_axioms")
        private List<String> newlyUnlockedAxioms;

        @JsonProperty("reflections_submitted")
        private int reflectionsSubmitted;

        @JsonProperty("submitted_at")
        private String submittedAt;

        public ResultDto() {
        } // Jackson

        public static ResultDto fromDomain(SubmissionResult result) {
            ResultDto dto = new ResultDto();
            dto.status = result.getStatus().name();
            dto.checkpointId = result.getCheckpointId();
            dto.reflectionId = result.getReflectionId();
            dto.eventIds = result.getEventIds();
            dto.newlyUnlockedAxioms = result.getNewlyUnlockedAxioms();
            dto.reflectionsSubmitted = result.getReflectionsSubmitted();
            dto.submittedAt = result.getSubmittedAt() != null ? result.getSubmittedAt().toString() : null;
            return dto;
        }

        public SubmissionResult toDomain() {
            return new SubmissionResult(
                    SubmissionResult.Status.valueOf(status),
                    checkpointId,
                    reflectionId,
                    eventIds,
                    newlyUnlockedAxioms,
                    reflectionsSubmitted,
                    submittedAt != null ? Instant.parse(submittedAt) : null,
                    null);
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public String getCheckpointId() {
            return checkpointId;
        }

        public void setCheckpointId(String checkpointId) {
            this.checkpointId = checkpointId;
        }

        public String getReflectionId() {
            return reflectionId;
        }

        public void setReflectionId(String reflectionId) {
            this.reflectionId = reflectionId;
        }

        public List<String> getEventIds() {
            return eventIds;
        }

        public void setEventIds(List<String> eventIds) {
            this.eventIds = eventIds;
        }

        public List<String> getNewlyUnlockedAxioms() {
            return newlyUnlockedAxioms;
        }

        public void setNewlyUnlockedAxioms(List<String> newlyUnlockedAxioms) {
            this.newlyUnlockedAxioms = newlyUnlockedAxioms;
        }

        public int getReflectionsSubmitted() {
            return reflectionsSubmitted;
        }

        public void setReflectionsSubmitted(int reflectionsSubmitted) {
            this.reflectionsSubmitted = reflectionsSubmitted;
        }

        public String getSubmittedAt() {
            return submittedAt;
        }

        public void setSubmittedAt(String submittedAt) {
            this.submittedAt = submittedAt;
        }
    }
}
