package com.ruach.formation.adapters.out.kafka;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.application.port.out.FormationNotificationPublisher;
import com.ruach.formation.application.service.FormationNotification;
import com.ruach.formation.bootstrap.config.FormationProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Kafka outbound adapter: publishes unlock and phase notifications, keyed by
 * user so one user's notices stay ordered on a partition.
 * <p>
 * A Redis status key per notification id (PROCESSING, then DONE) keeps
 * delivery at most once per id across retries and instances.
 * </p>
 */
public class KafkaNotificationPublisher implements FormationNotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaNotificationPublisher.class);

    private static final String PROCESSING = "PROCESSING";
    private static final String DONE = "DONE";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String notificationsTopic;
    private final String statusPrefix;
    private final long idempotencyTtlHours;
    private final long processingTtlMinutes;
    private final long publishAckTimeoutMs;

    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final Counter publishDuplicate;
    private final Timer publishLatency;

    public KafkaNotificationPublisher(KafkaTemplate<String, String> kafkaTemplate,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            FormationProperties properties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.notificationsTopic = properties.getKafka().getTopics().getNotifications();
        this.statusPrefix = properties.getNotifications().getRedisPrefix();
        this.idempotencyTtlHours = properties.getNotifications().getIdempotencyTtlHours();
        this.processingTtlMinutes = properties.getNotifications().getProcessingTtlMinutes();
        this.publishAckTimeoutMs = properties.getKafka().getPublishAckTimeoutMs();

        this.publishSuccess = meterRegistry.counter("formation.notification.publish.outcome", "status", "success");
        this.publishFailure = meterRegistry.counter("formation.notification.publish.outcome", "status", "failure");
        this.publishDuplicate = meterRegistry.counter("formation.notification.publish.outcome", "status", "duplicate");
        this.publishLatency = meterRegistry.timer("formation.notification.publish.latency");
    }

    @Override
    public void publish(FormationNotification notification) {
        Timer.Sample sample = Timer.start();
        String statusKey = statusPrefix + notification.notificationId();

        Boolean lockAcquired = redisTemplate.opsForValue()
                .setIfAbsent(statusKey, PROCESSING, processingTtlMinutes, TimeUnit.MINUTES);

        if (Boolean.FALSE.equals(lockAcquired)) {
            String existingStatus = redisTemplate.opsForValue().get(statusKey);
            if (DONE.equals(existingStatus)) {
                publishDuplicate.increment();
                log.warn("action=duplicate_notification_skipped notificationId={} userId={}",
                        notification.notificationId(), notification.userId());
                sample.stop(publishLatency);
                return;
            }
            sample.stop(publishLatency);
            log.warn("action=notification_inflight_skipped notificationId={} userId={} status={}",
                    notification.notificationId(), notification.userId(), existingStatus);
            throw new IllegalStateException(
                    "Notification publish already in progress for notificationId=" + notification.notificationId());
        }

        try {
            String json = serialize(notification);
            SendResult<String, String> sendResult = kafkaTemplate
                    .send(notificationsTopic, notification.userId(), json)
                    .get(publishAckTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("action=notification_published notificationId={} userId={} kind={} topic={} partition={} offset={}",
                    notification.notificationId(), notification.userId(), notification.kind(),
                    sendResult.getRecordMetadata().topic(),
                    sendResult.getRecordMetadata().partition(),
                    sendResult.getRecordMetadata().offset());

            redisTemplate.opsForValue().set(statusKey, DONE, idempotencyTtlHours, TimeUnit.HOURS);
            publishSuccess.increment();

        } catch (Exception e) {
            publishFailure.increment();
            redisTemplate.delete(statusKey);
            log.error("action=notification_publish_failed notificationId={} userId={} error={}",
                    notification.notificationId(), notification.userId(), e.getMessage(), e);
            throw new RuntimeException("Notification publish failed for notificationId="
                    + notification.notificationId(), e);
        } finally {
            sample.stop(publishLatency);
        }
    }

    private String serialize(FormationNotification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("notification_id", notification.notificationId());
        body.put("user_id", notification.userId());
        body.put("kind", notification.kind().name());
        body.put("content_id", notification.contentId());
        body.put("message", notification.message());
        body.put("created_at", notification.createdAt().toString());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize notification", e);
        }
    }
}
