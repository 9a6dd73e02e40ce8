package com.ruach.formation.adapters.out.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.application.service.FormationNotification;
import com.ruach.formation.bootstrap.config.FormationProperties;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("KafkaNotificationPublisher")
class KafkaNotificationPublisherTest {

    private static final String TOPIC = "formation-notifications";
    private static final FormationNotification NOTIFICATION = FormationNotification.of("user-1",
            FormationNotification.Kind.AXIOM_UNLOCKED, "axiom-awakening-identity",
            "New axiom unlocked: Identity in Christ", Instant.parse("2025-01-01T00:00:00Z"));
    private static final String STATUS_KEY = "formation:notification:" + NOTIFICATION.notificationId();

    private KafkaTemplate<String, String> kafkaTemplate;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private SimpleMeterRegistry meterRegistry;
    private KafkaNotificationPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        meterRegistry = new SimpleMeterRegistry();
        publisher = new KafkaNotificationPublisher(kafkaTemplate, redisTemplate, new ObjectMapper(),
                new FormationProperties(), meterRegistry);
    }

    private double outcome(String status) {
        return meterRegistry.counter("formation.notification.publish.outcome", "status", status).count();
    }

    private void brokerAcks() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 2), 41L, 0, 0L, 0, 0);
        SendResult<String, String> result = new SendResult<>(new ProducerRecord<>(TOPIC, "user-1", "{}"), metadata);
        when(kafkaTemplate.send(eq(TOPIC), eq("user-1"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(result));
    }

    @Test
    @DisplayName("publishes keyed by user and marks the notification done")
    void publishes() throws Exception {
        when(valueOps.setIfAbsent(eq(STATUS_KEY), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(true);
        brokerAcks();

        publisher.publish(NOTIFICATION);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("user-1"), json.capture());
        JsonNode body = new ObjectMapper().readTree(json.getValue());
        assertThat(body.get("notification_id").asText()).isEqualTo(NOTIFICATION.notificationId());
        assertThat(body.get("kind").asText()).isEqualTo("AXIOM_UNLOCKED");
        assertThat(body.get("created_at").asText()).isEqualTo("2025-01-01T00:00:00Z");
        verify(valueOps).set(STATUS_KEY, "DONE", 24, TimeUnit.HOURS);
        assertThat(outcome("success")).isEqualTo(1.0);
        assertThat(meterRegistry.timer("formation.notification.publish.latency").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("skips a notification already delivered")
    void duplicate() {
        when(valueOps.setIfAbsent(eq(STATUS_KEY), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(false);
        when(valueOps.get(STATUS_KEY)).thenReturn("DONE");

        publisher.publish(NOTIFICATION);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        assertThat(outcome("duplicate")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("refuses while another instance is publishing the same id")
    void inFlight() {
        when(valueOps.setIfAbsent(eq(STATUS_KEY), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(false);
        when(valueOps.get(STATUS_KEY)).thenReturn("PROCESSING");

        assertThatThrownBy(() -> publisher.publish(NOTIFICATION))
                .isInstanceOf(IllegalStateException.class);
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("a broker failure releases the status key and is rethrown")
    void brokerFailure() {
        when(valueOps.setIfAbsent(eq(STATUS_KEY), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(true);
        when(kafkaTemplate.send(eq(TOPIC), eq("user-1"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("leader not available")));

        assertThatThrownBy(() -> publisher.publish(NOTIFICATION))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining(NOTIFICATION.notificationId());

        verify(redisTemplate).delete(STATUS_KEY);
        verify(valueOps, never()).set(anyString(), eq("DONE"), anyLong(), any(TimeUnit.class));
        assertThat(outcome("failure")).isEqualTo(1.0);
    }
}
