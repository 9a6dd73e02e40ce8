package com.ruach.formation.adapters.in.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.adapters.codec.FormationEventCodec;
import com.ruach.formation.application.port.in.RecordActivityUseCase;
import com.ruach.formation.bootstrap.config.FormationProperties;
import com.ruach.formation.domain.entity.FormationEvent;

/**
 * Kafka inbound adapter: consumes formation activity events recorded by
 * other services (content views, checkpoint arrivals) from the activity
 * topic. Events the engine issues itself are refused as business errors.
 * <p>
 * Layered error handling:
 * <ol>
 * <li><b>Parse Error:</b> DLQ + skip</li>
 * <li><b>Business Logic Error:</b> DLQ + skip</li>
 * <li><b>Transient Error:</b> Throw → Kafka retry</li>
 * <li><b>Unknown Error:</b> DLQ + skip</li>
 * </ol>
 * </p>
 */
@Component
public class FormationActivityConsumer {

    private static final Logger log = LoggerFactory.getLogger(FormationActivityConsumer.class);

    private final RecordActivityUseCase recordActivityUseCase;
    private final FormationEventCodec codec;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String dlqTopic;

    public FormationActivityConsumer(RecordActivityUseCase recordActivityUseCase,
            FormationEventCodec codec,
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            Clock clock,
            FormationProperties properties) {
        this.recordActivityUseCase = recordActivityUseCase;
        this.codec = codec;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dlqTopic = properties.getKafka().getTopics().getDlq();
    }

    /**
     * Uses manual acknowledgment so an offset is only committed once the
     * event is stored or parked on the DLQ.
     */
    @KafkaListener(topics = "${formation.kafka.topics.activity:formation-activity}", groupId = "formation-engine")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String key = record.key();

        try {
            MDC.put("kafkaTopic", record.topic());
            MDC.put("kafkaPartition", String.valueOf(record.partition()));
            MDC.put("kafkaOffset", String.valueOf(record.offset()));

            log.info("action=activity_received key={} partition={} offset={}",
                    key, record.partition(), record.offset());

            FormationEvent event = codec.readEvent(record.value(), deliveryId(record), deliveryTime(record));
            MDC.put("userId", event.getUserId());
            MDC.put("eventType", event.getEventType().getWireName());

            recordActivityUseCase.record(event);

            ack.acknowledge();
            log.info("action=activity_acknowledged eventId={} userId={}", event.getId(), event.getUserId());

        } catch (JsonProcessingException e) {
            log.error("action=parse_error key={} error={}", key, e.getMessage());
            sendToDlq(record, "PARSE_ERROR", e);
            ack.acknowledge();

        } catch (IllegalStateException | IllegalArgumentException e) {
            // retry won't fix this
            log.error("action=business_error key={} error={}", key, e.getMessage());
            sendToDlq(record, "BUSINESS_ERROR", e);
            ack.acknowledge();

        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            // Redis or database unreachable: not acknowledged, Kafka redelivers
            log.error("action=transient_error key={} error={}", key, e.getMessage());
            throw new RuntimeException("Transient infrastructure error", e);

        } catch (Exception e) {
            log.error("action=unknown_error key={} error={}", key, e.getMessage(), e);
            sendToDlq(record, "UNKNOWN_ERROR", e);
            ack.acknowledge();

        } finally {
            MDC.clear();
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    /**
     * Stable id for an envelope that carries none: the same record always
     * maps to the same event, so a redelivery is absorbed by the store.
     */
    static String deliveryId(ConsumerRecord<String, String> record) {
        String coordinates = record.topic() + ":" + record.partition() + ":" + record.offset();
        return UUID.nameUUIDFromBytes(coordinates.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private Instant deliveryTime(ConsumerRecord<String, String> record) {
        return record.timestamp() >= 0 ? Instant.ofEpochMilli(record.timestamp()) : clock.instant();
    }

    private void sendToDlq(ConsumerRecord<String, String> record, String errorType, Exception error) {
        try {
            DlqMessage dlqMessage = new DlqMessage(
                    record.topic(),
                    record.partition(),
                    record.offset(),
                    record.key(),
                    record.value(),
                    errorType,
                    error.getMessage(),
                    abbreviatedStackTrace(error),
                    Instant.now(clock).toString());

            kafkaTemplate.send(dlqTopic, record.key(), objectMapper.writeValueAsString(dlqMessage));
            log.warn("action=sent_to_dlq errorType={} key={} originalTopic={}",
                    errorType, record.key(), record.topic());
        } catch (Exception dlqError) {
            // the record is acknowledged either way
            log.error("action=dlq_send_failed key={} error={}", record.key(), dlqError.getMessage());
        }
    }

    private String abbreviatedStackTrace(Exception e) {
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement element : e.getStackTrace()) {
            sb.append(element.toString()).append("\n");
            if (sb.length() > 500)
                break;
        }
        return sb.toString();
    }

    /**
     * DLQ message envelope with error context.
     */
    public record DlqMessage(
            String originalTopic,
            int originalPartition,
            long originalOffset,
            String originalKey,
            String originalValue,
            String errorType,
            String errorMessage,
            String stackTrace,
            String timestamp) {
    }
}
