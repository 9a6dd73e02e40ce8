package com.ruach.formation.adapters.in.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruach.formation.adapters.codec.FormationEventCodec;
import com.ruach.formation.adapters.out.memory.InMemoryFormationEventStore;
import com.ruach.formation.application.port.in.RecordActivityUseCase;
import com.ruach.formation.bootstrap.config.FormationProperties;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.support.MutableClock;

@DisplayName("FormationActivityConsumer")
class FormationActivityConsumerTest {

    private static final String TOPIC = "formation-activity";
    private static final String DLQ = "formation-activity-dlq";
    private static final String SECTION_VIEWED = "{\"id\":\"evt-1\",\"user_id\":\"user-1\","
            + "\"event_type\":\"section_viewed\",\"timestamp\":\"2025-01-01T10:00:00Z\","
            + "\"payload\":{\"sectionId\":\"awakening-1\",\"phase\":\"AWAKENING\",\"dwellTimeSeconds\":45}}";

    private RecordActivityUseCase useCase;
    private KafkaTemplate<String, String> kafkaTemplate;
    private Acknowledgment ack;
    private FormationActivityConsumer consumer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        useCase = mock(RecordActivityUseCase.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        ack = mock(Acknowledgment.class);
        ObjectMapper objectMapper = new ObjectMapper();
        consumer = new FormationActivityConsumer(useCase, new FormationEventCodec(objectMapper), kafkaTemplate,
                objectMapper, new MutableClock(Instant.parse("2025-01-01T12:00:00Z")), new FormationProperties());
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(TOPIC, 0, 17L, "user-1", value);
    }

    @Test
    @DisplayName("records the event and acknowledges")
    void recordsEvent() {
        consumer.consume(record(SECTION_VIEWED), ack);

        ArgumentCaptor<FormationEvent> captor = ArgumentCaptor.forClass(FormationEvent.class);
        verify(useCase).record(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo("evt-1");
        assertThat(captor.getValue().getEventType()).isEqualTo(EventType.SECTION_VIEWED);
        verify(ack).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("a redelivered record without an id decodes to the same event and is stored once")
    void redeliveryWithoutId() {
        String withoutId = "{\"user_id\":\"user-1\",\"event_type\":\"canon_definition_viewed\","
                + "\"payload\":{\"axiomId\":\"axiom-awakening-authority\"}}";

        consumer.consume(record(withoutId), ack);
        consumer.consume(record(withoutId), ack);

        ArgumentCaptor<FormationEvent> captor = ArgumentCaptor.forClass(FormationEvent.class);
        verify(useCase, times(2)).record(captor.capture());
        FormationEvent first = captor.getAllValues().get(0);
        FormationEvent second = captor.getAllValues().get(1);
        assertThat(second.getId()).isEqualTo(first.getId())
                .isEqualTo(FormationActivityConsumer.deliveryId(record(withoutId)));
        assertThat(second.getTimestamp()).isEqualTo(first.getTimestamp());

        InMemoryFormationEventStore store = new InMemoryFormationEventStore();
        store.append(List.of(first));
        store.append(List.of(second));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("different offsets get different ids")
    void distinctOffsets() {
        assertThat(FormationActivityConsumer.deliveryId(new ConsumerRecord<>(TOPIC, 0, 17L, "user-1", "{}")))
                .isNotEqualTo(FormationActivityConsumer.deliveryId(
                        new ConsumerRecord<>(TOPIC, 0, 18L, "user-1", "{}")));
    }

    @Test
    @DisplayName("an event type the feed may not carry is a business error")
    void refusedType() {
        doThrow(new IllegalArgumentException("Event type content_unlocked cannot be recorded"))
                .when(useCase).record(any());

        consumer.consume(record(SECTION_VIEWED), ack);

        verify(kafkaTemplate).send(eq(DLQ), eq("user-1"), contains("BUSINESS_ERROR"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("unparseable JSON is parked on the DLQ and acknowledged")
    void parseError() {
        consumer.consume(record("{broken"), ack);

        verify(useCase, never()).record(any());
        verify(kafkaTemplate).send(eq(DLQ), eq("user-1"), contains("PARSE_ERROR"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("an unknown event type is a business error")
    void unknownType() {
        consumer.consume(record("{\"user_id\":\"user-1\",\"event_type\":\"lesson_skipped\"}"), ack);

        verify(kafkaTemplate).send(eq(DLQ), eq("user-1"), contains("BUSINESS_ERROR"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("an unreachable store is rethrown without acknowledging")
    void transientError() {
        doThrow(new DataAccessResourceFailureException("connection refused")).when(useCase).record(any());

        assertThatThrownBy(() -> consumer.consume(record(SECTION_VIEWED), ack))
                .isInstanceOf(RuntimeException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);

        verify(ack, never()).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("anything else goes to the DLQ as unknown")
    void unknownError() {
        doThrow(new UnsupportedOperationException("boom")).when(useCase).record(any());

        consumer.consume(record(SECTION_VIEWED), ack);

        verify(kafkaTemplate).send(eq(DLQ), eq("user-1"), contains("UNKNOWN_ERROR"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("a failing DLQ send still acknowledges")
    void dlqFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenThrow(new RuntimeException("broker down"));

        consumer.consume(record("{broken"), ack);

        verify(ack).acknowledge();
    }
}
