package com.smartroom.booking.events;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link BookingEventPublisher}.
 *
 * Publishing is fire-and-forget: neither a failed send nor a rejected hand-off may reach the caller.
 */
@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private BookingEventPublisher publisher;

    private static BookingLifecycleEvent event(BookingEventType type) {
        return BookingLifecycleEvent.builder()
                .eventType(type)
                .bookingId(11L)
                .roomId(101L)
                .userId(1L)
                .version(2L)
                .timestamp(Instant.parse("2025-01-06T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("publish sends to the event type's topic keyed by booking id")
    void publish_success() {
        // given
        BookingLifecycleEvent event = event(BookingEventType.CANCELLED);
        SendResult<String, Object> result = new SendResult<>(
                new ProducerRecord<>("booking-cancelled", "11", event),
                new RecordMetadata(new TopicPartition("booking-cancelled", 0), 42L, 0, 0L, 0, 0));
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(CompletableFuture.completedFuture(result));

        // when
        publisher.publish(event);

        // then
        verify(kafkaTemplate).send("booking-cancelled", "11", event);
    }

    @Test
    @DisplayName("asynchronous send failure is logged, not thrown")
    void publish_asyncFailure() {
        // given
        BookingLifecycleEvent event = event(BookingEventType.SUPERSEDED);
        given(kafkaTemplate.send(anyString(), anyString(), any()))
                .willReturn(CompletableFuture.failedFuture(new KafkaException("broker unavailable")));

        // when / then
        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
        verify(kafkaTemplate).send("booking-superseded", "11", event);
    }

    @Test
    @DisplayName("synchronous send failure (e.g. metadata timeout) is logged, not thrown")
    void publish_syncFailure() {
        // given
        BookingLifecycleEvent event = event(BookingEventType.REJECTED);
        willThrow(new KafkaException("metadata timeout")).given(kafkaTemplate).send(anyString(), anyString(), any());

        // when / then
        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
    }
}
