package com.smartroom.booking.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka event publisher for booking lifecycle events.
 *
 * One topic per event type (booking-confirmed, booking-rejected, booking-cancelled,
 * booking-superseded), keyed by booking id so all events of a booking stay ordered in
 * one partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher implements BookingEventSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(BookingLifecycleEvent event) {
        String topic = event.getEventType().getTopic();
        String key = String.valueOf(event.getBookingId());
        log.info("Publishing event to topic {}: bookingId={}, version={}", topic, event.getBookingId(), event.getVersion());

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand event to Kafka for topic {}: bookingId={}", topic, event.getBookingId(), e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}: bookingId={}", topic, event.getBookingId(), ex);
            }
        });
    }
}
