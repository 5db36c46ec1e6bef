package com.parkezy.booking.events;

import com.parkezy.booking.ledger.BookingChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards committed booking changes to Kafka for downstream consumers
 * (notifications, analytics). Keyed by booking id so one booking's events stay ordered.
 *
 * Runs after commit: a rolled-back transition is never published. A failed send is logged
 * and not retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_STATUS_CHANGED = "booking-status-changed";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingChanged(BookingChangedEvent change) {
        BookingStatusChangedEvent event = BookingStatusChangedEvent.builder()
                .bookingId(change.bookingId())
                .bookingType(change.type().getWireValue())
                .driverId(change.driverId())
                .hostId(change.hostId())
                .previousStatus(change.previousStatus() == null ? null : change.previousStatus().getWireValue())
                .newStatus(change.newStatus().getWireValue())
                .timestamp(change.occurredAt())
                .build();

        publishEvent(TOPIC_BOOKING_STATUS_CHANGED, String.valueOf(change.bookingId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Event published successfully to topic {}: offset={}",
                            topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event to topic {}", topic, ex);
                }
            });
        } catch (RuntimeException e) {
            // The booking change is already committed; the send cannot undo it.
            log.error("Failed to hand event to Kafka producer for topic {}", topic, e);
        }
    }
}
