package com.parkezy.booking.events;

import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;
import com.parkezy.booking.ledger.BookingChangedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private BookingEventPublisher publisher;

    @Test
    @DisplayName("status change is sent keyed by booking id with wire values")
    void onBookingChanged_sendsWireEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.onBookingChanged(new BookingChangedEvent(11L, BookingType.COMMERCIAL, "driver-1", "owner-1",
                BookingStatus.CONFIRMED, BookingStatus.CANCEL_REQUESTED, NOW));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(BookingEventPublisher.TOPIC_BOOKING_STATUS_CHANGED), eq("11"), payload.capture());
        BookingStatusChangedEvent event = (BookingStatusChangedEvent) payload.getValue();
        assertThat(event.getBookingType()).isEqualTo("commercial");
        assertThat(event.getPreviousStatus()).isEqualTo("confirmed");
        assertThat(event.getNewStatus()).isEqualTo("cancel_requested");
        assertThat(event.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("creation events carry no previous status")
    void onBookingChanged_creation() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.onBookingChanged(new BookingChangedEvent(12L, BookingType.PRIVATE, "driver-1", "host-1",
                null, BookingStatus.REQUESTED, NOW));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(anyString(), eq("12"), payload.capture());
        assertThat(((BookingStatusChangedEvent) payload.getValue()).getPreviousStatus()).isNull();
    }

    @Test
    @DisplayName("a failed send is logged, never thrown back into the committed caller")
    void onBookingChanged_sendFails() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        assertThatCode(() -> publisher.onBookingChanged(new BookingChangedEvent(13L, BookingType.PRIVATE,
                "driver-1", "host-1", BookingStatus.ACTIVE, BookingStatus.COMPLETED, NOW)))
                .doesNotThrowAnyException();
    }
}
