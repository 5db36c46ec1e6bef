package com.parkezy.booking.api.controller;

import com.parkezy.booking.api.dto.BookingResponse;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.booking.subscription.BookingFeed;
import com.parkezy.booking.subscription.BookingSubscription;
import com.parkezy.booking.subscription.BookingSubscriptionService;
import com.parkezy.common.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Server-Sent Events for live booking feeds. Each event carries the full current list.
 * Only the feed's owner may follow it.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings/stream")
@RequiredArgsConstructor
public class BookingStreamController {

    private static final String EVENT_NAME = "bookings";

    private final BookingSubscriptionService subscriptionService;
    private final CurrentUserProvider currentUserProvider;

    @Value("${parking.subscription.sse-timeout-ms:1800000}")
    private long sseTimeoutMs;

    @GetMapping(value = "/driver/{driverId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamDriverBookings(@PathVariable String driverId) {
        return open(BookingFeed.driverBookings(driverId));
    }

    @GetMapping(value = "/driver/{driverId}/active", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamActiveDriverBookings(@PathVariable String driverId) {
        return open(BookingFeed.driverActiveBookings(driverId));
    }

    @GetMapping(value = "/host/{hostId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamHostBookings(@PathVariable String hostId) {
        return open(BookingFeed.hostBookings(hostId));
    }

    @GetMapping(value = "/host/{hostId}/pending", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamPendingApprovals(@PathVariable String hostId) {
        return open(BookingFeed.pendingApprovals(hostId));
    }

    private SseEmitter open(BookingFeed feed) {
        String userId = currentUserProvider.requireCurrentUserId();
        if (!userId.equals(feed.ownerId())) {
            throw new AccessDeniedException("Users can only follow their own booking feeds");
        }
        log.info("SSE subscription request: feed={}, user={}", feed.type(), userId);

        SseEmitter emitter = new SseEmitter(sseTimeoutMs);
        BookingSubscription subscription = subscriptionService.subscribe(feed, bookings -> {
            List<BookingResponse> snapshot = bookings.stream().map(BookingResponse::from).toList();
            try {
                emitter.send(SseEmitter.event().name(EVENT_NAME).data(snapshot, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());
        return emitter;
    }
}
