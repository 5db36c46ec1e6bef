package com.parkezy.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingStatusTest {

    @Test
    @DisplayName("terminal statuses have no outgoing edge")
    void terminalStatuses_haveNoSuccessors() {
        for (BookingStatus terminal : EnumSet.of(BookingStatus.COMPLETED, BookingStatus.CANCELLED,
                BookingStatus.REJECTED, BookingStatus.NO_SHOW)) {
            assertThat(terminal.isTerminal()).isTrue();
            for (BookingStatus next : BookingStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
            }
        }
    }

    @Test
    @DisplayName("lifecycle edges are allowed, shortcuts are not")
    void lifecycleEdges() {
        assertThat(BookingStatus.REQUESTED.canTransitionTo(BookingStatus.CONFIRMED)).isTrue();
        assertThat(BookingStatus.REQUESTED.canTransitionTo(BookingStatus.REJECTED)).isTrue();
        assertThat(BookingStatus.CONFIRMED.canTransitionTo(BookingStatus.ACTIVE)).isTrue();
        assertThat(BookingStatus.CONFIRMED.canTransitionTo(BookingStatus.NO_SHOW)).isTrue();
        assertThat(BookingStatus.ACTIVE.canTransitionTo(BookingStatus.COMPLETED)).isTrue();
        assertThat(BookingStatus.ACTIVE.canTransitionTo(BookingStatus.CANCEL_REQUESTED)).isTrue();
        assertThat(BookingStatus.CANCEL_REQUESTED.canTransitionTo(BookingStatus.CANCELLED)).isTrue();

        assertThat(BookingStatus.REQUESTED.canTransitionTo(BookingStatus.ACTIVE)).isFalse();
        assertThat(BookingStatus.CONFIRMED.canTransitionTo(BookingStatus.COMPLETED)).isFalse();
        assertThat(BookingStatus.ACTIVE.canTransitionTo(BookingStatus.NO_SHOW)).isFalse();
        assertThat(BookingStatus.CANCEL_REQUESTED.canTransitionTo(BookingStatus.ACTIVE)).isFalse();
    }

    @Test
    @DisplayName("holding set is confirmed, active and cancel_requested")
    void holdingSet() {
        assertThat(BookingStatus.HOLDING)
                .containsExactlyInAnyOrder(BookingStatus.CONFIRMED, BookingStatus.ACTIVE, BookingStatus.CANCEL_REQUESTED);
        assertThat(BookingStatus.REQUESTED.holdsResource()).isFalse();
    }

    @Test
    @DisplayName("wire values round-trip and unknown values are rejected")
    void wireValues() {
        assertThat(BookingStatus.fromWireValue("cancel_requested")).isEqualTo(BookingStatus.CANCEL_REQUESTED);
        assertThat(BookingStatus.NO_SHOW.getWireValue()).isEqualTo("no_show");
        assertThatThrownBy(() -> BookingStatus.fromWireValue("pending"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
