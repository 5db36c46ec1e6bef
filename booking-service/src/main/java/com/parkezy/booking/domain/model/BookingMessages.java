package com.parkezy.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingMessages {

    @Column(name = "driver_message", length = 1000)
    private String driverMessage;

    @Column(name = "host_message", length = 1000)
    private String hostMessage;
}
