package com.parkezy.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Server time source for requested-at, approval and session stamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
