package com.eduhub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {
    
    /**
     * UTC clock; quota windows are UTC days.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
