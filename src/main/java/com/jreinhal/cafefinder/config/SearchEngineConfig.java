package com.jreinhal.cafefinder.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchEngineConfig {

    /**
     * Source of "today" for temporal entities and session filters.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
