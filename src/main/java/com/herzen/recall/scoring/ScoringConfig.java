package com.herzen.recall.scoring;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
public class ScoringConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionIdGenerator sessionIdGenerator() {
        return () -> UUID.randomUUID().toString();
    }
}
