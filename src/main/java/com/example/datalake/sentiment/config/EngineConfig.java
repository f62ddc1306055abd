package com.example.datalake.sentiment.config;

import com.example.datalake.sentiment.store.EngineState;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EngineState engineState() {
        return new EngineState();
    }
}
