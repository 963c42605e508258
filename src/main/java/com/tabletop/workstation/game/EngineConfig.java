package com.tabletop.workstation.game;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource() {
        return RandomSource.secure();
    }

    @Bean
    public ActionProcessor actionProcessor(RandomSource randomSource,
                                           Clock clock,
                                           @Value("${workstation.engine.starting-hand-size:7}") int startingHandSize,
                                           @Value("${workstation.engine.signed-counters:loyalty}") Set<String> signedCounters) {
        return new ActionProcessor(randomSource, clock, startingHandSize, signedCounters);
    }
}
