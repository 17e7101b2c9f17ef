package com.numbersgame.puzzleserver;

import com.numbersgame.puzzleserver.engine.ReachabilitySolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

@Configuration
public class EngineConfig {

    @Bean
    public Random puzzleRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReachabilitySolver reachabilitySolver(@Value("${puzzle.solver.timeout-ms:2000}") long timeoutMs) {
        return new ReachabilitySolver(timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null);
    }
}
