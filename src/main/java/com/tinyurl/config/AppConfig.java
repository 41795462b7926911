package com.tinyurl.config;

import com.tinyurl.generator.HashingShortCodeGenerator;
import com.tinyurl.generator.RandomShortCodeGenerator;
import com.tinyurl.generator.ShortCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // app.short-code.strategy: "hashing" (default) or "random"
    @Bean
    public ShortCodeGenerator shortCodeGenerator(@Value("${app.short-code.strategy:hashing}") String strategy, Clock clock) {
        SecureRandom random = new SecureRandom();
        switch (strategy.toLowerCase()) {
            case "hashing":
                return new HashingShortCodeGenerator(clock, random);
            case "random":
                log.info("Using random short code generator");
                return new RandomShortCodeGenerator(random);
            default:
                throw new IllegalArgumentException("Unknown short code strategy: " + strategy);
        }
    }
}
