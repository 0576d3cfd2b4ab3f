package com.friendpick.backend.global.common.random;

import java.security.SecureRandom;
import java.util.Random;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Random source used when shuffling question sets. Tests construct services with a seeded instance.
 */
@Configuration
public class RandomConfig {

    @Bean
    public Random questionRandom() {
        return new SecureRandom();
    }
}
