package com.linguabot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the engines.
 */
@Configuration(proxyBeanMethods = false)
public class TutorConfiguration {

    /**
     * Clock used for test deadlines and the daily conversation cap. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock tutorClock() {
        return Clock.systemUTC();
    }
}
