package com.example.roomtodobot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single clock for dialogue dates, reminder checks and timestamps, in the bot's zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock botClock(BotConfig config) {
        return Clock.system(ZoneId.of(config.getZoneId()));
    }
}
