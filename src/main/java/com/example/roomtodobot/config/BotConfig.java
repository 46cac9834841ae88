package com.example.roomtodobot.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Data
public class BotConfig {

    @Value("${bot.name}")
    String botName;

    @Value("${bot.token}")
    String token;

    @Value("${bot.zone-id:UTC}")
    String zoneId;

    // unanswered dialogues are dropped after this many minutes
    @Value("${bot.dialogue.idle-timeout-minutes:30}")
    long idleTimeoutMinutes;
}
