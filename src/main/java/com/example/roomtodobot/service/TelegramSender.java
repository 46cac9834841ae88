package com.example.roomtodobot.service;

import com.example.roomtodobot.config.BotConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Component
@ConditionalOnProperty(name = "bot.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramSender extends DefaultAbsSender implements MessageSender {

    public TelegramSender(BotConfig config) {
        super(new DefaultBotOptions(), config.getToken());
    }

    @Override
    public void send(SendMessage message) throws TelegramApiException {
        execute(message);
    }
}
