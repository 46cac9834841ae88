package com.example.roomtodobot.service;

import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Outbound side of the transport: dialogue replies, room notifications and reminders all go here.
 */
public interface MessageSender {

    void send(SendMessage message) throws TelegramApiException;
}
