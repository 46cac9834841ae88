package com.example.roomtodobot.service;

import com.example.roomtodobot.model.ScheduledReminder;
import com.vdurmont.emoji.EmojiParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Sends a fired reminder to the user who set it
 */
@Slf4j
@Component
public class ReminderNotifier implements ReminderDelivery {

    private final MessageSender messageSender;

    public ReminderNotifier(MessageSender messageSender) {
        this.messageSender = messageSender;
    }

    @Override
    public void deliver(ScheduledReminder reminder) {
        String text = ":alarm_clock: Reminder";
        if (reminder.getRoomName() != null) text += " from «" + reminder.getRoomName() + "»";
        text += ":\n" + reminder.getCategory().getLabel() + " " + reminder.getTask();
        text = TextLimits.shorten(EmojiParser.parseToUnicode(text), TextLimits.MESSAGE_LENGTH);

        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(reminder.getUserId()));
        message.setText(text);
        try {
            messageSender.send(message);
            log.info("Reminder for todo {} delivered to {}", reminder.getTodoId(), reminder.getUserId());
        } catch (TelegramApiException e) {
            log.error("Reminder for todo {} not delivered: {}", reminder.getTodoId(), e.getMessage());
        }
    }
}
