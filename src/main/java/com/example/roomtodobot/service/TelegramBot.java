package com.example.roomtodobot.service;

import com.example.roomtodobot.config.BotConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Long-polling entry point. Updates are handed to the worker pool so one slow user
 * does not hold up the others.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bot.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBot extends TelegramLongPollingBot {

    final BotConfig config;
    private final DialogueEngine dialogueEngine;
    private final TaskExecutor updateExecutor;

    public TelegramBot(BotConfig config,
                       DialogueEngine dialogueEngine,
                       @Qualifier("updateExecutor") TaskExecutor updateExecutor) {
        super(config.getToken());
        this.config = config;
        this.dialogueEngine = dialogueEngine;
        this.updateExecutor = updateExecutor;

        List<BotCommand> listOfCommands = new ArrayList<>();
        listOfCommands.add(new BotCommand("/start", "Start talking to the bot"));
        listOfCommands.add(new BotCommand("/help", "List of commands"));
        listOfCommands.add(new BotCommand("/add", "Add a todo"));
        listOfCommands.add(new BotCommand("/list", "Show todos"));
        listOfCommands.add(new BotCommand("/delete", "Delete a todo"));
        listOfCommands.add(new BotCommand("/done", "Delete a todo by its number"));
        listOfCommands.add(new BotCommand("/create", "Create a room"));
        listOfCommands.add(new BotCommand("/join", "Join a room"));
        listOfCommands.add(new BotCommand("/leave", "Leave a room"));
        listOfCommands.add(new BotCommand("/rooms", "My rooms"));
        listOfCommands.add(new BotCommand("/cancel", "Cancel the current step"));
        try {
            this.execute(new SetMyCommands(listOfCommands, new BotCommandScopeDefault(), null));
        } catch (TelegramApiException e) {
            log.error("Error setting bot's command list: " + e.getMessage());
        }
    }

    @Override
    public String getBotUsername() {
        return config.getBotName();
    }

    @Override
    public void onUpdateReceived(Update update) {
        updateExecutor.execute(() -> {
            try {
                dispatch(update);
            } catch (RuntimeException e) {
                log.error("Failed to handle update {}: {}", update.getUpdateId(), e.getMessage(), e);
            }
        });
    }

    private void dispatch(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()) {
            Message message = update.getMessage();
            Long chatId = message.getChatId();
            String text = message.getText().trim();

            if (isStartCommand(text)) {
                var from = message.getFrom();
                dialogueEngine.handleStart(chatId,
                        from != null ? from.getFirstName() : message.getChat().getFirstName(),
                        from != null ? from.getUserName() : message.getChat().getUserName(),
                        from != null ? from.getLanguageCode() : null);
                return;
            }
            dialogueEngine.handleText(chatId, text);
        } else if (update.hasCallbackQuery()) {
            CallbackQuery callbackQuery = update.getCallbackQuery();
            answerCallback(callbackQuery.getId());
            // private chats only: the chat id is the user id
            dialogueEngine.handleCallback(callbackQuery.getFrom().getId(), callbackQuery.getData());
        }
    }

    /**
     * {@code /start}, also addressed to the bot ({@code /start@name}) or with a deep-link payload
     */
    static boolean isStartCommand(String text) {
        return text.equals("/start") || text.startsWith("/start ") || text.startsWith("/start@");
    }

    private void answerCallback(String callbackQueryId) {
        AnswerCallbackQuery answer = new AnswerCallbackQuery();
        answer.setCallbackQueryId(callbackQueryId);
        try {
            execute(answer);
        } catch (TelegramApiException e) {
            log.warn("Could not answer callback query: " + e.getMessage());
        }
    }
}
