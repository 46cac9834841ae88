package com.example.roomtodobot.service;

import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.RoomSummary;
import com.example.roomtodobot.model.TodoItem;
import com.vdurmont.emoji.EmojiParser;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class KeyboardSetups {

    public static final String MENU_ADD = EmojiParser.parseToUnicode(":heavy_plus_sign: Add todo");
    public static final String MENU_LIST = EmojiParser.parseToUnicode(":clipboard: List todos");
    public static final String MENU_DELETE = EmojiParser.parseToUnicode(":x: Delete todo");
    public static final String MENU_CREATE_ROOM = EmojiParser.parseToUnicode(":house: Create room");
    public static final String MENU_JOIN_ROOM = EmojiParser.parseToUnicode(":key: Join room");
    public static final String MENU_LEAVE_ROOM = EmojiParser.parseToUnicode(":door: Leave room");
    public static final String MENU_MY_ROOMS = EmojiParser.parseToUnicode(":busts_in_silhouette: My rooms");
    public static final String CANCEL = "Cancel";

    static final List<String> TIME_SLOTS = List.of("09:00", "12:00", "15:00", "18:00", "21:00");
    static final int DATE_BUTTONS = 7;
    static final int TODO_BUTTONS = 50;
    private static final int TASK_BUTTON_LENGTH = 40;
    private static final DateTimeFormatter DATE_BUTTON_FORMAT = DateTimeFormatter.ofPattern("EEE dd.MM", Locale.ENGLISH);

    public void setDefaultKeyboard(SendMessage message) {
        ReplyKeyboardMarkup keyboardMarkup = new ReplyKeyboardMarkup();
        List<KeyboardRow> keyboardRows = new ArrayList<>();

        KeyboardRow row = new KeyboardRow();
        row.add(MENU_ADD);
        row.add(MENU_LIST);
        row.add(MENU_DELETE);
        keyboardRows.add(row);

        row = new KeyboardRow();
        row.add(MENU_CREATE_ROOM);
        row.add(MENU_JOIN_ROOM);
        keyboardRows.add(row);

        row = new KeyboardRow();
        row.add(MENU_MY_ROOMS);
        row.add(MENU_LEAVE_ROOM);
        keyboardRows.add(row);

        keyboardMarkup.setKeyboard(keyboardRows);
        keyboardMarkup.setResizeKeyboard(true);
        message.setReplyMarkup(keyboardMarkup);
    }

    public void setCancelKeyboard(SendMessage message) {
        ReplyKeyboardMarkup keyboardMarkup = new ReplyKeyboardMarkup();
        List<KeyboardRow> keyboardRows = new ArrayList<>();

        KeyboardRow row = new KeyboardRow();
        row.add(CANCEL);
        keyboardRows.add(row);

        keyboardMarkup.setKeyboard(keyboardRows);
        keyboardMarkup.setResizeKeyboard(true);
        message.setReplyMarkup(keyboardMarkup);
    }

    /**
     * Category picker; {@code withAll} adds an "All" button for listing
     */
    public InlineKeyboardMarkup categoryKeyboard(String prefix, boolean withAll) {
        List<InlineKeyboardButton> row = new ArrayList<>();
        for (Category category : Category.values()) {
            row.add(button(category.getLabel(), CallbackData.of(prefix, category.getId())));
        }
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        rows.add(row);
        if (withAll) rows.add(List.of(button("All", CallbackData.of(prefix, CallbackData.ALL_CATEGORIES))));
        return new InlineKeyboardMarkup(rows);
    }

    public InlineKeyboardMarkup roomKeyboard(List<RoomSummary> rooms, String prefix) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (RoomSummary room : rooms) {
            rows.add(List.of(button(room.getRoomName() + " (" + room.getRoomCode() + ")",
                    CallbackData.of(prefix, room.getRoomCode()))));
        }
        return new InlineKeyboardMarkup(rows);
    }

    /**
     * One button per todo, numbered like the listing. Only the first {@link #TODO_BUTTONS} todos get a button.
     */
    public InlineKeyboardMarkup todoKeyboard(List<TodoItem> todos) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        int counter = 1;
        for (TodoItem todo : todos) {
            if (counter > TODO_BUTTONS) break;
            String task = TextLimits.shorten(todo.getTask(), TASK_BUTTON_LENGTH);
            rows.add(List.of(button(counter++ + ". " + task, CallbackData.of(CallbackData.DELETE, todo.getId()))));
        }
        return new InlineKeyboardMarkup(rows);
    }

    public InlineKeyboardMarkup reminderDecisionKeyboard() {
        List<InlineKeyboardButton> row = new ArrayList<>();
        row.add(button(EmojiParser.parseToUnicode(":bell: Set reminder"), CallbackData.REMINDER_SET));
        row.add(button("Skip", CallbackData.REMINDER_SKIP));
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        rows.add(row);
        return new InlineKeyboardMarkup(rows);
    }

    /**
     * Calendar strip: today and the following days, four per row
     */
    public InlineKeyboardMarkup dateKeyboard(LocalDate today) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        List<InlineKeyboardButton> row = new ArrayList<>();
        for (int i = 0; i < DATE_BUTTONS; i++) {
            LocalDate date = today.plusDays(i);
            String label = i == 0 ? "Today" : i == 1 ? "Tomorrow" : date.format(DATE_BUTTON_FORMAT);
            row.add(button(label, CallbackData.of(CallbackData.DATE, date)));
            if (row.size() == 4) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) rows.add(row);
        return new InlineKeyboardMarkup(rows);
    }

    public InlineKeyboardMarkup timeKeyboard() {
        List<InlineKeyboardButton> row = new ArrayList<>();
        for (String slot : TIME_SLOTS) {
            row.add(button(slot, CallbackData.of(CallbackData.TIME, slot)));
        }
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        rows.add(row);
        return new InlineKeyboardMarkup(rows);
    }

    private InlineKeyboardButton button(String text, String callbackData) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(text);
        button.setCallbackData(callbackData);
        return button;
    }
}
