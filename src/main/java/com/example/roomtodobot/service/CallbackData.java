package com.example.roomtodobot.service;

import java.util.Optional;

/**
 * Inline button tokens: an action prefix followed by its argument, e.g. {@code delete_42}
 */
public final class CallbackData {

    public static final String ROOM = "room_";
    public static final String ADD_CATEGORY = "add_category_";
    public static final String LIST_CATEGORY = "list_category_";
    public static final String DELETE = "delete_";
    public static final String LEAVE = "leave_";
    public static final String DATE = "date_";
    public static final String TIME = "time_";
    public static final String REMINDER_SET = "reminder_set";
    public static final String REMINDER_SKIP = "reminder_skip";
    public static final String ALL_CATEGORIES = "all";

    private CallbackData() {
    }

    public static String of(String prefix, Object argument) {
        return prefix + argument;
    }

    public static Optional<String> argument(String data, String prefix) {
        if (data == null || !data.startsWith(prefix) || data.length() == prefix.length()) return Optional.empty();
        return Optional.of(data.substring(prefix.length()));
    }
}
