package com.example.roomtodobot.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses what users type when setting a reminder. Nothing here throws on bad input: an invalid
 * text is an empty result.
 */
public final class ReminderTimeParser {

    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");
    private static final Pattern RELATIVE_TIME = Pattern.compile("in\\s+(\\d{1,4})\\s+(hours?|minutes?|mins?)");
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private ReminderTimeParser() {
    }

    /**
     * Accepts "HH:MM" (next occurrence: today if still ahead, otherwise tomorrow) or
     * "in N hours" / "in N minutes".
     */
    public static Optional<LocalDateTime> parseReminderTime(String text, LocalDateTime now) {
        if (text == null) return Optional.empty();

        Optional<LocalTime> clockTime = parseClockTime(text);
        if (clockTime.isPresent()) {
            LocalDateTime candidate = now.toLocalDate().atTime(clockTime.get());
            if (!candidate.isAfter(now)) candidate = candidate.plusDays(1);
            return Optional.of(candidate);
        }
        return parseRelativeTime(text, now);
    }

    /**
     * "in N hours" or "in N minutes" from now, N at least 1
     */
    public static Optional<LocalDateTime> parseRelativeTime(String text, LocalDateTime now) {
        if (text == null) return Optional.empty();
        Matcher matcher = RELATIVE_TIME.matcher(normalize(text));
        if (!matcher.matches()) return Optional.empty();

        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (amount < 1) return Optional.empty();
        return Optional.of(matcher.group(2).startsWith("h") ? now.plusHours(amount) : now.plusMinutes(amount));
    }

    /**
     * Strict 24h "HH:MM"
     */
    public static Optional<LocalTime> parseClockTime(String text) {
        if (text == null) return Optional.empty();
        Matcher matcher = CLOCK_TIME.matcher(text.trim());
        if (!matcher.matches()) return Optional.empty();

        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) return Optional.empty();
        return Optional.of(LocalTime.of(hour, minute));
    }

    /**
     * "today", "tomorrow" or "yyyy-mm-dd"; dates before today are rejected
     */
    public static Optional<LocalDate> parseDate(String text, LocalDate today) {
        if (text == null) return Optional.empty();
        String value = normalize(text);
        if (value.equals("today")) return Optional.of(today);
        if (value.equals("tomorrow")) return Optional.of(today.plusDays(1));
        if (!DATE.matcher(value).matches()) return Optional.empty();

        LocalDate date;
        try {
            date = LocalDate.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return date.isBefore(today) ? Optional.empty() : Optional.of(date);
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
