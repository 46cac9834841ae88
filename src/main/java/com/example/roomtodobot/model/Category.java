package com.example.roomtodobot.model;

import com.vdurmont.emoji.EmojiParser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of todo categories. Declaration order is the listing rank.
 */
public enum Category {
    GAME("Game", ":video_game:"),
    MOVIE("Movie", ":movie_camera:"),
    ACTION("Action", ":running:");

    private final String title;
    private final String emojiAlias;

    Category(String title, String emojiAlias) {
        this.title = title;
        this.emojiAlias = emojiAlias;
    }

    /**
     * Id used inside callback tokens, e.g. {@code add_category_game}
     */
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getLabel() {
        return EmojiParser.parseToUnicode(emojiAlias + " " + title);
    }

    public static Optional<Category> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(category -> category.getId().equals(id.trim().toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
