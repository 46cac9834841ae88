package com.example.roomtodobot.model;

/**
 * Room-scoped operation remembered while the user picks a room or a category
 */
public enum PendingOperation {
    ADD,
    LIST,
    DELETE
}
