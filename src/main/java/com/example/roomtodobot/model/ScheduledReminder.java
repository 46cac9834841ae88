package com.example.roomtodobot.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ScheduledReminder {
    Long todoId;
    Long userId;
    String roomCode;
    String roomName;
    Category category;
    String task;
    Instant fireAt;
}
