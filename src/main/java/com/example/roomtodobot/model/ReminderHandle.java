package com.example.roomtodobot.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ReminderHandle {
    long jobId;
    Long todoId;
    Instant fireAt;
}
