package com.example.roomtodobot.model;

import lombok.Value;

/**
 * Published by the todo store after an add or delete, delivered to the room after commit.
 */
@Value
public class RoomTodoEvent {
    String roomCode;
    Long actorId;
    String text;
}
