package com.example.roomtodobot.model;

import lombok.Value;

@Value
public class RoomSummary {
    String roomCode;
    String roomName;
}
