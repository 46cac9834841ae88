package com.example.roomtodobot.model;

import lombok.Value;

/**
 * Outcome of a join or leave. The failure statuses are expected answers, not errors.
 */
@Value
public class RoomResult {

    public enum Status {
        OK,
        NOT_FOUND,
        WRONG_PASSWORD,
        NOT_A_MEMBER
    }

    Status status;
    String roomName;

    public static RoomResult ok(String roomName) {
        return new RoomResult(Status.OK, roomName);
    }

    public static RoomResult of(Status status) {
        return new RoomResult(status, null);
    }
}
