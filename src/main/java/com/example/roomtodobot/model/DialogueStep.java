package com.example.roomtodobot.model;

public enum DialogueStep {
    IDLE(false),
    SELECTING_ROOM(false),
    CHOOSING_CATEGORY(false),
    ENTERING_TASK(true),
    DECIDING_REMINDER(false),
    ENTERING_REMINDER_DATE(true),
    ENTERING_REMINDER_TIME(true),
    CHOOSING_TODO(false),
    ENTERING_ROOM_NAME(true),
    ENTERING_ROOM_PASSWORD(true),
    ENTERING_ROOM_CODE(true),
    ENTERING_JOIN_PASSWORD(true);

    private final boolean expectingText;

    DialogueStep(boolean expectingText) {
        this.expectingText = expectingText;
    }

    /**
     * Free text in this step is an answer, never a menu command
     */
    public boolean isExpectingText() {
        return expectingText;
    }
}
