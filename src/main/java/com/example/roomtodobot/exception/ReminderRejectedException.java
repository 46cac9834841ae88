package com.example.roomtodobot.exception;

/**
 * Reminder was not armed: the fire time is not in the future or the scheduler is shut down.
 */
public class ReminderRejectedException extends RuntimeException {

    public ReminderRejectedException(String message) {
        super(message);
    }
}
