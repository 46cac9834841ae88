package com.example.roomtodobot.service;

import com.example.roomtodobot.model.ScheduledReminder;

/**
 * Callback the scheduler invokes once per fired reminder
 */
@FunctionalInterface
public interface ReminderDelivery {

    void deliver(ScheduledReminder reminder);
}
