package com.example.roomtodobot.service;

import com.example.roomtodobot.exception.ReminderRejectedException;
import com.example.roomtodobot.model.ScheduledReminder;
import com.example.roomtodobot.model.TodoItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Timers live in memory only; on startup the reminders stored on todo rows that are still
 * ahead get armed again. Reminders whose time passed while the bot was down are not sent.
 */
@Slf4j
@Component
public class ReminderRecovery {

    private final TodoService todoService;
    private final RoomService roomService;
    private final ReminderScheduler reminderScheduler;
    private final Clock clock;

    public ReminderRecovery(TodoService todoService,
                            RoomService roomService,
                            ReminderScheduler reminderScheduler,
                            Clock clock) {
        this.todoService = todoService;
        this.roomService = roomService;
        this.reminderScheduler = reminderScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rearmPendingReminders() {
        List<TodoItem> pending = todoService.findPendingReminders(LocalDateTime.now(clock));
        int armed = 0;
        for (TodoItem todo : pending) {
            ScheduledReminder reminder = new ScheduledReminder(
                    todo.getId(),
                    todo.getUserId(),
                    todo.getRoomCode(),
                    todo.getRoomCode() != null ? roomService.findRoomName(todo.getRoomCode()).orElse(null) : null,
                    todo.getCategory(),
                    todo.getTask(),
                    todo.getReminderTime().atZone(clock.getZone()).toInstant());
            try {
                reminderScheduler.schedule(reminder.getFireAt(), reminder);
                armed++;
            } catch (ReminderRejectedException e) {
                log.warn("Reminder for todo {} not re-armed: {}", todo.getId(), e.getMessage());
            }
        }
        if (armed > 0) log.info("Re-armed {} reminders after startup", armed);
    }
}
