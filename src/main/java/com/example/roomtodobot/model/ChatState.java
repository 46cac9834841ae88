package com.example.roomtodobot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Pending answer expected from a user. Each step is built by its own factory, which fills only the
 * fields that step reads, so no two steps can be mixed up in one state.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChatState {

    DialogueStep step;
    PendingOperation operation;
    String roomCode;
    String roomName;
    Category category;
    String task;
    Long todoId;
    LocalDate reminderDate;
    Instant updatedAt;

    public static ChatState idle(Instant now) {
        return new ChatState(DialogueStep.IDLE, null, null, null, null, null, null, null, now);
    }

    /**
     * @param argument text typed after the command: the task of an add, the todo number of a delete
     */
    public static ChatState selectingRoom(PendingOperation operation, String argument, Instant now) {
        return new ChatState(DialogueStep.SELECTING_ROOM, operation, null, null, null, argument, null, null, now);
    }

    public static ChatState choosingCategory(PendingOperation operation, RoomSummary room, String draftTask, Instant now) {
        return new ChatState(DialogueStep.CHOOSING_CATEGORY, operation, room.getRoomCode(), room.getRoomName(),
                null, draftTask, null, null, now);
    }

    public static ChatState enteringTask(String roomCode, String roomName, Category category, Instant now) {
        return new ChatState(DialogueStep.ENTERING_TASK, PendingOperation.ADD, roomCode, roomName,
                category, null, null, null, now);
    }

    public static ChatState decidingReminder(TodoItem todo, String roomName, Instant now) {
        return new ChatState(DialogueStep.DECIDING_REMINDER, PendingOperation.ADD, todo.getRoomCode(), roomName,
                todo.getCategory(), todo.getTask(), todo.getId(), null, now);
    }

    public static ChatState enteringReminderDate(ChatState draft, Instant now) {
        return new ChatState(DialogueStep.ENTERING_REMINDER_DATE, PendingOperation.ADD, draft.roomCode, draft.roomName,
                draft.category, draft.task, draft.todoId, null, now);
    }

    public static ChatState enteringReminderTime(ChatState draft, LocalDate date, Instant now) {
        return new ChatState(DialogueStep.ENTERING_REMINDER_TIME, PendingOperation.ADD, draft.roomCode, draft.roomName,
                draft.category, draft.task, draft.todoId, date, now);
    }

    public static ChatState choosingTodo(RoomSummary room, Instant now) {
        return new ChatState(DialogueStep.CHOOSING_TODO, PendingOperation.DELETE, room.getRoomCode(), room.getRoomName(),
                null, null, null, null, now);
    }

    public static ChatState enteringRoomName(Instant now) {
        return new ChatState(DialogueStep.ENTERING_ROOM_NAME, null, null, null, null, null, null, null, now);
    }

    public static ChatState enteringRoomPassword(String roomName, Instant now) {
        return new ChatState(DialogueStep.ENTERING_ROOM_PASSWORD, null, null, roomName, null, null, null, null, now);
    }

    public static ChatState enteringRoomCode(Instant now) {
        return new ChatState(DialogueStep.ENTERING_ROOM_CODE, null, null, null, null, null, null, null, now);
    }

    public static ChatState enteringJoinPassword(String roomCode, Instant now) {
        return new ChatState(DialogueStep.ENTERING_JOIN_PASSWORD, null, roomCode, null, null, null, null, null, now);
    }

    public boolean isIdle() {
        return step == DialogueStep.IDLE;
    }

    public boolean is(DialogueStep expected) {
        return step == expected;
    }
}
