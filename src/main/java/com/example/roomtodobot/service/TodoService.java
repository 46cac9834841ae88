package com.example.roomtodobot.service;

import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.Room;
import com.example.roomtodobot.model.RoomTodoEvent;
import com.example.roomtodobot.model.TodoItem;
import com.example.roomtodobot.repository.RoomMemberRepository;
import com.example.roomtodobot.repository.RoomRepository;
import com.example.roomtodobot.repository.TodoRepository;
import com.vdurmont.emoji.EmojiParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class TodoService {

    private final TodoRepository todoRepository;
    private final RoomRepository roomRepository;
    private final RoomMemberRepository roomMemberRepository;
    private final UserService userService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TodoService(TodoRepository todoRepository,
                       RoomRepository roomRepository,
                       RoomMemberRepository roomMemberRepository,
                       UserService userService,
                       ApplicationEventPublisher eventPublisher,
                       Clock clock) {
        this.todoRepository = todoRepository;
        this.roomRepository = roomRepository;
        this.roomMemberRepository = roomMemberRepository;
        this.userService = userService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Adds a todo to the room. Membership is re-checked here, under the room lock.
     *
     * @return the saved item, or empty when the room is gone or the author is not a member
     */
    @Transactional
    public Optional<TodoItem> addTodo(String roomCode, Long userId, Category category, String task) {
        Optional<Room> room = roomRepository.findLockedByRoomCode(roomCode);
        if (room.isEmpty() || !roomMemberRepository.existsByRoom_RoomCodeAndUserId(roomCode, userId)) {
            log.warn("Todo refused: user {} is not a member of room {}", userId, roomCode);
            return Optional.empty();
        }
        userService.ensureUser(userId);

        TodoItem todo = todoRepository.save(new TodoItem(roomCode, userId, category, task, LocalDateTime.now(clock)));
        log.info("New todo {} in room {} by {}", todo.getId(), roomCode, userId);

        eventPublisher.publishEvent(new RoomTodoEvent(roomCode, userId, EmojiParser.parseToUnicode(
                ":pushpin: " + userService.displayName(userId) + " added to «" + room.get().getRoomName() + "»:\n"
                        + category.getLabel() + " " + TextLimits.shorten(task, TextLimits.TASK_ECHO_LENGTH))));
        return Optional.of(todo);
    }

    /**
     * Todos of the room ordered by category rank, then creation time. Unknown rooms give an empty list.
     *
     * @param category filter, or null for every category
     */
    @Transactional(readOnly = true)
    public List<TodoItem> listTodos(String roomCode, Category category) {
        List<TodoItem> todos = category == null
                ? todoRepository.findAllByRoomCode(roomCode)
                : todoRepository.findAllByRoomCodeAndCategory(roomCode, category);
        return todos.stream()
                .sorted(TodoItem.LISTING_ORDER)
                .toList();
    }

    /**
     * Removes the todo when it belongs to the room and the actor is still a member there.
     *
     * @return true only for the call that actually removed the row
     */
    @Transactional
    public boolean deleteTodo(String roomCode, Long todoId, Long userId) {
        Optional<Room> room = roomRepository.findLockedByRoomCode(roomCode);
        if (room.isEmpty() || !roomMemberRepository.existsByRoom_RoomCodeAndUserId(roomCode, userId)) {
            return false;
        }
        Optional<TodoItem> todo = todoRepository.findByIdAndRoomCode(todoId, roomCode);
        if (todo.isEmpty()) return false;

        todoRepository.delete(todo.get());
        log.info("Todo {} removed from room {} by {}", todoId, roomCode, userId);

        eventPublisher.publishEvent(new RoomTodoEvent(roomCode, userId, EmojiParser.parseToUnicode(
                ":white_check_mark: " + userService.displayName(userId) + " removed from «" + room.get().getRoomName()
                        + "»:\n" + todo.get().getCategory().getLabel() + " "
                        + TextLimits.shorten(todo.get().getTask(), TextLimits.TASK_ECHO_LENGTH))));
        return true;
    }

    @Transactional
    public boolean setReminderTime(Long todoId, LocalDateTime reminderTime) {
        Optional<TodoItem> todo = todoRepository.findById(todoId);
        if (todo.isEmpty()) return false;
        todo.get().setReminderTime(reminderTime);
        todoRepository.save(todo.get());
        return true;
    }

    /**
     * Todos whose reminder is still ahead, used to re-arm timers after a restart
     */
    @Transactional(readOnly = true)
    public List<TodoItem> findPendingReminders(LocalDateTime now) {
        return todoRepository.findAllByReminderTimeAfter(now);
    }
}
