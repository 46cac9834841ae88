package com.example.roomtodobot.service;

import com.example.roomtodobot.config.BotConfig;
import com.example.roomtodobot.exception.ReminderRejectedException;
import com.example.roomtodobot.exception.StoreException;
import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.ChatState;
import com.example.roomtodobot.model.DialogueStep;
import com.example.roomtodobot.model.PendingOperation;
import com.example.roomtodobot.model.ReminderHandle;
import com.example.roomtodobot.model.RoomResult;
import com.example.roomtodobot.model.RoomSummary;
import com.example.roomtodobot.model.ScheduledReminder;
import com.example.roomtodobot.model.TodoItem;
import com.vdurmont.emoji.EmojiParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation state machine. Every inbound text or button press is read against the user's pending
 * {@link ChatState}; users without an entry are idle.
 */
@Slf4j
@Component
public class DialogueEngine {

    static final String HELP_TEXT = "Commands:\n" +
            "/add - add a todo to a room (or /add <task>)\n" +
            "/list - show a room's todos\n" +
            "/delete - delete a todo (or /done <number>)\n" +
            "/create - create a room\n" +
            "/join - join a room with its code and password\n" +
            "/leave - leave a room\n" +
            "/rooms - rooms you are in\n" +
            "/cancel - stop what you are doing\n" +
            "Everyone in a room sees its todos and gets notified about changes.";
    static final String NOT_IN_ROOM = "You are not in a room yet. Create one with /create or join one with /join.";
    static final String EXPIRED = "This button has expired. Please start again from the menu.";
    static final String STORE_FAILURE = "Something went wrong on our side. Please try again later.";
    static final String INVALID_TODO_NUMBER = "Please provide a valid task number. Usage: /done 1";
    static final int MAX_ROOM_NAME_LENGTH = 64;
    static final int LISTED_TASK_LENGTH = 500;

    private static final DateTimeFormatter REMINDER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final RoomService roomService;
    private final TodoService todoService;
    private final UserService userService;
    private final ReminderScheduler reminderScheduler;
    private final KeyboardSetups keyboardSetups;
    private final MessageSender messageSender;
    private final Clock clock;
    private final Duration idleTimeout;

    // no entry means the user is idle
    private final Map<Long, ChatState> chatStates = new ConcurrentHashMap<>();

    public DialogueEngine(RoomService roomService,
                          TodoService todoService,
                          UserService userService,
                          ReminderScheduler reminderScheduler,
                          KeyboardSetups keyboardSetups,
                          MessageSender messageSender,
                          Clock clock,
                          BotConfig config) {
        this.roomService = roomService;
        this.todoService = todoService;
        this.userService = userService;
        this.reminderScheduler = reminderScheduler;
        this.keyboardSetups = keyboardSetups;
        this.messageSender = messageSender;
        this.clock = clock;
        this.idleTimeout = Duration.ofMinutes(config.getIdleTimeoutMinutes());
    }

    public void handleStart(Long chatId, String firstName, String userName, String languageCode) {
        try {
            userService.registerUser(chatId, firstName, userName, languageCode);
            chatStates.remove(chatId);
            startCommandReceived(chatId, firstName);
        } catch (DataAccessException | TransactionException | StoreException e) {
            storeFailure(chatId, e);
        }
    }

    public void handleText(Long chatId, String text) {
        try {
            textReceived(chatId, text == null ? "" : text.trim());
        } catch (DataAccessException | TransactionException | StoreException e) {
            storeFailure(chatId, e);
        }
    }

    public void handleCallback(Long chatId, String data) {
        try {
            callbackReceived(chatId, data == null ? "" : data);
        } catch (DataAccessException | TransactionException | StoreException e) {
            storeFailure(chatId, e);
        }
    }

    public ChatState stateOf(Long chatId) {
        ChatState state = chatStates.get(chatId);
        return state != null ? state : ChatState.idle(clock.instant());
    }

    @Scheduled(fixedDelayString = "${bot.dialogue.sweep-interval-ms:300000}")
    public void sweepAbandonedDialogues() {
        int removed = removeIdleStates(clock.instant());
        if (removed > 0) log.info("Dropped {} abandoned dialogues", removed);
    }

    int removeIdleStates(Instant now) {
        Instant threshold = now.minus(idleTimeout);
        int removed = 0;
        for (Map.Entry<Long, ChatState> entry : chatStates.entrySet()) {
            if (entry.getValue().getUpdatedAt().isBefore(threshold)
                    && chatStates.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private void textReceived(Long chatId, String text) {
        if (text.equals("/cancel") || text.equals(KeyboardSetups.CANCEL)) {
            boolean hadState = chatStates.remove(chatId) != null;
            reply(chatId, hadState ? "Cancelled." : "Nothing to cancel.");
            return;
        }

        ChatState state = stateOf(chatId);
        // while an answer is expected, menu labels are plain text too
        if (state.getStep().isExpectingText()) {
            answerReceived(chatId, state, text);
            return;
        }
        if (!state.isIdle()) {
            chatStates.remove(chatId);
            log.debug("User {} left step {} for a new command", chatId, state.getStep());
        }
        commandReceived(chatId, text);
    }

    private void commandReceived(Long chatId, String text) {
        String command = menuCommand(text);
        String argument = "";
        if (command.startsWith("/")) {
            int space = command.indexOf(' ');
            if (space > 0) {
                argument = command.substring(space + 1).trim();
                command = command.substring(0, space);
            }
            int mention = command.indexOf('@');
            if (mention > 0) command = command.substring(0, mention);
        }

        switch (command) {
            case "/start":
                startCommandReceived(chatId, null);
                break;
            case "/help":
            case "help":
                reply(chatId, HELP_TEXT);
                break;
            case "/add":
                beginRoomOperation(chatId, PendingOperation.ADD, argument.isEmpty() ? null : argument);
                break;
            case "/list":
            case "/todo":
                beginRoomOperation(chatId, PendingOperation.LIST, null);
                break;
            case "/delete":
            case "/done":
                beginRoomOperation(chatId, PendingOperation.DELETE, argument.isEmpty() ? null : argument);
                break;
            case "/create":
                chatStates.put(chatId, ChatState.enteringRoomName(clock.instant()));
                reply(chatId, ":house: Send a name for the new room:");
                break;
            case "/join":
                chatStates.put(chatId, ChatState.enteringRoomCode(clock.instant()));
                reply(chatId, ":key: Send the 4-digit room code:");
                break;
            case "/leave":
                leaveCommandReceived(chatId);
                break;
            case "/rooms":
                roomsCommandReceived(chatId);
                break;
            default:
                reply(chatId, "Sorry, command not recognized. See /help");
        }
    }

    private String menuCommand(String text) {
        if (text.equals(KeyboardSetups.MENU_ADD)) return "/add";
        if (text.equals(KeyboardSetups.MENU_LIST)) return "/list";
        if (text.equals(KeyboardSetups.MENU_DELETE)) return "/delete";
        if (text.equals(KeyboardSetups.MENU_CREATE_ROOM)) return "/create";
        if (text.equals(KeyboardSetups.MENU_JOIN_ROOM)) return "/join";
        if (text.equals(KeyboardSetups.MENU_LEAVE_ROOM)) return "/leave";
        if (text.equals(KeyboardSetups.MENU_MY_ROOMS)) return "/rooms";
        return text;
    }

    /**
     * Add, list and delete work inside a room: with one room it is picked automatically,
     * with several the user chooses first. The argument is the task to add, or the number of the todo to delete.
     */
    private void beginRoomOperation(Long chatId, PendingOperation operation, String argument) {
        List<RoomSummary> rooms = roomService.listUserRooms(chatId);
        if (rooms.isEmpty()) {
            chatStates.remove(chatId);
            reply(chatId, NOT_IN_ROOM);
            return;
        }
        if (rooms.size() == 1) {
            proceedInRoom(chatId, operation, rooms.get(0), argument);
            return;
        }
        chatStates.put(chatId, ChatState.selectingRoom(operation, argument, clock.instant()));
        reply(chatId, "Which room?", keyboardSetups.roomKeyboard(rooms, CallbackData.ROOM));
    }

    private void proceedInRoom(Long chatId, PendingOperation operation, RoomSummary room, String argument) {
        switch (operation) {
            case ADD:
                chatStates.put(chatId, ChatState.choosingCategory(PendingOperation.ADD, room, argument, clock.instant()));
                reply(chatId, "Room «" + room.getRoomName() + "». Pick a category:",
                        keyboardSetups.categoryKeyboard(CallbackData.ADD_CATEGORY, false));
                break;
            case LIST:
                chatStates.put(chatId, ChatState.choosingCategory(PendingOperation.LIST, room, null, clock.instant()));
                reply(chatId, "Room «" + room.getRoomName() + "». Which category?",
                        keyboardSetups.categoryKeyboard(CallbackData.LIST_CATEGORY, true));
                break;
            case DELETE:
                List<TodoItem> todos = todoService.listTodos(room.getRoomCode(), null);
                if (todos.isEmpty()) {
                    chatStates.remove(chatId);
                    reply(chatId, "Nothing to delete in «" + room.getRoomName() + "».");
                    return;
                }
                if (argument != null) {
                    chatStates.remove(chatId);
                    deleteByNumber(chatId, room, todos, argument);
                    return;
                }
                chatStates.put(chatId, ChatState.choosingTodo(room, clock.instant()));
                String hint = todos.size() > KeyboardSetups.TODO_BUTTONS
                        ? "\nTap a todo to delete it, or send /done <number> for one further down:"
                        : "\nTap a todo to delete it:";
                reply(chatId, renderTodos(room.getRoomName(), todos) + hint, keyboardSetups.todoKeyboard(todos));
                break;
        }
    }

    /**
     * {@code /done 2}: deletes the second todo of the room's numbered list
     */
    private void deleteByNumber(Long chatId, RoomSummary room, List<TodoItem> todos, String number) {
        int index;
        try {
            index = Integer.parseInt(number.trim()) - 1;
        } catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 0 || index >= todos.size()) {
            reply(chatId, INVALID_TODO_NUMBER);
            return;
        }
        TodoItem todo = todos.get(index);
        if (todoService.deleteTodo(room.getRoomCode(), todo.getId(), chatId)) {
            reminderScheduler.cancelForTodo(todo.getId());
            reply(chatId, ":white_check_mark: Completed: " + todo.getCategory().getLabel() + " "
                    + TextLimits.shorten(todo.getTask(), TextLimits.TASK_ECHO_LENGTH));
        } else {
            reply(chatId, "That todo is already gone, or you are no longer in «" + room.getRoomName() + "».");
        }
    }

    private void callbackReceived(Long chatId, String data) {
        ChatState state = stateOf(chatId);

        if (data.startsWith(CallbackData.LEAVE)) {
            leaveRoomSelected(chatId, state, CallbackData.argument(data, CallbackData.LEAVE).orElse(""));
        } else if (data.startsWith(CallbackData.ROOM)) {
            roomSelected(chatId, state, CallbackData.argument(data, CallbackData.ROOM).orElse(""));
        } else if (data.startsWith(CallbackData.ADD_CATEGORY)) {
            addCategorySelected(chatId, state, CallbackData.argument(data, CallbackData.ADD_CATEGORY).orElse(""));
        } else if (data.startsWith(CallbackData.LIST_CATEGORY)) {
            listCategorySelected(chatId, state, CallbackData.argument(data, CallbackData.LIST_CATEGORY).orElse(""));
        } else if (data.startsWith(CallbackData.DELETE)) {
            deleteSelected(chatId, state, CallbackData.argument(data, CallbackData.DELETE).orElse(""));
        } else if (data.equals(CallbackData.REMINDER_SET) || data.equals(CallbackData.REMINDER_SKIP)) {
            reminderDecided(chatId, state, data.equals(CallbackData.REMINDER_SET));
        } else if (data.startsWith(CallbackData.DATE)) {
            dateSelected(chatId, state, CallbackData.argument(data, CallbackData.DATE).orElse(""));
        } else if (data.startsWith(CallbackData.TIME)) {
            if (!state.is(DialogueStep.ENTERING_REMINDER_TIME) || state.getTodoId() == null) {
                expired(chatId, data);
                return;
            }
            reminderTimeEntered(chatId, state, CallbackData.argument(data, CallbackData.TIME).orElse(""));
        } else {
            expired(chatId, data);
        }
    }

    private void roomSelected(Long chatId, ChatState state, String roomCode) {
        if (!state.is(DialogueStep.SELECTING_ROOM) || state.getOperation() == null) {
            expired(chatId, CallbackData.ROOM + roomCode);
            return;
        }
        Optional<String> roomName = roomService.findRoomName(roomCode);
        if (roomName.isEmpty() || !roomService.isMember(roomCode, chatId)) {
            chatStates.remove(chatId);
            reply(chatId, "You are not a member of that room anymore.");
            return;
        }
        proceedInRoom(chatId, state.getOperation(), new RoomSummary(roomCode, roomName.get()), state.getTask());
    }

    private void addCategorySelected(Long chatId, ChatState state, String categoryId) {
        Optional<Category> category = Category.fromId(categoryId);
        if (!state.is(DialogueStep.CHOOSING_CATEGORY) || state.getOperation() != PendingOperation.ADD
                || state.getRoomCode() == null || category.isEmpty()) {
            expired(chatId, CallbackData.ADD_CATEGORY + categoryId);
            return;
        }
        if (state.getTask() != null) {
            addTodo(chatId, state.getRoomCode(), state.getRoomName(), category.get(), state.getTask());
            return;
        }
        chatStates.put(chatId, ChatState.enteringTask(state.getRoomCode(), state.getRoomName(), category.get(),
                clock.instant()));
        reply(chatId, category.get().getLabel() + ". Now send the task:");
    }

    private void listCategorySelected(Long chatId, ChatState state, String categoryId) {
        boolean all = CallbackData.ALL_CATEGORIES.equals(categoryId);
        Optional<Category> category = Category.fromId(categoryId);
        if (!state.is(DialogueStep.CHOOSING_CATEGORY) || state.getOperation() != PendingOperation.LIST
                || state.getRoomCode() == null || (!all && category.isEmpty())) {
            expired(chatId, CallbackData.LIST_CATEGORY + categoryId);
            return;
        }
        chatStates.remove(chatId);
        if (!roomService.isMember(state.getRoomCode(), chatId)) {
            reply(chatId, "You are not a member of «" + state.getRoomName() + "» anymore.");
            return;
        }
        List<TodoItem> todos = todoService.listTodos(state.getRoomCode(), category.orElse(null));
        reply(chatId, renderTodos(state.getRoomName(), todos));
    }

    private void deleteSelected(Long chatId, ChatState state, String todoIdText) {
        Long todoId;
        try {
            todoId = Long.parseLong(todoIdText);
        } catch (NumberFormatException e) {
            todoId = null;
        }
        if (!state.is(DialogueStep.CHOOSING_TODO) || state.getRoomCode() == null || todoId == null) {
            expired(chatId, CallbackData.DELETE + todoIdText);
            return;
        }
        chatStates.remove(chatId);
        if (todoService.deleteTodo(state.getRoomCode(), todoId, chatId)) {
            reminderScheduler.cancelForTodo(todoId);
            reply(chatId, ":white_check_mark: Todo deleted from «" + state.getRoomName() + "».");
        } else {
            reply(chatId, "That todo is already gone, or you are no longer in «" + state.getRoomName() + "».");
        }
    }

    private void reminderDecided(Long chatId, ChatState state, boolean setReminder) {
        if (!state.is(DialogueStep.DECIDING_REMINDER) || state.getTodoId() == null) {
            expired(chatId, setReminder ? CallbackData.REMINDER_SET : CallbackData.REMINDER_SKIP);
            return;
        }
        if (!setReminder) {
            chatStates.remove(chatId);
            reply(chatId, "Ok, no reminder.");
            return;
        }
        chatStates.put(chatId, ChatState.enteringReminderDate(state, clock.instant()));
        reply(chatId, ":calendar: Which day? Tap one, or type a date (yyyy-mm-dd, today, tomorrow). " +
                        "A time like 18:30 or \"in 2 hours\" works too.",
                keyboardSetups.dateKeyboard(LocalDate.now(clock)));
    }

    private void dateSelected(Long chatId, ChatState state, String dateText) {
        if (!state.is(DialogueStep.ENTERING_REMINDER_DATE) || state.getTodoId() == null) {
            expired(chatId, CallbackData.DATE + dateText);
            return;
        }
        Optional<LocalDate> date = ReminderTimeParser.parseDate(dateText, LocalDate.now(clock));
        if (date.isEmpty()) {
            reply(chatId, "That day is over, pick another one:", keyboardSetups.dateKeyboard(LocalDate.now(clock)));
            return;
        }
        reminderDateAccepted(chatId, state, date.get());
    }

    private void answerReceived(Long chatId, ChatState state, String text) {
        switch (state.getStep()) {
            case ENTERING_TASK:
                taskEntered(chatId, state, text);
                break;
            case ENTERING_REMINDER_DATE:
                reminderDateEntered(chatId, state, text);
                break;
            case ENTERING_REMINDER_TIME:
                reminderTimeEntered(chatId, state, text);
                break;
            case ENTERING_ROOM_NAME:
                roomNameEntered(chatId, text);
                break;
            case ENTERING_ROOM_PASSWORD:
                roomPasswordEntered(chatId, state, text);
                break;
            case ENTERING_ROOM_CODE:
                roomCodeEntered(chatId, text);
                break;
            case ENTERING_JOIN_PASSWORD:
                joinPasswordEntered(chatId, state, text);
                break;
            default:
                commandReceived(chatId, text);
        }
    }

    private void taskEntered(Long chatId, ChatState state, String text) {
        if (text.isEmpty()) {
            reply(chatId, "The task can't be empty, send it again:");
            return;
        }
        addTodo(chatId, state.getRoomCode(), state.getRoomName(), state.getCategory(), text);
    }

    /**
     * Stores the todo and offers a reminder for it
     */
    private void addTodo(Long chatId, String roomCode, String roomName, Category category, String task) {
        Optional<TodoItem> todo = todoService.addTodo(roomCode, chatId, category, task);
        if (todo.isEmpty()) {
            chatStates.remove(chatId);
            reply(chatId, "Could not add the todo: you are no longer a member of «" + roomName + "».");
            return;
        }
        chatStates.put(chatId, ChatState.decidingReminder(todo.get(), roomName, clock.instant()));
        reply(chatId, ":pushpin: Added to «" + roomName + "»: " + category.getLabel() + " "
                + TextLimits.shorten(task, TextLimits.TASK_ECHO_LENGTH) + "\nSet a reminder?",
                keyboardSetups.reminderDecisionKeyboard());
    }

    private void reminderDateEntered(Long chatId, ChatState state, String text) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<LocalDate> date = ReminderTimeParser.parseDate(text, now.toLocalDate());
        if (date.isPresent()) {
            reminderDateAccepted(chatId, state, date.get());
            return;
        }
        Optional<LocalDateTime> time = ReminderTimeParser.parseReminderTime(text, now);
        if (time.isPresent()) {
            scheduleReminder(chatId, state, time.get());
            return;
        }
        reply(chatId, "Please send a date like " + now.toLocalDate().plusDays(1) + ", today or tomorrow:");
    }

    private void reminderDateAccepted(Long chatId, ChatState state, LocalDate date) {
        chatStates.put(chatId, ChatState.enteringReminderTime(state, date, clock.instant()));
        reply(chatId, ":alarm_clock: Reminder on " + date + ". Pick a time or type HH:MM (or \"in 2 hours\"):",
                keyboardSetups.timeKeyboard());
    }

    private void reminderTimeEntered(Long chatId, ChatState state, String text) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<LocalDateTime> relative = ReminderTimeParser.parseRelativeTime(text, now);
        if (relative.isPresent()) {
            scheduleReminder(chatId, state, relative.get());
            return;
        }
        Optional<LocalTime> time = ReminderTimeParser.parseClockTime(text);
        if (time.isEmpty()) {
            reply(chatId, "Please send the time as HH:MM, for example 18:30, or \"in 2 hours\":");
            return;
        }
        LocalDateTime reminderTime = state.getReminderDate().atTime(time.get());
        if (!reminderTime.isAfter(now)) {
            reply(chatId, "That moment has already passed. Pick a later time:", keyboardSetups.timeKeyboard());
            return;
        }
        scheduleReminder(chatId, state, reminderTime);
    }

    /**
     * Arms the timer first, then stores the time on the todo. A rejected time keeps the user in the
     * current step with the draft intact.
     */
    private void scheduleReminder(Long chatId, ChatState state, LocalDateTime reminderTime) {
        ScheduledReminder reminder = new ScheduledReminder(state.getTodoId(), chatId, state.getRoomCode(),
                state.getRoomName(), state.getCategory(), state.getTask(),
                reminderTime.atZone(clock.getZone()).toInstant());
        ReminderHandle handle;
        try {
            handle = reminderScheduler.schedule(reminder.getFireAt(), reminder);
        } catch (ReminderRejectedException e) {
            log.warn("Reminder for todo {} rejected: {}", state.getTodoId(), e.getMessage());
            reply(chatId, "That moment has already passed. Send a later time:");
            return;
        }

        boolean stored;
        try {
            stored = todoService.setReminderTime(state.getTodoId(), reminderTime);
        } catch (RuntimeException e) {
            reminderScheduler.cancel(handle);
            throw e;
        }
        chatStates.remove(chatId);
        if (!stored) {
            reminderScheduler.cancel(handle);
            reply(chatId, "This todo no longer exists, so there is nothing to remind about.");
            return;
        }
        reply(chatId, ":bell: Reminder set for " + reminderTime.format(REMINDER_FORMAT) + ".");
    }

    private void roomNameEntered(Long chatId, String text) {
        if (text.isEmpty() || text.length() > MAX_ROOM_NAME_LENGTH) {
            reply(chatId, "A room name needs 1 to " + MAX_ROOM_NAME_LENGTH + " characters, try again:");
            return;
        }
        chatStates.put(chatId, ChatState.enteringRoomPassword(text, clock.instant()));
        reply(chatId, "Now choose a password for «" + text + "»:");
    }

    private void roomPasswordEntered(Long chatId, ChatState state, String text) {
        if (text.isEmpty()) {
            reply(chatId, "The password can't be empty, try again:");
            return;
        }
        String roomCode = roomService.createRoom(state.getRoomName(), text, chatId);
        chatStates.remove(chatId);
        reply(chatId, ":house: Room «" + state.getRoomName() + "» created!\n" +
                "Code: " + roomCode + "\n" +
                "Share the code and the password with the people you want to invite.");
    }

    private void roomCodeEntered(Long chatId, String text) {
        if (!text.matches("\\d{4}")) {
            reply(chatId, "Room codes are 4 digits, try again:");
            return;
        }
        chatStates.put(chatId, ChatState.enteringJoinPassword(text, clock.instant()));
        reply(chatId, "Password for room " + text + ":");
    }

    private void joinPasswordEntered(Long chatId, ChatState state, String text) {
        RoomResult result = roomService.joinRoom(state.getRoomCode(), text, chatId);
        chatStates.remove(chatId);
        switch (result.getStatus()) {
            case OK:
                reply(chatId, ":tada: You joined «" + result.getRoomName() + "»!");
                break;
            case NOT_FOUND:
                reply(chatId, "There is no room with code " + state.getRoomCode() + ".");
                break;
            case WRONG_PASSWORD:
                reply(chatId, "Wrong password for room " + state.getRoomCode() + ".");
                break;
            default:
                reply(chatId, "Could not join room " + state.getRoomCode() + ".");
        }
    }

    private void leaveCommandReceived(Long chatId) {
        List<RoomSummary> rooms = roomService.listUserRooms(chatId);
        if (rooms.isEmpty()) {
            reply(chatId, "You are not in any room.");
            return;
        }
        reply(chatId, "Which room do you want to leave?", keyboardSetups.roomKeyboard(rooms, CallbackData.LEAVE));
    }

    private void leaveRoomSelected(Long chatId, ChatState state, String roomCode) {
        RoomResult result = roomService.leaveRoom(roomCode, chatId);
        switch (result.getStatus()) {
            case OK:
                if (Objects.equals(state.getRoomCode(), roomCode)) chatStates.remove(chatId);
                reply(chatId, ":door: You left «" + result.getRoomName() + "».");
                break;
            case NOT_FOUND:
                reply(chatId, "That room no longer exists.");
                break;
            case NOT_A_MEMBER:
                reply(chatId, "You are not a member of that room.");
                break;
            default:
                reply(chatId, "Could not leave the room.");
        }
    }

    private void roomsCommandReceived(Long chatId) {
        List<RoomSummary> rooms = roomService.listUserRooms(chatId);
        if (rooms.isEmpty()) {
            reply(chatId, NOT_IN_ROOM);
            return;
        }
        StringBuilder answer = new StringBuilder("Your rooms :busts_in_silhouette::\n");
        int counter = 1;
        for (RoomSummary room : rooms) {
            answer.append(counter++).append(". ").append(room.getRoomName())
                    .append(" (code ").append(room.getRoomCode()).append(")\n");
        }
        reply(chatId, answer.toString());
    }

    /**
     * Numbered list, already sorted by category rank and creation time
     */
    private String renderTodos(String roomName, List<TodoItem> todos) {
        if (todos.isEmpty()) return "No todos in «" + roomName + "» yet.";

        StringBuilder answer = new StringBuilder("Todo list «" + roomName + "» :zap::\n");
        LocalDateTime now = LocalDateTime.now(clock);
        int counter = 1;
        for (TodoItem todo : todos) {
            answer.append(counter++).append(". ").append(todo.getCategory().getLabel()).append(" ")
                    .append(TextLimits.shorten(todo.getTask(), LISTED_TASK_LENGTH));
            if (todo.getReminderTime() != null && todo.getReminderTime().isAfter(now)) {
                answer.append(" :alarm_clock: ").append(todo.getReminderTime().format(REMINDER_FORMAT));
            }
            answer.append("\n");
        }
        return answer.toString();
    }

    private void startCommandReceived(Long chatId, String name) {
        reply(chatId, "Hi" + (name != null ? ", " + name : "") + "! I keep shared todo lists :pushpin:\n" +
                "Create a room or join a friend's one, then add todos for games, movies and things to do. " +
                "Everyone in the room sees them, and I can remind you at the right time :bell:\n\n" + HELP_TEXT);
        log.info("Replied to user " + chatId);
    }

    private void expired(Long chatId, String data) {
        log.warn("Expired interaction {} from user {} in step {}", data, chatId, stateOf(chatId).getStep());
        reply(chatId, EXPIRED);
    }

    private void storeFailure(Long chatId, RuntimeException e) {
        log.error("Store failure while serving user {}: {}", chatId, e.getMessage(), e);
        chatStates.remove(chatId);
        reply(chatId, STORE_FAILURE);
    }

    private void reply(Long chatId, String text) {
        reply(chatId, text, null);
    }

    /**
     * Sends the answer, split into several messages when it is too long for one. Without an inline
     * keyboard the reply keyboard follows the state: Cancel while an answer is expected, the main menu
     * otherwise. An inline keyboard goes with the last part.
     */
    private void reply(Long chatId, String text, ReplyKeyboard markup) {
        List<String> parts = TextLimits.split(EmojiParser.parseToUnicode(text), TextLimits.MESSAGE_LENGTH);
        for (int i = 0; i < parts.size(); i++) {
            SendMessage message = new SendMessage();
            message.setChatId(String.valueOf(chatId));
            message.setText(parts.get(i));

            if (markup != null && i == parts.size() - 1) message.setReplyMarkup(markup);
            else if (stateOf(chatId).getStep().isExpectingText()) keyboardSetups.setCancelKeyboard(message);
            else keyboardSetups.setDefaultKeyboard(message);

            try {
                messageSender.send(message);
            } catch (TelegramApiException e) {
                log.error("Error occurred: " + e.getMessage());
                return;
            }
        }
    }
}
