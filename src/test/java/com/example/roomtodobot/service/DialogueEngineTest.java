package com.example.roomtodobot.service;

import com.example.roomtodobot.config.BotConfig;
import com.example.roomtodobot.exception.ReminderRejectedException;
import com.example.roomtodobot.exception.StoreException;
import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.DialogueStep;
import com.example.roomtodobot.model.PendingOperation;
import com.example.roomtodobot.model.RoomResult;
import com.example.roomtodobot.model.RoomSummary;
import com.example.roomtodobot.model.ScheduledReminder;
import com.example.roomtodobot.model.TodoItem;
import com.example.roomtodobot.support.RecordingMessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DialogueEngineTest {

    private static final Long USER = 100L;
    private static final Instant NOW = Instant.parse("2026-03-10T10:30:00Z");
    private static final RoomSummary FLAT = new RoomSummary("0420", "Flat");
    private static final RoomSummary OFFICE = new RoomSummary("7777", "Office");

    @Mock
    private RoomService roomService;

    @Mock
    private TodoService todoService;

    @Mock
    private UserService userService;

    @Mock
    private ReminderScheduler reminderScheduler;

    private RecordingMessageSender messageSender;
    private DialogueEngine engine;

    @BeforeEach
    void setUp() {
        messageSender = new RecordingMessageSender();
        BotConfig config = new BotConfig();
        config.setIdleTimeoutMinutes(30);
        engine = new DialogueEngine(roomService, todoService, userService, reminderScheduler, new KeyboardSetups(),
                messageSender, Clock.fixed(NOW, ZoneOffset.UTC), config);
    }

    @Test
    @DisplayName("add without any room explains how to get one and stays idle")
    void addWithoutRooms() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of());

        engine.handleText(USER, "/add");

        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.NOT_IN_ROOM);
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("with a single room the room choice is skipped")
    void singleRoomIsPickedAutomatically() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));

        engine.handleText(USER, KeyboardSetups.MENU_ADD);

        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.CHOOSING_CATEGORY);
        assertThat(engine.stateOf(USER).getRoomCode()).isEqualTo("0420");
        assertThat(messageSender.lastTo(USER).getReplyMarkup()).isInstanceOf(InlineKeyboardMarkup.class);
    }

    @Test
    void severalRoomsAskWhichOne() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT, OFFICE));

        engine.handleText(USER, "/list");

        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.SELECTING_ROOM);
        assertThat(engine.stateOf(USER).getOperation()).isEqualTo(PendingOperation.LIST);
        InlineKeyboardMarkup keyboard = (InlineKeyboardMarkup) messageSender.lastTo(USER).getReplyMarkup();
        assertThat(keyboard.getKeyboard()).hasSize(2);
        assertThat(keyboard.getKeyboard().get(1).get(0).getCallbackData()).isEqualTo("room_7777");
    }

    @Test
    @DisplayName("a button from an old keyboard is reported as expired and changes nothing")
    void staleButtonIsExpired() {
        engine.handleCallback(USER, "delete_5");
        engine.handleCallback(USER, "add_category_game");
        engine.handleCallback(USER, "reminder_set");

        assertThat(messageSender.textsTo(USER)).containsOnly(DialogueEngine.EXPIRED);
        verifyNoInteractions(todoService);
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    void roomButtonForLostMembershipResets() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT, OFFICE));
        when(roomService.findRoomName("7777")).thenReturn(Optional.of("Office"));
        when(roomService.isMember("7777", USER)).thenReturn(false);
        engine.handleText(USER, "/delete");

        engine.handleCallback(USER, "room_7777");

        assertThat(messageSender.lastTo(USER).getText()).contains("not a member");
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("a store failure resets the dialogue and tells the user to retry")
    void storeFailureResetsToIdle() {
        when(roomService.createRoom("Flat", "secret", USER)).thenThrow(new DataAccessResourceFailureException("db down"));
        engine.handleText(USER, "/create");
        engine.handleText(USER, "Flat");

        engine.handleText(USER, "secret");

        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.STORE_FAILURE);
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    void exhaustedRoomCodesAreReportedAsStoreFailure() {
        when(roomService.createRoom(anyString(), anyString(), eq(USER))).thenThrow(new StoreException("no free code"));
        engine.handleText(USER, "/create");
        engine.handleText(USER, "Flat");

        engine.handleText(USER, "secret");

        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.STORE_FAILURE);
    }

    @Test
    @DisplayName("invalid answers re-prompt and keep the current step")
    void invalidInputReprompts() {
        engine.handleText(USER, "/create");
        engine.handleText(USER, "   ");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_ROOM_NAME);

        engine.handleText(USER, "x".repeat(DialogueEngine.MAX_ROOM_NAME_LENGTH + 1));
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_ROOM_NAME);

        engine.handleText(USER, "/cancel");
        engine.handleText(USER, "/join");
        engine.handleText(USER, "12a4");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_ROOM_CODE);
        assertThat(messageSender.lastTo(USER).getText()).contains("4 digits");
        verifyNoInteractions(roomService);
    }

    @Test
    @DisplayName("while an answer is expected a menu label is taken as the answer")
    void menuLabelIsAnswerInTextStep() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.addTodo("0420", USER, Category.ACTION, KeyboardSetups.MENU_LIST))
                .thenReturn(Optional.of(todo(5L, Category.ACTION, KeyboardSetups.MENU_LIST)));
        engine.handleText(USER, "/add");
        engine.handleCallback(USER, "add_category_action");

        engine.handleText(USER, KeyboardSetups.MENU_LIST);

        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.DECIDING_REMINDER);
        verify(todoService, never()).listTodos(anyString(), any());
    }

    @Test
    @DisplayName("text typed at a button step drops the draft and runs as a command")
    void commandAbandonsButtonStep() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        engine.handleText(USER, "/add");

        engine.handleText(USER, "/help");

        assertThat(engine.stateOf(USER).isIdle()).isTrue();
        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.HELP_TEXT);
        assertThat(messageSender.lastTo(USER).getReplyMarkup()).isInstanceOf(ReplyKeyboardMarkup.class);
    }

    @Test
    void cancelClearsTheDraft() {
        engine.handleText(USER, "/join");

        engine.handleText(USER, KeyboardSetups.CANCEL);

        assertThat(engine.stateOf(USER).isIdle()).isTrue();
        assertThat(messageSender.lastTo(USER).getText()).isEqualTo("Cancelled.");
    }

    @Test
    @DisplayName("/add with text skips the task prompt")
    void inlineTaskIsUsedAfterCategory() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.addTodo("0420", USER, Category.MOVIE, "Dune 2"))
                .thenReturn(Optional.of(todo(5L, Category.MOVIE, "Dune 2")));

        engine.handleText(USER, "/add Dune 2");
        engine.handleCallback(USER, "add_category_movie");

        verify(todoService).addTodo("0420", USER, Category.MOVIE, "Dune 2");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.DECIDING_REMINDER);
        assertThat(engine.stateOf(USER).getTodoId()).isEqualTo(5L);
    }

    @Test
    void refusedAddReturnsToIdle() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.addTodo("0420", USER, Category.GAME, "Hades")).thenReturn(Optional.empty());
        engine.handleText(USER, "/add Hades");

        engine.handleCallback(USER, "add_category_game");

        assertThat(messageSender.lastTo(USER).getText()).contains("no longer a member");
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("a clock time already passed on the chosen day is refused, a later one is scheduled")
    void reminderTimeInThePast() {
        reachReminderTimeStep();

        engine.handleText(USER, "09:00");
        assertThat(messageSender.lastTo(USER).getText()).contains("already passed");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_REMINDER_TIME);

        engine.handleText(USER, "25:00");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_REMINDER_TIME);
        verify(reminderScheduler, never()).schedule(any(), any());

        when(todoService.setReminderTime(5L, LocalDateTime.of(2026, 3, 10, 18, 0))).thenReturn(true);
        engine.handleCallback(USER, "time_18:00");

        ArgumentCaptor<ScheduledReminder> captor = ArgumentCaptor.forClass(ScheduledReminder.class);
        verify(reminderScheduler).schedule(eq(Instant.parse("2026-03-10T18:00:00Z")), captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(USER);
        assertThat(captor.getValue().getRoomName()).isEqualTo("Flat");
        assertThat(messageSender.lastTo(USER).getText()).contains("Reminder set for 2026-03-10 18:00");
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    void rejectedReminderKeepsTheStep() {
        reachReminderTimeStep();
        when(reminderScheduler.schedule(any(), any())).thenThrow(new ReminderRejectedException("shut down"));

        engine.handleText(USER, "in 2 hours");

        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_REMINDER_TIME);
        verify(todoService, never()).setReminderTime(anyLong(), any());
    }

    @Test
    void deleteCancelsTheReminder() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.listTodos("0420", null)).thenReturn(List.of(todo(5L, Category.GAME, "Hades")));
        when(todoService.deleteTodo("0420", 5L, USER)).thenReturn(true);
        engine.handleText(USER, "/done");

        engine.handleCallback(USER, "delete_5");

        verify(reminderScheduler).cancelForTodo(5L);
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("/done with a number deletes that entry of the numbered list")
    void doneWithNumber() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.listTodos("0420", null))
                .thenReturn(List.of(todo(5L, Category.GAME, "Hades"), todo(6L, Category.MOVIE, "Dune 2")));
        when(todoService.deleteTodo("0420", 6L, USER)).thenReturn(true);

        engine.handleText(USER, "/done 2");

        verify(reminderScheduler).cancelForTodo(6L);
        assertThat(messageSender.lastTo(USER).getText()).contains("Completed").contains("Dune 2");
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    void doneWithInvalidNumber() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.listTodos("0420", null)).thenReturn(List.of(todo(5L, Category.GAME, "Hades")));

        engine.handleText(USER, "/done 2");
        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.INVALID_TODO_NUMBER);

        engine.handleText(USER, "/done first");
        assertThat(messageSender.lastTo(USER).getText()).isEqualTo(DialogueEngine.INVALID_TODO_NUMBER);

        verify(todoService, never()).deleteTodo(anyString(), anyLong(), anyLong());
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("with several rooms the todo number waits for the room choice")
    void doneWithNumberAfterRoomChoice() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT, OFFICE));
        when(roomService.findRoomName("7777")).thenReturn(Optional.of("Office"));
        when(roomService.isMember("7777", USER)).thenReturn(true);
        when(todoService.listTodos("7777", null)).thenReturn(List.of(todo(8L, Category.ACTION, "Print slides")));
        when(todoService.deleteTodo("7777", 8L, USER)).thenReturn(true);

        engine.handleText(USER, "/done 1");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.SELECTING_ROOM);

        engine.handleCallback(USER, "room_7777");

        verify(todoService).deleteTodo("7777", 8L, USER);
        assertThat(messageSender.lastTo(USER).getText()).contains("Print slides");
    }

    @Test
    @DisplayName("a task at the input limit still gets a confirmation with the reminder buttons")
    void longTaskConfirmationFitsOneMessage() {
        String task = "x".repeat(TextLimits.MESSAGE_LENGTH);
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.addTodo("0420", USER, Category.GAME, task)).thenReturn(Optional.of(todo(5L, Category.GAME, task)));
        engine.handleText(USER, "/add");
        engine.handleCallback(USER, "add_category_game");

        engine.handleText(USER, task);

        SendMessage confirmation = messageSender.lastTo(USER);
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.DECIDING_REMINDER);
        assertThat(confirmation.getText().length()).isLessThanOrEqualTo(TextLimits.MESSAGE_LENGTH);
        assertThat(confirmation.getReplyMarkup()).isInstanceOf(InlineKeyboardMarkup.class);
    }

    @Test
    void longListingIsSentInParts() {
        List<TodoItem> todos = new ArrayList<>();
        for (long id = 1; id <= 20; id++) todos.add(todo(id, Category.GAME, "y".repeat(400)));
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(roomService.isMember("0420", USER)).thenReturn(true);
        when(todoService.listTodos("0420", null)).thenReturn(todos);
        engine.handleText(USER, "/list");
        messageSender.clear();

        engine.handleCallback(USER, "list_category_all");

        List<String> parts = messageSender.textsTo(USER);
        assertThat(parts).hasSizeGreaterThan(1);
        assertThat(parts).allSatisfy(part -> assertThat(part.length()).isLessThanOrEqualTo(TextLimits.MESSAGE_LENGTH));
        assertThat(String.join("", parts)).contains("1. ").contains("20. ");
    }

    @Test
    void joinWithWrongPassword() {
        when(roomService.joinRoom("0420", "guess", USER)).thenReturn(RoomResult.of(RoomResult.Status.WRONG_PASSWORD));
        engine.handleText(USER, "/join");
        engine.handleText(USER, "0420");

        engine.handleText(USER, "guess");

        assertThat(messageSender.lastTo(USER).getText()).contains("Wrong password");
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    @DisplayName("dialogues left unanswered past the timeout are dropped")
    void abandonedDialoguesAreSwept() {
        engine.handleText(USER, "/create");

        assertThat(engine.removeIdleStates(NOW.plus(Duration.ofMinutes(10)))).isZero();
        assertThat(engine.removeIdleStates(NOW.plus(Duration.ofMinutes(31)))).isEqualTo(1);
        assertThat(engine.stateOf(USER).isIdle()).isTrue();
    }

    @Test
    void unknownCommand() {
        engine.handleText(USER, "hello?");

        assertThat(messageSender.lastTo(USER).getText()).startsWith("Sorry, command not recognized");
    }

    private void reachReminderTimeStep() {
        when(roomService.listUserRooms(USER)).thenReturn(List.of(FLAT));
        when(todoService.addTodo("0420", USER, Category.MOVIE, "Dune 2"))
                .thenReturn(Optional.of(todo(5L, Category.MOVIE, "Dune 2")));
        engine.handleText(USER, "/add");
        engine.handleCallback(USER, "add_category_movie");
        engine.handleText(USER, "Dune 2");
        engine.handleCallback(USER, "reminder_set");
        engine.handleCallback(USER, "date_2026-03-10");
        assertThat(engine.stateOf(USER).getStep()).isEqualTo(DialogueStep.ENTERING_REMINDER_TIME);
    }

    private TodoItem todo(Long id, Category category, String task) {
        TodoItem todo = new TodoItem("0420", USER, category, task, LocalDateTime.of(2026, 3, 10, 10, 30));
        todo.setId(id);
        return todo;
    }
}
