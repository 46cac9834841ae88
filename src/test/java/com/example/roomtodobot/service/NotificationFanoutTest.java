package com.example.roomtodobot.service;

import com.example.roomtodobot.model.RoomTodoEvent;
import com.example.roomtodobot.support.RecordingMessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationFanoutTest {

    @Mock
    private RoomService roomService;

    private RecordingMessageSender messageSender;
    private NotificationFanout fanout;

    @BeforeEach
    void setUp() {
        messageSender = new RecordingMessageSender();
        fanout = new NotificationFanout(roomService, messageSender);
    }

    @Test
    @DisplayName("every member gets the text")
    void deliversToAllMembers() {
        when(roomService.listMembers("0420")).thenReturn(List.of(1L, 2L, 3L));

        int delivered = fanout.broadcast("0420", "hello room");

        assertThat(delivered).isEqualTo(3);
        assertThat(messageSender.textsTo(1L)).containsExactly("hello room");
        assertThat(messageSender.textsTo(2L)).containsExactly("hello room");
        assertThat(messageSender.textsTo(3L)).containsExactly("hello room");
    }

    @Test
    @DisplayName("a member who blocked the bot does not stop delivery to the others")
    void failingRecipientIsSkipped() {
        when(roomService.listMembers("0420")).thenReturn(List.of(1L, 2L, 3L));
        messageSender.block(2L);

        int delivered = fanout.broadcast("0420", "hello room");

        assertThat(delivered).isEqualTo(2);
        assertThat(messageSender.textsTo(1L)).containsExactly("hello room");
        assertThat(messageSender.textsTo(2L)).isEmpty();
        assertThat(messageSender.textsTo(3L)).containsExactly("hello room");
    }

    @Test
    void actorIsNotNotifiedAboutOwnChange() {
        when(roomService.listMembers("0420")).thenReturn(List.of(1L, 2L));

        fanout.onRoomTodoChanged(new RoomTodoEvent("0420", 1L, "A added a todo"));

        assertThat(messageSender.textsTo(1L)).isEmpty();
        assertThat(messageSender.textsTo(2L)).containsExactly("A added a todo");
    }

    @Test
    void emptyRoomDeliversNothing() {
        when(roomService.listMembers("9999")).thenReturn(List.of());

        assertThat(fanout.broadcast("9999", "anyone?")).isZero();
    }
}
