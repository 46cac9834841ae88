package com.example.roomtodobot.service;

import com.example.roomtodobot.model.RoomTodoEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;
import java.util.Objects;

/**
 * Delivers one text to every member of a room. A failing recipient (blocked bot, deleted chat)
 * is logged and skipped.
 */
@Slf4j
@Component
public class NotificationFanout {

    private final RoomService roomService;
    private final MessageSender messageSender;

    public NotificationFanout(RoomService roomService, MessageSender messageSender) {
        this.roomService = roomService;
        this.messageSender = messageSender;
    }

    /**
     * Runs after the store transaction commits, off the thread that made the change
     */
    @Async("notificationExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onRoomTodoChanged(RoomTodoEvent event) {
        broadcast(event.getRoomCode(), event.getText(), event.getActorId());
    }

    public int broadcast(String roomCode, String text) {
        return broadcast(roomCode, text, null);
    }

    /**
     * @param exceptUserId member who should not get the text, usually the one who caused it
     * @return number of members the text was delivered to
     */
    public int broadcast(String roomCode, String text, Long exceptUserId) {
        List<Long> members = roomService.listMembers(roomCode);
        int delivered = 0;
        for (Long memberId : members) {
            if (Objects.equals(memberId, exceptUserId)) continue;

            SendMessage message = new SendMessage();
            message.setChatId(String.valueOf(memberId));
            message.setText(text);
            try {
                messageSender.send(message);
                delivered++;
            } catch (TelegramApiException | RuntimeException e) {
                log.warn("Room {} notification to {} failed: {}", roomCode, memberId, e.getMessage());
            }
        }
        log.debug("Room {} notification delivered to {}/{} members", roomCode, delivered, members.size());
        return delivered;
    }
}
