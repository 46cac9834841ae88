package com.example.roomtodobot.repository;

import com.example.roomtodobot.model.Category;
import com.example.roomtodobot.model.TodoItem;
import org.springframework.data.repository.CrudRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface TodoRepository extends CrudRepository<TodoItem, Long> {
    List<TodoItem> findAllByRoomCode(String roomCode);
    List<TodoItem> findAllByRoomCodeAndCategory(String roomCode, Category category);
    Optional<TodoItem> findByIdAndRoomCode(Long id, String roomCode);
    List<TodoItem> findAllByReminderTimeAfter(LocalDateTime time);
}
