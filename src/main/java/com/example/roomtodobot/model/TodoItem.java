package com.example.roomtodobot.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Comparator;

@Entity(name = "todos")
@Data
public class TodoItem {

    /**
     * Listing order: category rank first, then creation time
     */
    public static final Comparator<TodoItem> LISTING_ORDER = Comparator
            .comparing(TodoItem::getCategory)
            .thenComparing(TodoItem::getCreatedAt)
            .thenComparing(TodoItem::getId);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String roomCode;
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Category category;

    @Column(nullable = false, length = 4096)
    private String task;

    private LocalDateTime reminderTime;
    private LocalDateTime createdAt;

    public TodoItem() {
    }

    public TodoItem(String roomCode, Long userId, Category category, String task, LocalDateTime createdAt) {
        this.roomCode = roomCode;
        this.userId = userId;
        this.category = category;
        this.task = task;
        this.createdAt = createdAt;
    }
}
