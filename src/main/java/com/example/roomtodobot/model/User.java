package com.example.roomtodobot.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.Data;

import java.time.LocalDateTime;

@Entity(name = "users")
@Data
public class User {

    public static final String DEFAULT_LANGUAGE = "en";

    @Id
    private Long userId;

    private String firstName;
    private String userName;
    private String language = DEFAULT_LANGUAGE;
    private LocalDateTime createdAt;

    public User() {
    }

    public User(Long userId, LocalDateTime createdAt) {
        this.userId = userId;
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "User{" +
                "userId=" + userId +
                ", firstName='" + firstName + '\'' +
                ", userName='" + userName + '\'' +
                ", language='" + language + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
