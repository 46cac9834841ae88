package com.example.roomtodobot.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

@Entity(name = "rooms")
@Data
public class Room implements Persistable<String> {

    @Id
    @Column(length = 4)
    private String roomCode;

    @Column(nullable = false)
    private String roomName;

    @Column(nullable = false)
    private String passwordHash;

    private Long ownerId;
    private LocalDateTime createdAt;

    // code is assigned by the application, so save() has to persist instead of merge
    @Transient
    @EqualsAndHashCode.Exclude
    private boolean fresh;

    public Room() {
    }

    public Room(String roomCode, String roomName, String passwordHash, Long ownerId, LocalDateTime createdAt) {
        this.roomCode = roomCode;
        this.roomName = roomName;
        this.passwordHash = passwordHash;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
        this.fresh = true;
    }

    @Override
    public String getId() {
        return roomCode;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.fresh = false;
    }

    @Override
    public String toString() {
        return "Room{" +
                "roomCode='" + roomCode + '\'' +
                ", roomName='" + roomName + '\'' +
                ", ownerId=" + ownerId +
                ", createdAt=" + createdAt +
                '}';
    }
}
