package com.example.roomtodobot.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity(name = "room_members")
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"room_code", "user_id"}))
@Data
public class RoomMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_code")
    private Room room;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    private LocalDateTime joinedAt;

    public RoomMember() {
    }

    public RoomMember(Room room, Long userId, LocalDateTime joinedAt) {
        this.room = room;
        this.userId = userId;
        this.joinedAt = joinedAt;
    }

    @Override
    public String toString() {
        return "RoomMember{" +
                "id=" + id +
                ", roomCode=" + (room != null ? room.getRoomCode() : null) +
                ", userId=" + userId +
                ", joinedAt=" + joinedAt +
                '}';
    }
}
