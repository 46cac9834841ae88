package com.example.roomtodobot.repository;

import com.example.roomtodobot.model.Room;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;

import java.util.Optional;

public interface RoomRepository extends JpaRepository<Room, String> {

    /**
     * Row lock that serialises membership checks and writes of one room
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Room> findLockedByRoomCode(String roomCode);
}
