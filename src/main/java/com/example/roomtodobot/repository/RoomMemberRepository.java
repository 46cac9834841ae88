package com.example.roomtodobot.repository;

import com.example.roomtodobot.model.RoomMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface RoomMemberRepository extends JpaRepository<RoomMember, Long> {
    boolean existsByRoom_RoomCodeAndUserId(String roomCode, Long userId);
    Optional<RoomMember> findByRoom_RoomCodeAndUserId(String roomCode, Long userId);

    @Query("select m from room_members m join fetch m.room where m.userId = ?1 order by m.joinedAt desc, m.id desc")
    List<RoomMember> findAllWithRoomByUserId(Long userId);

    @Query("select m.userId from room_members m where m.room.roomCode = ?1 order by m.joinedAt, m.id")
    List<Long> findUserIdsByRoomCode(String roomCode);
}
