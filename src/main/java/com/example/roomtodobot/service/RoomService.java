package com.example.roomtodobot.service;

import com.example.roomtodobot.exception.StoreException;
import com.example.roomtodobot.model.Room;
import com.example.roomtodobot.model.RoomMember;
import com.example.roomtodobot.model.RoomResult;
import com.example.roomtodobot.model.RoomSummary;
import com.example.roomtodobot.repository.RoomMemberRepository;
import com.example.roomtodobot.repository.RoomRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Rooms and memberships. Every mutation locks the room row, so checks and writes for one room
 * are serialised while other rooms proceed independently.
 */
@Slf4j
@Component
public class RoomService {

    static final int MAX_CODE_ATTEMPTS = 200;

    private final RoomRepository roomRepository;
    private final RoomMemberRepository roomMemberRepository;
    private final UserService userService;
    private final RoomCodeGenerator codeGenerator;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public RoomService(RoomRepository roomRepository,
                       RoomMemberRepository roomMemberRepository,
                       UserService userService,
                       RoomCodeGenerator codeGenerator,
                       PasswordEncoder passwordEncoder,
                       Clock clock) {
        this.roomRepository = roomRepository;
        this.roomMemberRepository = roomMemberRepository;
        this.userService = userService;
        this.codeGenerator = codeGenerator;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Creates the room with a fresh code and makes the owner its first member.
     *
     * @return the generated 4-digit room code
     * @throws StoreException when no free code was found
     */
    @Transactional
    public String createRoom(String name, String password, Long ownerId) {
        userService.ensureUser(ownerId);
        String code = generateFreeCode();
        LocalDateTime now = LocalDateTime.now(clock);

        Room room = roomRepository.save(new Room(code, name, passwordEncoder.encode(password), ownerId, now));
        roomMemberRepository.save(new RoomMember(room, ownerId, now));
        log.info("Room {} «{}» created by {}", code, name, ownerId);
        return code;
    }

    @Transactional
    public RoomResult joinRoom(String roomCode, String password, Long userId) {
        Optional<Room> found = roomRepository.findLockedByRoomCode(roomCode);
        if (found.isEmpty()) return RoomResult.of(RoomResult.Status.NOT_FOUND);

        Room room = found.get();
        if (password == null || !passwordEncoder.matches(password, room.getPasswordHash())) {
            log.warn("Wrong password for room {} from user {}", roomCode, userId);
            return RoomResult.of(RoomResult.Status.WRONG_PASSWORD);
        }

        if (!roomMemberRepository.existsByRoom_RoomCodeAndUserId(roomCode, userId)) {
            userService.ensureUser(userId);
            roomMemberRepository.save(new RoomMember(room, userId, LocalDateTime.now(clock)));
            log.info("User {} joined room {}", userId, roomCode);
        }
        return RoomResult.ok(room.getRoomName());
    }

    @Transactional
    public RoomResult leaveRoom(String roomCode, Long userId) {
        Optional<Room> found = roomRepository.findLockedByRoomCode(roomCode);
        if (found.isEmpty()) return RoomResult.of(RoomResult.Status.NOT_FOUND);

        Optional<RoomMember> membership = roomMemberRepository.findByRoom_RoomCodeAndUserId(roomCode, userId);
        if (membership.isEmpty()) return RoomResult.of(RoomResult.Status.NOT_A_MEMBER);

        roomMemberRepository.delete(membership.get());
        log.info("User {} left room {}", userId, roomCode);
        return RoomResult.ok(found.get().getRoomName());
    }

    /**
     * Rooms of the user, most recently joined first
     */
    @Transactional(readOnly = true)
    public List<RoomSummary> listUserRooms(Long userId) {
        return roomMemberRepository.findAllWithRoomByUserId(userId).stream()
                .map(member -> new RoomSummary(member.getRoom().getRoomCode(), member.getRoom().getRoomName()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Long> listMembers(String roomCode) {
        return roomMemberRepository.findUserIdsByRoomCode(roomCode);
    }

    @Transactional(readOnly = true)
    public boolean isMember(String roomCode, Long userId) {
        return roomMemberRepository.existsByRoom_RoomCodeAndUserId(roomCode, userId);
    }

    @Transactional(readOnly = true)
    public Optional<String> findRoomName(String roomCode) {
        return roomRepository.findById(roomCode).map(Room::getRoomName);
    }

    private String generateFreeCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.nextCode();
            if (!roomRepository.existsById(code)) return code;
        }
        throw new StoreException("No free room code after " + MAX_CODE_ATTEMPTS + " attempts");
    }
}
