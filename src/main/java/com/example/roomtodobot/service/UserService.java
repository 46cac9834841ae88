package com.example.roomtodobot.service;

import com.example.roomtodobot.model.User;
import com.example.roomtodobot.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Component
public class UserService {

    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * First registration on /start, keeps the profile fields fresh afterwards
     */
    @Transactional
    public User registerUser(Long userId, String firstName, String userName, String languageCode) {
        Optional<User> existing = userRepository.findById(userId);
        boolean created = existing.isEmpty();
        User user = existing.orElseGet(() -> new User(userId, LocalDateTime.now(clock)));
        user.setFirstName(firstName);
        user.setUserName(userName);
        if (languageCode != null && !languageCode.isBlank()) user.setLanguage(languageCode);
        user = userRepository.save(user);
        if (created) log.info("user saved: " + user);
        return user;
    }

    /**
     * Lazily creates the user row before the first write that references it
     */
    @Transactional
    public void ensureUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            userRepository.save(new User(userId, LocalDateTime.now(clock)));
            log.info("user {} created on first write", userId);
        }
    }

    @Transactional(readOnly = true)
    public String displayName(Long userId) {
        return userRepository.findById(userId)
                .map(user -> user.getFirstName() != null ? user.getFirstName()
                        : user.getUserName() != null ? "@" + user.getUserName() : "#" + userId)
                .orElse("#" + userId);
    }
}
