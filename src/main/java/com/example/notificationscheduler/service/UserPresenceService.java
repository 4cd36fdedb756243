package com.example.notificationscheduler.service;

import com.example.notificationscheduler.domain.entity.AppUser;
import com.example.notificationscheduler.domain.enums.UserRole;
import com.example.notificationscheduler.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Persists the online flag of users as realtime sessions come and go.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserPresenceService {

    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Flip a user online, creating a placeholder user for an unknown id
     */
    @Transactional
    public void markOnline(String userId) {
        var existing = userRepository.findById(userId);
        if (existing.isPresent()) {
            var user = existing.get();
            user.setOnline(true);
            userRepository.save(user);
            return;
        }

        log.info("Creating user {} on first connection", userId);
        userRepository.save(AppUser.builder()
                .id(userId)
                .email("user-" + userId + "@example.com")
                .name(userId)
                .role(UserRole.USER)
                .online(true)
                .build());
    }

    public void markOffline(String userId) {
        var updated = userRepository.updateOnline(userId, false, clock.instant());
        if (updated == 0) {
            log.debug("No user {} to mark offline", userId);
        }
    }

    public boolean isOnline(String userId) {
        return userRepository.findById(userId)
                .map(user -> Boolean.TRUE.equals(user.getOnline()))
                .orElse(false);
    }
}
