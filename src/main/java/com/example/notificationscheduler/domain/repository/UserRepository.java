package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.AppUser;
import com.example.notificationscheduler.domain.enums.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for users.
 */
@Repository
public interface UserRepository extends JpaRepository<AppUser, String> {

    List<AppUser> findByRole(UserRole role);

    long countByOnlineTrue();

    @Transactional
    @Modifying
    @Query("""
            UPDATE AppUser u
            SET u.online = :online,
                u.updatedAt = :now
            WHERE u.id = :userId
            """)
    int updateOnline(@Param("userId") String userId, @Param("online") boolean online, @Param("now") Instant now);
}
