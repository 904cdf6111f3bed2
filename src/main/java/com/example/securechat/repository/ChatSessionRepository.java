package com.example.securechat.repository;

import com.example.securechat.domain.ChatSession;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * ChatSession JPA repository. Every lookup is scoped by owner.
 */
public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {

    Optional<ChatSession> findByIdAndOwnerId(UUID id, String ownerId);

    /**
     * Owner-scoped lookup that locks the row (SELECT ... FOR UPDATE) so the
     * session cannot be deleted between the ownership check and the write.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ChatSession s where s.id = :id and s.ownerId = :ownerId")
    Optional<ChatSession> findOwnedForUpdate(@Param("id") UUID id, @Param("ownerId") String ownerId);
}
