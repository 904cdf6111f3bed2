package com.example.securechat.repository;

import com.example.securechat.domain.ChatMessage;
import com.example.securechat.domain.MessageRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /** createdAt ASC, id ASC: insertion order even when timestamps collide. */
    List<ChatMessage> findBySession_IdOrderByCreatedAtAscIdAsc(UUID sessionId);

    long countBySession_IdAndRole(UUID sessionId, MessageRole role);

    long countBySession_Id(UUID sessionId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ChatMessage m where m.session.id = :sessionId")
    int deleteAllBySessionId(@Param("sessionId") UUID sessionId);
}
