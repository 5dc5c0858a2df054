package com.replyline.repository;

import com.replyline.entity.ChatMessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for persisted chat messages.
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, UUID> {

    Optional<ChatMessageEntity> findByMessageId(String messageId);

    List<ChatMessageEntity> findByConversationIdOrderByCreatedAtAsc(String conversationId);
}
