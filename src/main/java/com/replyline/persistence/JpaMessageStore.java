package com.replyline.persistence;

import com.replyline.entity.ChatMessageEntity;
import com.replyline.model.ChatMessageRecord;
import com.replyline.model.StoredMessage;
import com.replyline.repository.ChatMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link MessageStore} on Postgres. JPA calls run on the bounded elastic scheduler.
 */
@Slf4j
@Component
public class JpaMessageStore implements MessageStore {

    private final ChatMessageRepository repository;

    public JpaMessageStore(ChatMessageRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<StoredMessage> storeMessage(ChatMessageRecord record) {
        return Mono.fromCallable(() -> {
                    ChatMessageEntity saved = repository.save(ChatMessageEntity.builder()
                            .messageId(record.getMessageId())
                            .conversationId(record.getConversationId())
                            .workspaceId(record.getWorkspaceId())
                            .agentId(record.getAgentId())
                            .role(record.getRole())
                            .content(record.getContent())
                            .model(record.getModel())
                            .responseTimeMs(record.getResponseTimeMs())
                            .build());

                    log.debug("Stored message {} for conversation {}", saved.getMessageId(), saved.getConversationId());

                    return StoredMessage.builder()
                            .id(saved.getId().toString())
                            .messageId(saved.getMessageId())
                            .conversationId(saved.getConversationId())
                            .content(saved.getContent())
                            .createdAt(saved.getCreatedAt())
                            .build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
