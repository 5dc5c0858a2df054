package com.replyline.persistence;

import com.replyline.model.ChatMessageRecord;
import com.replyline.model.StoredMessage;
import reactor.core.publisher.Mono;

/**
 * Store for the final messages of streamed answers.
 */
public interface MessageStore {

    Mono<StoredMessage> storeMessage(ChatMessageRecord record);
}
