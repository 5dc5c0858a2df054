package com.replyline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One event of a streamed agent answer.
 *
 * <pre>
 * start  { messageId, agentId, timestamp }
 * chunk  { messageId, chunk, index, isLast }
 * end    { messageId, totalChunks, totalTimeMs, fullResponse }
 * error  { messageId, error, code, partialResponse }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

    @JsonIgnore
    private StreamEventType type;

    private String messageId;

    // start
    private String agentId;
    private Instant timestamp;

    // chunk
    private String chunk;
    private Integer index;
    @JsonProperty("isLast")
    private Boolean last;

    // end
    private Integer totalChunks;
    private Long totalTimeMs;
    private String fullResponse;

    // error
    private String error;
    private String code;
    private String partialResponse;

    public static StreamEvent start(String messageId, String agentId, Instant timestamp) {
        return StreamEvent.builder()
                .type(StreamEventType.START)
                .messageId(messageId)
                .agentId(agentId)
                .timestamp(timestamp)
                .build();
    }

    public static StreamEvent chunk(String messageId, String chunk, int index) {
        return StreamEvent.builder()
                .type(StreamEventType.CHUNK)
                .messageId(messageId)
                .chunk(chunk)
                .index(index)
                .last(false)
                .build();
    }

    public static StreamEvent end(String messageId, int totalChunks, long totalTimeMs, String fullResponse) {
        return StreamEvent.builder()
                .type(StreamEventType.END)
                .messageId(messageId)
                .totalChunks(totalChunks)
                .totalTimeMs(totalTimeMs)
                .fullResponse(fullResponse)
                .build();
    }

    public static StreamEvent error(String messageId, String error, String code, String partialResponse) {
        return StreamEvent.builder()
                .type(StreamEventType.ERROR)
                .messageId(messageId)
                .error(error)
                .code(code)
                .partialResponse(partialResponse)
                .build();
    }
}
