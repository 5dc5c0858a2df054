package com.replyline.exception;

/**
 * Failure of a streamed answer, tagged with a protocol error code.
 */
public class StreamDeliveryException extends RuntimeException {

    public static final String STREAM_ERROR = "STREAM_ERROR";

    private final String code;

    public StreamDeliveryException(String code, String message) {
        super(message);
        this.code = code;
    }

    public StreamDeliveryException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
