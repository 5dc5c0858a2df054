package com.replyline.exception;

/**
 * The client went away (or a stream deadline expired) before the answer finished.
 */
public class StreamAbortedException extends StreamDeliveryException {

    public static final String STREAM_ABORTED = "STREAM_ABORTED";

    public StreamAbortedException(String message) {
        super(STREAM_ABORTED, message);
    }

    public StreamAbortedException(String message, Throwable cause) {
        super(STREAM_ABORTED, message, cause);
    }
}
