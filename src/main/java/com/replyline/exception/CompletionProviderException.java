package com.replyline.exception;

/**
 * Error raised by, or on behalf of, a completion provider.
 */
public class CompletionProviderException extends StreamDeliveryException {

    public static final String PROVIDER_ERROR = "PROVIDER_ERROR";
    public static final String NO_PROVIDER = "NO_PROVIDER";
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";

    public CompletionProviderException(String code, String message) {
        super(code, message);
    }

    public CompletionProviderException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
