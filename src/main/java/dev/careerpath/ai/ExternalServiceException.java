package dev.careerpath.ai;

import lombok.Getter;

/**
 * Failure of a single call to a text-generation provider.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        AUTH_ERROR,
        RATE_LIMITED,
        MALFORMED_RESPONSE,
        PROVIDER_ERROR
    }

    private final Kind kind;
    private final boolean retryable;

    public ExternalServiceException(Kind kind, String message) {
        this(kind, message, null);
    }

    public ExternalServiceException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, kind == Kind.RATE_LIMITED || kind == Kind.PROVIDER_ERROR);
    }

    public ExternalServiceException(Kind kind, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }
}
