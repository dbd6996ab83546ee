package com.arbiter.arbitration;

import java.util.Optional;

/**
 * Protocol-level failure with a stable code. Raised synchronously to the
 * caller of the failing operation; the engine never retries.
 */
public class ArbitrationException extends RuntimeException {

    private final ArbitrationErrorCode code;
    private final String sessionId;

    public ArbitrationException(ArbitrationErrorCode code, String message) {
        this(code, message, null);
    }

    public ArbitrationException(ArbitrationErrorCode code, String message, String sessionId) {
        super(message);
        this.code = code;
        this.sessionId = sessionId;
    }

    public ArbitrationErrorCode getCode() {
        return code;
    }

    public Optional<String> getSessionId() {
        return Optional.ofNullable(sessionId);
    }
}
