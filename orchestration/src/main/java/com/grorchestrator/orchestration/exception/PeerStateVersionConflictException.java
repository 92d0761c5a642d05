package com.grorchestrator.orchestration.exception;

public class PeerStateVersionConflictException extends RuntimeException {
    public PeerStateVersionConflictException() {
    }

    public PeerStateVersionConflictException(String message) {
        super(message);
    }

    public PeerStateVersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public PeerStateVersionConflictException(Throwable cause) {
        super(cause);
    }

    public PeerStateVersionConflictException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
