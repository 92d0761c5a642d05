package com.grorchestrator.orchestration.exception;

public class CertificateIssuanceException extends RuntimeException {
    public CertificateIssuanceException() {
    }

    public CertificateIssuanceException(String message) {
        super(message);
    }

    public CertificateIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }

    public CertificateIssuanceException(Throwable cause) {
        super(cause);
    }

    public CertificateIssuanceException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
