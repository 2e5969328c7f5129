package com.contenttracker.domain.error;

/**
 * Base type for invariant violations raised synchronously by aggregate mutators.
 * The error code is stable and safe to surface to callers.
 */
public abstract class DomainException extends RuntimeException {

    private final String errorCode;

    protected DomainException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
