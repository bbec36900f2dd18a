package com.modelretraining.exception;

import lombok.Getter;

@Getter
public abstract class RetrainingException extends RuntimeException {
    private final String errorCode;
    protected RetrainingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected RetrainingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
