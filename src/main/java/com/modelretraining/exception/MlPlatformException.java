package com.modelretraining.exception;

public class MlPlatformException extends RetrainingException {
    public MlPlatformException(String message) {
        super("ML_PLATFORM_ERROR", message);
    }
    public MlPlatformException(String message, Throwable cause) {
        super("ML_PLATFORM_ERROR", message, cause);
    }
}
