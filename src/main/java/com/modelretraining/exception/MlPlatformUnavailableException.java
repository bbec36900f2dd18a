package com.modelretraining.exception;

public class MlPlatformUnavailableException extends RetrainingException {
    public MlPlatformUnavailableException(Throwable cause) {
        super("ML_PLATFORM_UNAVAILABLE",
              "The ML platform is currently unavailable. Please try again later.",
              cause);
    }
}
