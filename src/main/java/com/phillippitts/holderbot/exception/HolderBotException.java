package com.phillippitts.holderbot.exception;

/**
 * Base exception for all HolderBot application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class HolderBotException extends RuntimeException {

    public HolderBotException(String message) {
        super(message);
    }

    public HolderBotException(String message, Throwable cause) {
        super(message, cause);
    }

    public HolderBotException(Throwable cause) {
        super(cause);
    }
}
