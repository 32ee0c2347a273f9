package com.phillippitts.holderbot.exception;

/**
 * Thrown when a caller supplies a blank subject id or blank correction values.
 */
public class InvalidSubjectException extends HolderBotException {

    private final String reason;

    public InvalidSubjectException(String reason) {
        super("Invalid subject input: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
