package com.phillippitts.holderbot.exception;

/**
 * Thrown when the pattern-learning store cannot complete a read or write.
 * A correction that fails with this exception has left no partial state behind.
 */
public class StorageException extends HolderBotException {

    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("Storage operation failed: " + operation, cause);
        this.operation = operation;
    }

    public StorageException(String operation, String subjectId, Throwable cause) {
        super("Storage operation failed: " + operation + " (subject: " + subjectId + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
