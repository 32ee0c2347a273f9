package com.phillippitts.holderbot.exception;

/**
 * Thrown when the vision oracle cannot analyse a region: transport failure,
 * non-success HTTP status, or an empty reply.
 */
public class VisionOracleException extends HolderBotException {

    private final String region;
    private final int status;

    public VisionOracleException(String message) {
        super(message);
        this.region = "unknown";
        this.status = -1;
    }

    public VisionOracleException(String message, String region, int status) {
        super(message + " (region: " + region + ")");
        this.region = region;
        this.status = status;
    }

    public VisionOracleException(String message, String region, int status, Throwable cause) {
        super(message + " (region: " + region + ")", cause);
        this.region = region;
        this.status = status;
    }

    public String getRegion() {
        return region;
    }

    /**
     * HTTP status returned by the oracle, or -1 when no response was received.
     */
    public int getStatus() {
        return status;
    }
}
