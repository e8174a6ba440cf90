package com.landscape.connect.distance;

/**
 * Thrown when a structural distance cannot be computed.
 */
public class DistanceComputationException extends RuntimeException {

    public DistanceComputationException(String message) {
        super(message);
    }

    public DistanceComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
