package com.landscape.connect.dgraph;

import com.landscape.connect.core.model.MinimumId;

/**
 * Thrown when a minimum could not be admitted into the distance graph.
 * The admission has been rolled back completely; the caller may retry.
 */
public class AdmissionException extends RuntimeException {

    private final MinimumId minimumId;

    public AdmissionException(MinimumId minimumId, Throwable cause) {
        super("Admission of minimum " + minimumId + " failed: " + cause.getMessage(), cause);
        this.minimumId = minimumId;
    }

    public MinimumId getMinimumId() {
        return minimumId;
    }
}
