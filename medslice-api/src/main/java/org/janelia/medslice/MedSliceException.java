package org.janelia.medslice;

/**
 * Base class for the failures reported by the image pipeline.
 */
public class MedSliceException extends RuntimeException {

    public MedSliceException(String message) {
        super(message);
    }

    public MedSliceException(String message, Throwable cause) {
        super(message, cause);
    }
}
