package org.janelia.medslice.image;

import org.janelia.medslice.MedSliceException;

/**
 * Raised when an image does not reduce to a 2-D or 3-D array.
 */
public class VolumeDimensionException extends MedSliceException {

    public VolumeDimensionException(String message) {
        super(message);
    }
}
