package org.janelia.medslice.image.io;

import org.janelia.medslice.MedSliceException;

/**
 * The content cannot be decoded as the declared image type.
 */
public class ImageFormatException extends MedSliceException {

    public ImageFormatException(String message) {
        super(message);
    }

    public ImageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
