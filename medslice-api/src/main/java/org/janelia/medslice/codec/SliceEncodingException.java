package org.janelia.medslice.codec;

import org.janelia.medslice.MedSliceException;

public class SliceEncodingException extends MedSliceException {

    public SliceEncodingException(String message) {
        super(message);
    }

    public SliceEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
