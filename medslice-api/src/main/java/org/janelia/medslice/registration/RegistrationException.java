package org.janelia.medslice.registration;

import org.janelia.medslice.MedSliceException;

public class RegistrationException extends MedSliceException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
