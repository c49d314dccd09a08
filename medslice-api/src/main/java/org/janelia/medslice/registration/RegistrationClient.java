package org.janelia.medslice.registration;

import java.util.Arrays;

import org.janelia.medslice.MedSliceException;
import org.janelia.medslice.image.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RegistrationClient {

    private static final Logger LOG = LoggerFactory.getLogger(RegistrationClient.class);

    private final RegistrationCollaborator collaborator;

    public RegistrationClient(RegistrationCollaborator collaborator) {
        this.collaborator = collaborator;
    }

    /**
     * @return the moving volume aligned to the fixed one; it has the shape, spacing and source format of the fixed volume
     */
    public Volume register(Volume fixed, Volume moving) {
        long startTime = System.currentTimeMillis();
        RegistrationRequest request = new RegistrationRequest(VolumePayload.fromVolume(fixed), VolumePayload.fromVolume(moving));
        VolumePayload result;
        try {
            result = collaborator.register(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Registration of {} to {} was interrupted", moving, fixed);
            throw new RegistrationException("Registration interrupted", e);
        } catch (Exception e) {
            LOG.error("Registration of {} to {} failed", moving, fixed, e);
            throw new RegistrationException("Registration failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new RegistrationException("Registration returned no volume");
        }
        if (!Arrays.equals(result.getShape(), fixed.getShape())) {
            throw new RegistrationException("Registration returned a volume with shape " + Arrays.toString(result.getShape())
                    + " instead of " + Arrays.toString(fixed.getShape()));
        }
        Volume registered;
        try {
            registered = result.toVolume(fixed.getSourceFormat());
        } catch (MedSliceException e) {
            throw new RegistrationException("Invalid registration result: " + e.getMessage(), e);
        }
        LOG.info("Registered {} to {} in {}ms", moving, fixed, System.currentTimeMillis() - startTime);
        return new Volume(registered.getData(), fixed.getVoxelSpacing(), fixed.getSourceFormat());
    }
}
