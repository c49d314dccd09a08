package org.janelia.medslice.registration;

/**
 * Aligns a moving volume to a fixed one. The answer must have the shape of the fixed volume.
 */
public interface RegistrationCollaborator {
    VolumePayload register(RegistrationRequest request) throws Exception;
}
