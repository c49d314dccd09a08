package org.janelia.medslice.registration;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class RegistrationRequest {

    private final VolumePayload fixed;
    private final VolumePayload moving;

    public RegistrationRequest(VolumePayload fixed, VolumePayload moving) {
        this.fixed = fixed;
        this.moving = moving;
    }

    public VolumePayload getFixed() {
        return fixed;
    }

    public VolumePayload getMoving() {
        return moving;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("fixed", fixed)
                .append("moving", moving)
                .toString();
    }
}
