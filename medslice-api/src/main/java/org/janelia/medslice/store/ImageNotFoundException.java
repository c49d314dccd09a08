package org.janelia.medslice.store;

import org.janelia.medslice.MedSliceException;

public class ImageNotFoundException extends MedSliceException {

    private final String imageId;

    public ImageNotFoundException(String imageId) {
        this(imageId, "Image " + imageId + " not found");
    }

    protected ImageNotFoundException(String imageId, String message) {
        super(message);
        this.imageId = imageId;
    }

    public String getImageId() {
        return imageId;
    }
}
