package org.janelia.medslice.service;

import org.janelia.medslice.dto.ImageInfo;

/**
 * Result of loading an image: its id in the store and its metadata.
 */
public class LoadedImage {
    private final String imageId;
    private final ImageInfo imageInfo;

    LoadedImage(String imageId, ImageInfo imageInfo) {
        this.imageId = imageId;
        this.imageInfo = imageInfo;
    }

    public String getImageId() {
        return imageId;
    }

    public ImageInfo getImageInfo() {
        return imageInfo;
    }

    public int getTotalSlices() {
        return imageInfo.getTotalSlices();
    }
}
