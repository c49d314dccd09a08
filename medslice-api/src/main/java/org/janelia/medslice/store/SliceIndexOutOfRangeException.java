package org.janelia.medslice.store;

/**
 * The image exists but the requested slice does not.
 */
public class SliceIndexOutOfRangeException extends ImageNotFoundException {

    private final int sliceIndex;
    private final int totalSlices;

    public SliceIndexOutOfRangeException(String imageId, int sliceIndex, int totalSlices) {
        super(imageId, "Slice " + sliceIndex + " not found for image " + imageId + " with " + totalSlices + " slices");
        this.sliceIndex = sliceIndex;
        this.totalSlices = totalSlices;
    }

    public int getSliceIndex() {
        return sliceIndex;
    }

    public int getTotalSlices() {
        return totalSlices;
    }
}
