package org.janelia.medslice.image;

/**
 * Maps a position in the transformed image to the position in the source image
 * that supplies its value.
 */
public interface GeomTransform {
    void apply(long[] currentPos, long[] originPos);

    /**
     * @return the shape of the transformed image
     */
    long[] getTargetShape();
}
