package org.janelia.medslice.image;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Physical distance between adjacent voxel centers along x (width), y (height) and z (depth).
 */
public class VoxelSpacing {

    public static final VoxelSpacing UNIT = new VoxelSpacing(1.0, 1.0, 1.0);

    private final double width;
    private final double height;
    private final double depth;

    public VoxelSpacing(double width, double height, double depth) {
        this.width = validSpacingOrDefault(width);
        this.height = validSpacingOrDefault(height);
        this.depth = validSpacingOrDefault(depth);
    }

    /**
     * Create the spacing from the per-axis values; missing axes default to 1.
     */
    public static VoxelSpacing fromAxes(double... axesSpacing) {
        return new VoxelSpacing(
                axesSpacing.length > 0 ? axesSpacing[0] : 1.0,
                axesSpacing.length > 1 ? axesSpacing[1] : 1.0,
                axesSpacing.length > 2 ? axesSpacing[2] : 1.0
        );
    }

    private static double validSpacingOrDefault(double v) {
        return Double.isFinite(v) && v > 0 ? v : 1.0;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getDepth() {
        return depth;
    }

    public double[] toArray() {
        return new double[] {width, height, depth};
    }

    /**
     * @return the spacing of an image whose x and y axes were swapped
     */
    public VoxelSpacing swapWidthAndHeight() {
        return new VoxelSpacing(height, width, depth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        VoxelSpacing that = (VoxelSpacing) o;

        return new EqualsBuilder()
                .append(width, that.width)
                .append(height, that.height)
                .append(depth, that.depth)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(width)
                .append(height)
                .append(depth)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("width", width)
                .append("height", height)
                .append("depth", depth)
                .toString();
    }
}
