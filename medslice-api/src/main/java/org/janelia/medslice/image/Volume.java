package org.janelia.medslice.image;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Canonical image samples as 64-bit reals.
 * Axis 0 runs along the columns (x), axis 1 along the rows (y) and the optional axis 2 along the depth (z).
 * The samples are never modified once the volume is created; transformations create new volumes.
 */
public class Volume {

    private final Img<DoubleType> data;
    private final VoxelSpacing voxelSpacing;
    private final SourceFormat sourceFormat;
    private final double minValue;
    private final double maxValue;
    private final long finiteCount;

    public Volume(Img<DoubleType> data, VoxelSpacing voxelSpacing, SourceFormat sourceFormat) {
        int ndims = data.numDimensions();
        if (ndims != 2 && ndims != 3) {
            throw new VolumeDimensionException("Expected 2D or 3D data, but got " + ndims + "D data with shape "
                    + Arrays.toString(data.dimensionsAsLongArray()));
        }
        this.data = data;
        this.voxelSpacing = voxelSpacing == null ? VoxelSpacing.UNIT : voxelSpacing;
        this.sourceFormat = sourceFormat;
        ImageAccessUtils.FiniteRange range = ImageAccessUtils.computeFiniteRange(data);
        this.minValue = range.min;
        this.maxValue = range.max;
        this.finiteCount = range.count;
    }

    /**
     * @return the samples backing this volume; they are shared, so callers must only read them
     */
    public Img<DoubleType> getData() {
        return data;
    }

    public VoxelSpacing getVoxelSpacing() {
        return voxelSpacing;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    public int numDimensions() {
        return data.numDimensions();
    }

    public boolean isVolumetric() {
        return data.numDimensions() == 3;
    }

    public int getCols() {
        return (int) data.dimension(0);
    }

    public int getRows() {
        return (int) data.dimension(1);
    }

    public int getDepth() {
        return isVolumetric() ? (int) data.dimension(2) : 1;
    }

    public int getNumSlices() {
        return getDepth();
    }

    /**
     * @return (rows, cols) or (rows, cols, depth)
     */
    public long[] getShape() {
        return isVolumetric()
                ? new long[] {getRows(), getCols(), getDepth()}
                : new long[] {getRows(), getCols()};
    }

    /**
     * Min of the finite samples or 0 if there are none.
     */
    public double getMinValue() {
        return minValue;
    }

    /**
     * Max of the finite samples or 0 if there are none.
     */
    public double getMaxValue() {
        return maxValue;
    }

    public boolean hasFiniteValues() {
        return finiteCount > 0;
    }

    /**
     * @param sliceIndex index along the depth axis
     * @return a 2D view of the requested slice
     */
    public RandomAccessibleInterval<DoubleType> getSlice(int sliceIndex) {
        if (sliceIndex < 0 || sliceIndex >= getNumSlices()) {
            throw new IndexOutOfBoundsException("Slice " + sliceIndex + " is outside [0, " + getNumSlices() + ")");
        }
        if (isVolumetric()) {
            return Views.hyperSlice(data, 2, sliceIndex);
        } else {
            return data;
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("shape", getShape())
                .append("voxelSpacing", voxelSpacing)
                .append("sourceFormat", sourceFormat)
                .append("minValue", minValue)
                .append("maxValue", maxValue)
                .toString();
    }
}
