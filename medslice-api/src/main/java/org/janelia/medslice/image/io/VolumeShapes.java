package org.janelia.medslice.image.io;

import java.util.Arrays;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VolumeDimensionException;
import org.janelia.medslice.image.VoxelSpacing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings decoded samples to the 2D or 3D shape every volume has.
 */
class VolumeShapes {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeShapes.class);

    /**
     * @param samples decoded samples with the first axis varying fastest
     * @param dims extent of every axis; the first axis runs along the columns
     * @param axesSpacing physical spacing of every axis; missing values default to 1
     * @param sourceFormat
     * @return the volume
     */
    static Volume createVolume(double[] samples, long[] dims, double[] axesSpacing, SourceFormat sourceFormat) {
        return createVolume(samples, dims, axesSpacing, sourceFormat, false);
    }

    /**
     * Same as {@link #createVolume(double[], long[], double[], SourceFormat)} for data indexed as (row, column, slice),
     * like NIfTI arrays, where the first axis runs along the rows.
     */
    static Volume createRowsFirstVolume(double[] samples, long[] dims, double[] axesSpacing, SourceFormat sourceFormat) {
        return createVolume(samples, dims, axesSpacing, sourceFormat, true);
    }

    private static Volume createVolume(double[] samples, long[] dims, double[] axesSpacing, SourceFormat sourceFormat, boolean rowsFirst) {
        if (dims.length < 2 || dims.length > 4) {
            throw new VolumeDimensionException("Expected 2D or 3D data, but got " + dims.length + "D data with shape " + Arrays.toString(dims));
        }
        long[] volumeDims = dims;
        double[] volumeSamples = samples;
        if (volumeDims.length == 4) {
            // keep the first volume along the 4th axis
            volumeDims = Arrays.copyOf(dims, 3);
            int volumeSize = (int) (volumeDims[0] * volumeDims[1] * volumeDims[2]);
            volumeSamples = Arrays.copyOf(samples, volumeSize);
            LOG.debug("Reduced 4D data with shape {} to {}", Arrays.toString(dims), Arrays.toString(volumeDims));
        }
        double[] volumeSpacing = Arrays.copyOf(axesSpacing, volumeDims.length);
        for (int d = axesSpacing.length; d < volumeSpacing.length; d++) {
            volumeSpacing[d] = 1.0;
        }
        if (volumeDims.length == 3 && Arrays.stream(volumeDims).anyMatch(d -> d == 1)) {
            long[] squeezedDims = new long[volumeDims.length];
            double[] squeezedSpacing = new double[volumeDims.length];
            int n = 0;
            for (int d = 0; d < volumeDims.length; d++) {
                if (volumeDims[d] != 1) {
                    squeezedDims[n] = volumeDims[d];
                    squeezedSpacing[n] = volumeSpacing[d];
                    n++;
                }
            }
            LOG.debug("Squeezed singleton axes of shape {}", Arrays.toString(volumeDims));
            volumeDims = Arrays.copyOf(squeezedDims, n);
            volumeSpacing = Arrays.copyOf(squeezedSpacing, n);
        }
        if (volumeDims.length != 2 && volumeDims.length != 3) {
            throw new VolumeDimensionException("Expected 2D or 3D data, but got " + volumeDims.length + "D data with shape "
                    + Arrays.toString(dims));
        }
        if (rowsFirst) {
            volumeSamples = swapFirstAxes(volumeSamples, volumeDims);
            volumeDims = swapFirst(volumeDims.clone());
            volumeSpacing = swapFirst(volumeSpacing.clone());
        }
        ArrayImg<DoubleType, DoubleArray> img = ArrayImgs.doubles(volumeSamples, volumeDims);
        return new Volume(img, VoxelSpacing.fromAxes(volumeSpacing), sourceFormat);
    }

    /**
     * Transposes every plane spanned by the first two axes so that the second axis varies fastest.
     */
    static double[] swapFirstAxes(double[] samples, long[] dims) {
        int n0 = (int) dims[0];
        int n1 = (int) dims[1];
        int planeSize = n0 * n1;
        double[] swapped = new double[samples.length];
        for (int offset = 0; offset + planeSize <= samples.length; offset += planeSize) {
            for (int i1 = 0; i1 < n1; i1++) {
                for (int i0 = 0; i0 < n0; i0++) {
                    swapped[offset + i0 * n1 + i1] = samples[offset + i1 * n0 + i0];
                }
            }
        }
        return swapped;
    }

    private static long[] swapFirst(long[] values) {
        long tmp = values[0];
        values[0] = values[1];
        values[1] = tmp;
        return values;
    }

    private static double[] swapFirst(double[] values) {
        double tmp = values[0];
        values[0] = values[1];
        values[1] = tmp;
        return values;
    }

    static long sampleCount(long[] dims) {
        long n = 1;
        for (long d : dims) {
            if (d <= 0) {
                throw new ImageFormatException("Invalid image shape " + Arrays.toString(dims));
            }
            n *= d;
        }
        if (n > Integer.MAX_VALUE - 8) {
            throw new ImageFormatException("Image with shape " + Arrays.toString(dims) + " is too large");
        }
        return n;
    }
}
