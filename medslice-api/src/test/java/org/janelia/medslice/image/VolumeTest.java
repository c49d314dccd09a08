package org.janelia.medslice.image;

import net.imglib2.img.array.ArrayImgs;
import org.janelia.medslice.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class VolumeTest {

    @Test
    public void volumeShapeAndSlices() {
        Volume volume = TestUtils.createIndexedVolume(2, 3, 4);
        assertArrayEquals(new long[] {2, 3, 4}, volume.getShape());
        assertEquals(4, volume.getNumSlices());
        assertTrue(volume.isVolumetric());
        for (int z = 0; z < 4; z++) {
            assertArrayEquals(new long[] {3, 2}, volume.getSlice(z).dimensionsAsLongArray());
            assertEquals(1 + 100 * z, TestUtils.valueAt(volume.getSlice(z), 0, 0), 0);
        }
    }

    @Test
    public void valueRangeIgnoresNonFiniteValues() {
        Volume volume = TestUtils.createVolume(new double[][] {
                {Double.NaN, -3, 7},
                {Double.POSITIVE_INFINITY, 0, 2}
        });
        assertEquals(-3, volume.getMinValue(), 0);
        assertEquals(7, volume.getMaxValue(), 0);
        assertTrue(volume.hasFiniteValues());
    }

    @Test
    public void valueRangeWithoutFiniteValues() {
        Volume volume = TestUtils.createVolume(new double[][] {
                {Double.NaN, Double.NaN}
        });
        assertEquals(0, volume.getMinValue(), 0);
        assertEquals(0, volume.getMaxValue(), 0);
        assertFalse(volume.hasFiniteValues());
    }

    @Test(expected = VolumeDimensionException.class)
    public void rejectOneDimensionalData() {
        new Volume(ArrayImgs.doubles(5), VoxelSpacing.UNIT, SourceFormat.NIFTI);
    }

    @Test(expected = VolumeDimensionException.class)
    public void rejectFourDimensionalData() {
        new Volume(ArrayImgs.doubles(2, 2, 2, 2), VoxelSpacing.UNIT, SourceFormat.NIFTI);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectSliceOutsideVolume() {
        TestUtils.createIndexedVolume(2, 2, 3).getSlice(3);
    }

    @Test
    public void invalidSpacingDefaultsToUnit() {
        VoxelSpacing spacing = new VoxelSpacing(0, Double.NaN, -1);
        assertEquals(VoxelSpacing.UNIT, spacing);
        assertEquals(new VoxelSpacing(0.5, 1, 1), VoxelSpacing.fromAxes(0.5));
    }

    @Test
    public void resolveSourceFormatFromFileName() {
        assertEquals(SourceFormat.NIFTI, SourceFormat.fromFileName("brain.nii.gz"));
        assertEquals(SourceFormat.NIFTI, SourceFormat.fromFileName("BRAIN.NII"));
        assertEquals(SourceFormat.DICOM, SourceFormat.fromFileName("slice.dcm"));
        assertEquals(SourceFormat.BITMAP, SourceFormat.fromFileName("photo.JPEG"));
        assertEquals(SourceFormat.BITMAP, SourceFormat.fromFileName("scan.bmp"));
    }
}
