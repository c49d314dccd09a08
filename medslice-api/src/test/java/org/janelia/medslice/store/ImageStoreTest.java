package org.janelia.medslice.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.cache.RemovalCause;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.medslice.TestUtils;
import org.janelia.medslice.dto.ImageInfo;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VoxelSpacing;
import org.janelia.medslice.image.algorithms.NormalizedSlices;
import org.janelia.medslice.image.algorithms.WindowSettings;
import org.janelia.medslice.image.algorithms.WindowingAlgorithms;
import org.janelia.medslice.image.algorithms.WindowingOptions;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ImageStoreTest {

    private ImageStore imageStore;

    @Before
    public void setUp() {
        imageStore = new ImageStore();
    }

    @After
    public void tearDown() {
        imageStore.evictAll();
    }

    @Test
    public void storeAndRetrieveSlices() {
        Volume volume = TestUtils.createIndexedVolume(2, 3, 4);
        String imageId = store(volume);

        assertTrue(imageStore.contains(imageId));
        for (int z = 0; z < 4; z++) {
            SliceBitmap slice = imageStore.getSlice(imageId, z);
            assertEquals(2, slice.getRows());
            assertEquals(3, slice.getCols());
            assertEquals(6, slice.toByteArray().length);
        }
        Img<DoubleType> rawSlice = imageStore.getRawSlice(imageId, 2);
        assertEquals(1 + 1 + 20 + 200, TestUtils.valueAt(rawSlice, 2, 1), 0);
    }

    @Test
    public void imageIdsAreUnique() {
        Volume volume = TestUtils.createIndexedVolume(2, 2, 1);
        String id1 = store(volume);
        String id2 = store(volume);
        assertNotEquals(id1, id2);
        assertEquals(2, imageStore.size());
    }

    @Test
    public void imageInfo() {
        Volume volume = TestUtils.createVolume(new double[][][] {
                {{0, 10}, {20, 30}, {40, 50}},
                {{60, 70}, {80, 90}, {100, Double.NaN}}
        }, new VoxelSpacing(0.5, 0.7, 3));
        String imageId = store(volume);

        ImageInfo imageInfo = imageStore.getImageInfo(imageId);
        assertEquals(imageId, imageInfo.getImageId());
        assertEquals(2, imageInfo.getTotalSlices());
        assertEquals(3, imageInfo.getRows());
        assertEquals(2, imageInfo.getCols());
        assertEquals(0, imageInfo.getDataMin(), 0);
        assertEquals(100, imageInfo.getDataMax(), 0);
        assertArrayEquals(new double[] {0.5, 0.7, 3}, imageInfo.getVoxelSpacing(), 0);
        assertEquals("NIFTI", imageInfo.getSourceFormat());
        WindowSettings windowSettings = imageStore.getWindowSettings(imageId);
        assertEquals(windowSettings.getCenter(), imageInfo.getWindowCenter(), 0);
        assertEquals(windowSettings.getWidth(), imageInfo.getWindowWidth(), 0);
    }

    @Test
    public void unknownImage() {
        try {
            imageStore.getSlice("missing", 0);
            fail("Expected ImageNotFoundException");
        } catch (ImageNotFoundException e) {
            assertEquals("missing", e.getImageId());
        }
        try {
            imageStore.rotate("missing", 90);
            fail("Expected ImageNotFoundException");
        } catch (ImageNotFoundException e) {
            assertEquals("missing", e.getImageId());
        }
        assertFalse(imageStore.contains(null));
    }

    @Test
    public void sliceIndexOutOfRange() {
        String imageId = store(TestUtils.createIndexedVolume(2, 3, 4));
        for (int sliceIndex : new int[] {-1, 4, 100}) {
            try {
                imageStore.getSlice(imageId, sliceIndex);
                fail("Expected SliceIndexOutOfRangeException for " + sliceIndex);
            } catch (SliceIndexOutOfRangeException e) {
                assertEquals(sliceIndex, e.getSliceIndex());
                assertEquals(4, e.getTotalSlices());
            }
        }
        try {
            imageStore.getRawSlice(imageId, 4);
            fail("Expected SliceIndexOutOfRangeException");
        } catch (SliceIndexOutOfRangeException e) {
            assertEquals(imageId, e.getImageId());
        }
    }

    @Test
    public void returnedSlicesAreCopies() {
        String imageId = store(TestUtils.createIndexedVolume(2, 3, 1));
        SliceBitmap slice = imageStore.getSlice(imageId, 0);
        int value = slice.getValue(0, 0);
        slice.getBitmap().getAt(0, 0).set(value == 0 ? 1 : 0);
        assertEquals(value, imageStore.getSlice(imageId, 0).getValue(0, 0));
        assertNotSame(imageStore.getSlice(imageId, 0).getBitmap(), imageStore.getSlice(imageId, 0).getBitmap());
    }

    @Test
    public void rotateQuarterTurn() {
        Volume volume = TestUtils.createIndexedVolume(2, 3, 2);
        String imageId = store(volume);
        WindowSettings windowSettings = imageStore.getWindowSettings(imageId);

        imageStore.rotate(imageId, 90);

        ImageInfo imageInfo = imageStore.getImageInfo(imageId);
        assertEquals(3, imageInfo.getRows());
        assertEquals(2, imageInfo.getCols());
        assertEquals(2, imageInfo.getTotalSlices());
        assertEquals(windowSettings, imageStore.getWindowSettings(imageId));
        // the top left corner of the rotated slice is the top right corner of the original one
        Img<DoubleType> rawSlice = imageStore.getRawSlice(imageId, 1);
        assertEquals(1 + 0 + 20 + 100, TestUtils.valueAt(rawSlice, 0, 0), 0);
        SliceBitmap slice = imageStore.getSlice(imageId, 1);
        assertEquals(3, slice.getRows());
        assertEquals(2, slice.getCols());
    }

    @Test
    public void rotateTwiceByHalfTurnRestoresSlices() {
        double[][][] values = new double[2][3][5];
        for (int z = 0; z < 2; z++) {
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 5; c++) {
                    values[z][r][c] = 0.37 * (r + 1) + 1.13 * c + 17.5 * z + 1e-9 * (r * 5 + c);
                }
            }
        }
        String imageId = store(TestUtils.createVolume(values, new VoxelSpacing(0.4, 0.6, 1.5)));
        List<byte[]> before = new ArrayList<>();
        for (int z = 0; z < 2; z++) {
            before.add(imageStore.getSlice(imageId, z).toByteArray());
        }

        imageStore.rotate(imageId, 180);
        assertFalse(Arrays.equals(before.get(0), imageStore.getSlice(imageId, 0).toByteArray()));
        assertEquals(values[0][2][4], TestUtils.valueAt(imageStore.getRawSlice(imageId, 0), 0, 0), 0);
        imageStore.rotate(imageId, 180);

        ImageInfo imageInfo = imageStore.getImageInfo(imageId);
        assertEquals(3, imageInfo.getRows());
        assertEquals(5, imageInfo.getCols());
        assertEquals(2, imageInfo.getTotalSlices());
        assertArrayEquals(new long[] {3, 5, 2}, imageStore.getVolume(imageId).getShape());
        assertEquals(new VoxelSpacing(0.4, 0.6, 1.5), imageStore.getVolume(imageId).getVoxelSpacing());
        for (int z = 0; z < 2; z++) {
            Img<DoubleType> rawSlice = imageStore.getRawSlice(imageId, z);
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 5; c++) {
                    assertEquals(Double.doubleToLongBits(values[z][r][c]), Double.doubleToLongBits(TestUtils.valueAt(rawSlice, c, r)));
                }
            }
            assertArrayEquals(before.get(z), imageStore.getSlice(imageId, z).toByteArray());
        }
    }

    @Test
    public void storedSlicesDoNotDependOnCallerList() {
        Volume volume = TestUtils.createIndexedVolume(2, 3, 2);
        NormalizedSlices normalizedSlices = WindowingAlgorithms.precomputeNormalizedSlices(volume);
        List<Img<UnsignedByteType>> slices = new ArrayList<>(normalizedSlices.getSlices());
        String imageId = imageStore.put(volume, normalizedSlices.getWindowSettings(), slices);

        slices.clear();

        assertEquals(2, imageStore.getImageInfo(imageId).getTotalSlices());
        assertEquals(3, imageStore.getSlice(imageId, 1).getCols());
    }

    @Test
    public void rotateByInvalidAngleKeepsRecord() {
        String imageId = store(TestUtils.createIndexedVolume(2, 3, 1));
        byte[] before = imageStore.getSlice(imageId, 0).toByteArray();
        try {
            imageStore.rotate(imageId, 45);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("45"));
        }
        assertArrayEquals(before, imageStore.getSlice(imageId, 0).toByteArray());
        assertEquals(2, imageStore.getImageInfo(imageId).getRows());
    }

    @Test
    public void updateWindowLevel() {
        Volume volume = TestUtils.createVolume(new double[][] {{0, 10, 20, 30}});
        String imageId = store(volume);

        imageStore.updateWindowLevel(imageId, 20, 20);

        assertEquals(new WindowSettings(20, 20), imageStore.getWindowSettings(imageId));
        SliceBitmap slice = imageStore.getSlice(imageId, 0);
        assertEquals(0, slice.getValue(0, 0));
        assertEquals(0, slice.getValue(0, 1));
        assertEquals(127, slice.getValue(0, 2));
        assertEquals(255, slice.getValue(0, 3));

        imageStore.updateWindowLevel(imageId, 20, 0);
        assertEquals(WindowSettings.MIN_WIDTH, imageStore.getWindowSettings(imageId).getWidth(), 0);
    }

    @Test
    public void invalidWindowKeepsRecord() {
        String imageId = store(TestUtils.createIndexedVolume(2, 3, 1));
        WindowSettings windowSettings = imageStore.getWindowSettings(imageId);
        try {
            imageStore.updateWindowLevel(imageId, Double.NaN, 10);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            assertEquals(windowSettings, imageStore.getWindowSettings(imageId));
        }
    }

    @Test
    public void explicitEviction() {
        List<String> evicted = new ArrayList<>();
        imageStore = new ImageStore(0, new UUIDImageIdGenerator(), WindowingOptions.DEFAULT, null,
                (imageId, cause) -> {
                    assertEquals(RemovalCause.EXPLICIT, cause);
                    evicted.add(imageId);
                });
        String imageId = store(TestUtils.createIndexedVolume(2, 2, 1));
        imageStore.evict(imageId);

        assertFalse(imageStore.contains(imageId));
        assertEquals(1, evicted.size());
        assertEquals(imageId, evicted.get(0));
        try {
            imageStore.evict(imageId);
            fail("Expected ImageNotFoundException");
        } catch (ImageNotFoundException expected) {
            assertEquals(imageId, expected.getImageId());
        }
    }

    @Test
    public void capacityEviction() {
        AtomicInteger counter = new AtomicInteger();
        List<String> evicted = new ArrayList<>();
        imageStore = new ImageStore(2, () -> "img-" + counter.incrementAndGet(), WindowingOptions.DEFAULT, null,
                (imageId, cause) -> {
                    if (cause == RemovalCause.SIZE) {
                        evicted.add(imageId);
                    }
                });
        Volume volume = TestUtils.createIndexedVolume(2, 2, 1);
        store(volume);
        store(volume);
        store(volume);

        assertEquals(2, imageStore.size());
        assertEquals(1, evicted.size());
        assertEquals("img-1", evicted.get(0));
        assertFalse(imageStore.contains("img-1"));
        assertTrue(imageStore.contains("img-3"));
    }

    @Test
    public void parallelRecomputation() {
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        try {
            imageStore = new ImageStore(0, new UUIDImageIdGenerator(), WindowingOptions.DEFAULT, executorService, null);
            String imageId = store(TestUtils.createIndexedVolume(4, 6, 5));
            imageStore.rotate(imageId, 270);
            assertEquals(6, imageStore.getImageInfo(imageId).getRows());
            assertEquals(5, imageStore.getImageInfo(imageId).getTotalSlices());
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    public void readersSeeConsistentState() throws Exception {
        Volume volume = TestUtils.createIndexedVolume(6, 6, 3);
        String imageId = store(volume);
        WindowSettings narrow = new WindowSettings(100, 10);
        WindowSettings wide = new WindowSettings(150, 400);
        byte[] narrowSlice = imageStoreSliceFor(volume, narrow);
        byte[] wideSlice = imageStoreSliceFor(volume, wide);

        ExecutorService executorService = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < 2; t++) {
                int writer = t;
                tasks.add(() -> {
                    for (int i = 0; i < 50; i++) {
                        WindowSettings windowSettings = (i + writer) % 2 == 0 ? narrow : wide;
                        imageStore.updateWindowLevel(imageId, windowSettings.getCenter(), windowSettings.getWidth());
                    }
                    return null;
                });
                tasks.add(() -> {
                    for (int i = 0; i < 200; i++) {
                        byte[] slice = imageStore.getSlice(imageId, 1).toByteArray();
                        if (!Arrays.equals(slice, narrowSlice) && !Arrays.equals(slice, wideSlice)) {
                            throw new AssertionError("Slice does not match any window");
                        }
                    }
                    return null;
                });
            }
            for (Future<Void> f : executorService.invokeAll(tasks)) {
                f.get();
            }
        } finally {
            executorService.shutdownNow();
        }
    }

    private byte[] imageStoreSliceFor(Volume volume, WindowSettings windowSettings) {
        ImageStore otherStore = new ImageStore();
        String otherId = otherStore.put(volume, WindowingAlgorithms.normalizeSlices(volume, windowSettings, WindowingOptions.DEFAULT, null));
        return otherStore.getSlice(otherId, 1).toByteArray();
    }

    private String store(Volume volume) {
        return imageStore.put(volume, WindowingAlgorithms.precomputeNormalizedSlices(volume));
    }
}
