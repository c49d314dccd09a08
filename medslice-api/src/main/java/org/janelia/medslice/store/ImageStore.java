package org.janelia.medslice.store;

import java.util.List;
import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalNotification;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.medslice.config.Config;
import org.janelia.medslice.dto.ImageInfo;
import org.janelia.medslice.image.ImageAccessUtils;
import org.janelia.medslice.image.ImageTransforms;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.algorithms.NormalizedSlices;
import org.janelia.medslice.image.algorithms.WindowSettings;
import org.janelia.medslice.image.algorithms.WindowingAlgorithms;
import org.janelia.medslice.image.algorithms.WindowingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the loaded images together with their display slices.
 * Operations on different images are independent; operations on the same image are serialized
 * so that readers always see a consistent volume, window and slice cache.
 */
public class ImageStore {

    private static final Logger LOG = LoggerFactory.getLogger(ImageStore.class);

    public static ImageStore fromConfig(Config config, ExecutorService executorService) {
        return new ImageStore(
                config.getLongPropertyValue("ImageStore.MaxRecords", 0L),
                new UUIDImageIdGenerator(),
                WindowingOptions.fromConfig(config),
                executorService,
                null);
    }

    private final Cache<String, ImageRecord> records;
    private final ImageIdGenerator imageIdGenerator;
    private final WindowingOptions windowingOptions;
    private final ExecutorService executorService;
    private final EvictionListener evictionListener;

    public ImageStore() {
        this(0, new UUIDImageIdGenerator(), WindowingOptions.DEFAULT, null, null);
    }

    /**
     * @param maxRecords maximum number of records; 0 means no limit
     * @param imageIdGenerator
     * @param windowingOptions options used to recompute the display slices
     * @param executorService if not null the display slices are recomputed in parallel
     * @param evictionListener optional listener notified when a record leaves the store
     */
    public ImageStore(long maxRecords,
                      ImageIdGenerator imageIdGenerator,
                      WindowingOptions windowingOptions,
                      @Nullable ExecutorService executorService,
                      @Nullable EvictionListener evictionListener) {
        Preconditions.checkArgument(maxRecords >= 0, "Invalid max records: %s", maxRecords);
        this.imageIdGenerator = imageIdGenerator;
        this.windowingOptions = windowingOptions;
        this.executorService = executorService;
        this.evictionListener = evictionListener;
        CacheBuilder<Object, Object> cacheBuilder = CacheBuilder.newBuilder()
                .concurrencyLevel(8);
        if (maxRecords > 0) {
            LOG.info("Initialize image store: maxRecords={}", maxRecords);
            cacheBuilder.maximumSize(maxRecords);
        }
        this.records = cacheBuilder
                .<String, ImageRecord>removalListener(this::onRemoval)
                .build();
    }

    private void onRemoval(RemovalNotification<String, ImageRecord> notification) {
        LOG.debug("Removed image {} ({})", notification.getKey(), notification.getCause());
        if (evictionListener != null) {
            evictionListener.onEviction(notification.getKey(), notification.getCause());
        }
    }

    public String put(Volume volume, NormalizedSlices normalizedSlices) {
        return put(volume, normalizedSlices.getWindowSettings(), normalizedSlices.getSlices());
    }

    /**
     * @return the id of the new record
     */
    public String put(Volume volume, WindowSettings windowSettings, List<Img<UnsignedByteType>> normalizedSlices) {
        ImageRecord.State state = new ImageRecord.State(volume, windowSettings, normalizedSlices, volume.getMinValue(), volume.getMaxValue());
        String imageId = imageIdGenerator.generateId();
        if (records.asMap().putIfAbsent(imageId, new ImageRecord(imageId, state)) != null) {
            throw new IllegalStateException("Duplicate image id " + imageId);
        }
        LOG.debug("Stored image {}: {}", imageId, volume);
        return imageId;
    }

    public boolean contains(String imageId) {
        return imageId != null && records.getIfPresent(imageId) != null;
    }

    public long size() {
        return records.size();
    }

    public void evict(String imageId) {
        records.invalidate(getRecord(imageId).getImageId());
    }

    public void evictAll() {
        records.invalidateAll();
    }

    /**
     * @return a copy of the display bitmap of the given slice
     */
    public SliceBitmap getSlice(String imageId, int sliceIndex) {
        return getRecord(imageId).read(state -> {
            checkSliceIndex(imageId, sliceIndex, state);
            return new SliceBitmap(ImageAccessUtils.copyToArrayImg(state.normalizedSlices.get(sliceIndex), new UnsignedByteType()));
        });
    }

    /**
     * @return a copy of the raw samples of the given slice
     */
    public Img<DoubleType> getRawSlice(String imageId, int sliceIndex) {
        return getRecord(imageId).read(state -> {
            checkSliceIndex(imageId, sliceIndex, state);
            return ImageAccessUtils.copyToArrayImg(state.volume.getSlice(sliceIndex), new DoubleType());
        });
    }

    /**
     * @return the current raw volume of the record; its samples are shared with the store and must not be modified,
     * use {@link #getRawSlice(String, int)} for a private copy
     */
    public Volume getVolume(String imageId) {
        return getRecord(imageId).read(state -> state.volume);
    }

    public WindowSettings getWindowSettings(String imageId) {
        return getRecord(imageId).read(state -> state.windowSettings);
    }

    public ImageInfo getImageInfo(String imageId) {
        return getRecord(imageId).read(state -> new ImageInfo()
                .setImageId(imageId)
                .setTotalSlices(state.getTotalSlices())
                .setRows(state.volume.getRows())
                .setCols(state.volume.getCols())
                .setWindowCenter(state.windowSettings.getCenter())
                .setWindowWidth(state.windowSettings.getWidth())
                .setDataMin(state.dataMin)
                .setDataMax(state.dataMax)
                .setVoxelSpacing(state.volume.getVoxelSpacing().toArray())
                .setSourceFormat(state.volume.getSourceFormat() != null ? state.volume.getSourceFormat().name() : null));
    }

    /**
     * Rotate every slice counter-clockwise and recompute the display slices with the current window.
     *
     * @param imageId
     * @param angle degrees, a multiple of 90
     */
    public void rotate(String imageId, int angle) {
        ImageTransforms.angleToQuarterTurns(angle);
        ImageRecord record = getRecord(imageId);
        long startTime = System.currentTimeMillis();
        record.update(state -> {
            Volume rotated = ImageTransforms.rotateVolume(state.volume, angle);
            NormalizedSlices normalizedSlices = WindowingAlgorithms.normalizeSlices(
                    rotated, state.windowSettings, windowingOptions, executorService);
            return new ImageRecord.State(rotated, state.windowSettings, normalizedSlices.getSlices(), state.dataMin, state.dataMax);
        });
        LOG.info("Rotated image {} by {} degrees in {}ms", imageId, angle, System.currentTimeMillis() - startTime);
    }

    /**
     * Replace the window and recompute the display slices from the unchanged volume.
     */
    public void updateWindowLevel(String imageId, double center, double width) {
        WindowSettings windowSettings = new WindowSettings(center, width);
        ImageRecord record = getRecord(imageId);
        long startTime = System.currentTimeMillis();
        record.update(state -> {
            NormalizedSlices normalizedSlices = WindowingAlgorithms.normalizeSlices(
                    state.volume, windowSettings, windowingOptions, executorService);
            return new ImageRecord.State(state.volume, windowSettings, normalizedSlices.getSlices(), state.dataMin, state.dataMax);
        });
        LOG.info("Updated window of image {} to {} in {}ms", imageId, windowSettings, System.currentTimeMillis() - startTime);
    }

    private ImageRecord getRecord(String imageId) {
        ImageRecord record = imageId == null ? null : records.getIfPresent(imageId);
        if (record == null) {
            throw new ImageNotFoundException(imageId);
        }
        return record;
    }

    private void checkSliceIndex(String imageId, int sliceIndex, ImageRecord.State state) {
        if (sliceIndex < 0 || sliceIndex >= state.getTotalSlices()) {
            throw new SliceIndexOutOfRangeException(imageId, sliceIndex, state.getTotalSlices());
        }
    }
}
