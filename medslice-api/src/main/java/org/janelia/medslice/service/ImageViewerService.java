package org.janelia.medslice.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import org.janelia.medslice.codec.SliceCodec;
import org.janelia.medslice.codec.TransferFormat;
import org.janelia.medslice.config.Config;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.algorithms.NormalizedSlices;
import org.janelia.medslice.image.algorithms.WindowingAlgorithms;
import org.janelia.medslice.image.algorithms.WindowingOptions;
import org.janelia.medslice.image.io.ImageReader;
import org.janelia.medslice.store.ImageStore;
import org.janelia.medslice.store.SliceBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads uploaded images into the store and serves their slices.
 * The asynchronous variants run on the worker pool so that decoding and windowing
 * do not hold up the calling thread.
 */
public class ImageViewerService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ImageViewerService.class);

    public static ImageViewerService fromConfig(Config config) {
        ExecutorService slicePool = WorkerPools.slicePoolFromConfig(config);
        return new ImageViewerService(
                ImageStore.fromConfig(config, slicePool),
                WindowingOptions.fromConfig(config),
                slicePool,
                WorkerPools.fromConfig(config),
                true);
    }

    private final ImageStore imageStore;
    private final WindowingOptions windowingOptions;
    private final ExecutorService slicePool;
    private final ExecutorService executorService;
    private final boolean ownsExecutors;

    /**
     * @param imageStore
     * @param windowingOptions
     * @param slicePool pool used to window the slices in parallel; may be null
     * @param executorService pool running the asynchronous operations
     */
    public ImageViewerService(ImageStore imageStore,
                              WindowingOptions windowingOptions,
                              @Nullable ExecutorService slicePool,
                              ExecutorService executorService) {
        this(imageStore, windowingOptions, slicePool, executorService, false);
    }

    private ImageViewerService(ImageStore imageStore,
                               WindowingOptions windowingOptions,
                               @Nullable ExecutorService slicePool,
                               ExecutorService executorService,
                               boolean ownsExecutors) {
        this.imageStore = imageStore;
        this.windowingOptions = windowingOptions;
        this.slicePool = slicePool;
        this.executorService = executorService;
        this.ownsExecutors = ownsExecutors;
    }

    public ImageStore getImageStore() {
        return imageStore;
    }

    public LoadedImage load(byte[] content, String fileName) {
        long startTime = System.currentTimeMillis();
        Volume volume;
        try {
            volume = ImageReader.decode(content, fileName);
        } catch (RuntimeException e) {
            LOG.error("Error loading {}", fileName, e);
            throw e;
        }
        NormalizedSlices normalizedSlices = WindowingAlgorithms.precomputeNormalizedSlices(volume, windowingOptions, slicePool);
        String imageId = imageStore.put(volume, normalizedSlices);
        LOG.info("Loaded {} as {} with {} slices in {}ms",
                fileName, imageId, normalizedSlices.getNumSlices(), System.currentTimeMillis() - startTime);
        return new LoadedImage(imageId, imageStore.getImageInfo(imageId));
    }

    public byte[] encodeSlice(String imageId, int sliceIndex, TransferFormat format) {
        switch (format) {
            case RAW_FLOAT32:
                return SliceCodec.encodeSlice(imageStore.getRawSlice(imageId, sliceIndex), format);
            case PNG:
                return SliceCodec.encodeSlice(imageStore.getSlice(imageId, sliceIndex).getBitmap(), format);
            default:
                throw new IllegalArgumentException("Unsupported transfer format " + format);
        }
    }

    public CompletableFuture<LoadedImage> loadAsync(byte[] content, String fileName) {
        return CompletableFuture.supplyAsync(() -> load(content, fileName), executorService);
    }

    public CompletableFuture<SliceBitmap> getSliceAsync(String imageId, int sliceIndex) {
        return CompletableFuture.supplyAsync(() -> imageStore.getSlice(imageId, sliceIndex), executorService);
    }

    public CompletableFuture<Void> rotateAsync(String imageId, int angle) {
        return CompletableFuture.runAsync(() -> imageStore.rotate(imageId, angle), executorService);
    }

    public CompletableFuture<Void> updateWindowLevelAsync(String imageId, double center, double width) {
        return CompletableFuture.runAsync(() -> imageStore.updateWindowLevel(imageId, center, width), executorService);
    }

    public CompletableFuture<byte[]> encodeSliceAsync(String imageId, int sliceIndex, TransferFormat format) {
        return CompletableFuture.supplyAsync(() -> encodeSlice(imageId, sliceIndex, format), executorService);
    }

    /**
     * Stops the worker pools created by {@link #fromConfig(Config)}. Pools passed to the public constructor
     * belong to the caller and are left running. Operations already submitted still complete.
     */
    public void terminate() {
        if (ownsExecutors) {
            LOG.info("Shutting down image viewer worker pools");
            executorService.shutdown();
            if (slicePool != null) {
                slicePool.shutdown();
            }
        }
    }

    @Override
    public void close() {
        terminate();
    }
}
