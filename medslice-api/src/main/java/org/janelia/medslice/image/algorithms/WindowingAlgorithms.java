package org.janelia.medslice.image.algorithms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converter;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.medslice.image.ImageAccessUtils;
import org.janelia.medslice.image.ImageTransforms;
import org.janelia.medslice.image.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class WindowingAlgorithms {

    private static final Logger LOG = LoggerFactory.getLogger(WindowingAlgorithms.class);

    private static final double LOWER_PERCENTILE = 2;
    private static final double UPPER_PERCENTILE = 98;
    private static final double CENTRAL_REGION_START = 0.2;
    private static final double CENTRAL_REGION_END = 0.8;

    public static WindowSettings calculateOptimalWindowSettings(Volume volume) {
        return calculateOptimalWindowSettings(volume, WindowEstimation.ALL_FINITE);
    }

    /**
     * Estimate the window from the 2nd and 98th percentiles of the selected samples.
     * A volume without finite samples gets {@link WindowSettings#FALLBACK}.
     */
    public static WindowSettings calculateOptimalWindowSettings(Volume volume, WindowEstimation estimation) {
        double[] intensities = selectIntensities(volume.getData(), estimation);
        if (intensities.length == 0) {
            LOG.debug("No finite samples in {} - use fallback window {}", volume, WindowSettings.FALLBACK);
            return WindowSettings.FALLBACK;
        }
        Arrays.sort(intensities);
        double p2 = percentile(intensities, LOWER_PERCENTILE);
        double p98 = percentile(intensities, UPPER_PERCENTILE);
        return new WindowSettings((p98 + p2) / 2, Math.max(p98 - p2, WindowSettings.MIN_WIDTH));
    }

    private static double[] selectIntensities(RandomAccessibleInterval<DoubleType> data, WindowEstimation estimation) {
        double[] finiteValues = ImageAccessUtils.getFiniteValues(data);
        if (estimation != WindowEstimation.CENTRAL_FOREGROUND || finiteValues.length == 0) {
            return finiteValues;
        }
        double[] centralForeground = positiveValues(centralRegionValues(data));
        if (centralForeground.length > 0) {
            return centralForeground;
        }
        double[] foreground = positiveValues(finiteValues);
        return foreground.length > 0 ? foreground : finiteValues;
    }

    private static double[] centralRegionValues(RandomAccessibleInterval<DoubleType> data) {
        int ndims = data.numDimensions();
        long[] min = new long[ndims];
        long[] max = new long[ndims];
        for (int d = 0; d < ndims; d++) {
            long start = (long) (data.dimension(d) * CENTRAL_REGION_START);
            long end = (long) (data.dimension(d) * CENTRAL_REGION_END);
            if (end <= start) {
                return new double[0];
            }
            min[d] = data.min(d) + start;
            max[d] = data.min(d) + end - 1;
        }
        return ImageAccessUtils.getFiniteValues(Views.interval(data, min, max));
    }

    private static double[] positiveValues(double[] values) {
        return Arrays.stream(values).filter(v -> v > 0).toArray();
    }

    /**
     * Percentile with linear interpolation between the closest ranks.
     *
     * @param sortedValues non empty sorted array
     * @param p percentile in [0, 100]
     */
    static double percentile(double[] sortedValues, double p) {
        double pos = p / 100. * (sortedValues.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sortedValues.length - 1);
        double frac = pos - lo;
        return sortedValues[lo] + (sortedValues[hi] - sortedValues[lo]) * frac;
    }

    public static Img<UnsignedByteType> applyWindowLevel(RandomAccessibleInterval<DoubleType> slice,
                                                         WindowSettings windowSettings,
                                                         DisplayRange displayRange) {
        return applyWindowLevel(slice, windowSettings, WindowingOptions.DEFAULT, displayRange);
    }

    /**
     * Map raw samples to display intensities. Samples equal to 0 and NaNs are background and always map
     * to the display minimum. Any other sample is mapped linearly from the window to the display range,
     * clipped and truncated.
     */
    public static Img<UnsignedByteType> applyWindowLevel(RandomAccessibleInterval<DoubleType> slice,
                                                         WindowSettings windowSettings,
                                                         WindowingOptions options,
                                                         DisplayRange displayRange) {
        Converter<DoubleType, UnsignedByteType> windowLevelConverter = createWindowLevelConverter(windowSettings, options, displayRange);
        return ImageAccessUtils.copyToArrayImg(
                ImageTransforms.createPixelTransformation(slice, windowLevelConverter, new UnsignedByteType()),
                new UnsignedByteType());
    }

    private static Converter<DoubleType, UnsignedByteType> createWindowLevelConverter(WindowSettings windowSettings,
                                                                                      WindowingOptions options,
                                                                                      DisplayRange displayRange) {
        double low = windowSettings.getLow();
        double width = windowSettings.getWidth();
        int min = displayRange.getMin();
        int max = displayRange.getMax();
        boolean contrastBoost = options.isContrastBoost();
        double gamma = options.getContrastBoostGamma();
        return (s, t) -> {
            double v = s.getRealDouble();
            if (v == 0 || Double.isNaN(v)) {
                t.setInteger(min);
                return;
            }
            double scaled = min + (v - low) * (max - min) / width;
            if (scaled < min) {
                scaled = min;
            } else if (scaled > max) {
                scaled = max;
            }
            if (contrastBoost) {
                scaled = ContrastEnhancer.gammaBoost(scaled, displayRange, gamma);
            }
            t.setInteger((int) scaled);
        };
    }

    public static NormalizedSlices precomputeNormalizedSlices(Volume volume) {
        return precomputeNormalizedSlices(volume, WindowingOptions.DEFAULT, null);
    }

    /**
     * Estimate one window for the entire volume and apply it to every slice.
     *
     * @param volume
     * @param options
     * @param executorService if not null the slices are computed in parallel
     * @return slices in slice index order
     */
    public static NormalizedSlices precomputeNormalizedSlices(Volume volume, WindowingOptions options, @Nullable ExecutorService executorService) {
        long startTime = System.currentTimeMillis();
        WindowSettings windowSettings = calculateOptimalWindowSettings(volume, options.getEstimation());
        NormalizedSlices normalizedSlices = normalizeSlices(volume, windowSettings, options, executorService);
        LOG.debug("Normalized {} slices of {} using {} in {}ms",
                normalizedSlices.getNumSlices(), volume, windowSettings, System.currentTimeMillis() - startTime);
        return normalizedSlices;
    }

    /**
     * Apply the given window to every slice of the volume.
     */
    public static NormalizedSlices normalizeSlices(Volume volume,
                                                   WindowSettings windowSettings,
                                                   WindowingOptions options,
                                                   @Nullable ExecutorService executorService) {
        List<Img<UnsignedByteType>> slices;
        int nslices = volume.getNumSlices();
        if (executorService == null || nslices == 1) {
            slices = new ArrayList<>(nslices);
            for (int z = 0; z < nslices; z++) {
                slices.add(applyWindowLevel(volume.getSlice(z), windowSettings, options, options.getDisplayRange()));
            }
        } else {
            Scheduler scheduler = Schedulers.fromExecutorService(executorService);
            slices = Flux.range(0, nslices)
                    .flatMapSequential(sliceIndex -> Mono.fromCallable(
                            () -> applyWindowLevel(volume.getSlice(sliceIndex), windowSettings, options, options.getDisplayRange()))
                            .subscribeOn(scheduler))
                    .collectList()
                    .block();
        }
        return new NormalizedSlices(slices, windowSettings, volume.getMinValue(), volume.getMaxValue());
    }
}
