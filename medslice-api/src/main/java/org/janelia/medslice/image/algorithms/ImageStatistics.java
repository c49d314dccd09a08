package org.janelia.medslice.image.algorithms;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Summary of the finite samples of an image. All values are 0 when there is no finite sample.
 */
public class ImageStatistics {

    public static <T extends RealType<T>> ImageStatistics compute(RandomAccessibleInterval<T> img) {
        long count = 0;
        double mean = 0;
        double m2 = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        Cursor<T> cursor = Views.flatIterable(img).cursor();
        while (cursor.hasNext()) {
            double v = cursor.next().getRealDouble();
            if (!Double.isFinite(v)) continue;
            count++;
            double delta = v - mean;
            mean += delta / count;
            m2 += delta * (v - mean);
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (count == 0) {
            return new ImageStatistics(0, 0, 0, 0, 0);
        }
        return new ImageStatistics(count, mean, Math.sqrt(m2 / count), min, max);
    }

    private final long count;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;

    ImageStatistics(long count, double mean, double std, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
    }

    @JsonProperty
    public long getCount() {
        return count;
    }

    @JsonProperty
    public double getMean() {
        return mean;
    }

    /**
     * Population standard deviation.
     */
    @JsonProperty
    public double getStd() {
        return std;
    }

    @JsonProperty
    public double getMin() {
        return min;
    }

    @JsonProperty
    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("count", count)
                .append("mean", mean)
                .append("std", std)
                .append("min", min)
                .append("max", max)
                .toString();
    }
}
