package org.janelia.medslice.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static class FiniteRange {
        public final double min;
        public final double max;
        public final long count;

        FiniteRange(double min, double max, long count) {
            this.min = min;
            this.max = max;
            this.count = count;
        }
    }

    /**
     * @param shape
     * @return the inclusive max interval bound.
     */
    public static long[] getMax(long[] shape) {
        long[] m = new long[shape.length];
        for (int d = 0; d < shape.length; d++) {
            m[d] = shape[d] - 1;
        }
        return m;
    }

    /**
     * Min and max of the finite values. If there are no finite values both bounds are 0.
     */
    public static <T extends RealType<T>> FiniteRange computeFiniteRange(RandomAccessibleInterval<T> img) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        long count = 0;
        Cursor<T> imgCursor = Views.flatIterable(img).cursor();
        while (imgCursor.hasNext()) {
            double v = imgCursor.next().getRealDouble();
            if (Double.isFinite(v)) {
                if (v < min) min = v;
                if (v > max) max = v;
                count++;
            }
        }
        if (count == 0) {
            return new FiniteRange(0, 0, 0);
        } else {
            return new FiniteRange(min, max, count);
        }
    }

    /**
     * Collect the finite values in flat iteration order.
     */
    public static <T extends RealType<T>> double[] getFiniteValues(RandomAccessibleInterval<T> img) {
        IterableInterval<T> imgIterable = Views.flatIterable(img);
        double[] values = new double[(int) imgIterable.size()];
        int n = 0;
        for (T px : imgIterable) {
            double v = px.getRealDouble();
            if (Double.isFinite(v)) {
                values[n++] = v;
            }
        }
        return n == values.length ? values : Arrays.copyOf(values, n);
    }

    /**
     * Materialize the given view into a new array image.
     */
    public static <T extends NativeType<T>> Img<T> copyToArrayImg(RandomAccessibleInterval<T> img, T pxType) {
        Img<T> imgCopy = new ArrayImgFactory<>(pxType).create(img.dimensionsAsLongArray());
        copyInto(img, imgCopy);
        return imgCopy;
    }

    public static <T extends Type<T>> void copyInto(RandomAccessibleInterval<T> source, RandomAccessibleInterval<T> target) {
        Cursor<T> sourceCursor = Views.flatIterable(Views.zeroMin(source)).cursor();
        Cursor<T> targetCursor = Views.flatIterable(Views.zeroMin(target)).cursor();
        while (targetCursor.hasNext() && sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
    }
}
