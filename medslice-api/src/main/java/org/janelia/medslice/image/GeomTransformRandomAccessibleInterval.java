package org.janelia.medslice.image;

import net.imglib2.AbstractInterval;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.Type;

/**
 * Lazy view of a source image through a {@link GeomTransform}. The view spans the transform's target shape,
 * which for odd quarter turns has the first two axes of the source swapped.
 */
class GeomTransformRandomAccessibleInterval<T extends Type<T>> extends AbstractInterval implements RandomAccessibleInterval<T> {

    private final RandomAccessibleInterval<T> source;
    private final GeomTransform geomTransform;

    GeomTransformRandomAccessibleInterval(RandomAccessibleInterval<T> source, GeomTransform geomTransform) {
        super(new FinalInterval(geomTransform.getTargetShape()));
        this.source = source;
        this.geomTransform = geomTransform;
    }

    @Override
    public RandomAccess<T> randomAccess() {
        return new GeomTransformRandomAccess<>(source, geomTransform);
    }

    @Override
    public RandomAccess<T> randomAccess(Interval interval) {
        // any target interval may map onto the whole source
        return randomAccess();
    }
}
