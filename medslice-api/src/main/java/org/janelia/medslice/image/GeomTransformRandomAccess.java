package org.janelia.medslice.image;

import net.imglib2.Interval;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.Type;

/**
 * The position is kept in target coordinates and mapped onto the source only when a value is read.
 * Positions that map outside the source read as the zero value of the pixel type.
 */
class GeomTransformRandomAccess<T extends Type<T>> extends Point implements RandomAccess<T> {

    private final RandomAccess<T> sourceAccess;
    private final Interval sourceInterval;
    private final GeomTransform geomTransform;
    private final long[] sourcePos;
    private final T zero;

    GeomTransformRandomAccess(RandomAccessibleInterval<T> source, GeomTransform geomTransform) {
        super(source.numDimensions());
        this.sourceAccess = source.randomAccess();
        this.sourceInterval = source;
        this.geomTransform = geomTransform;
        this.sourcePos = new long[source.numDimensions()];
        this.zero = sourceAccess.get().createVariable();
    }

    private GeomTransformRandomAccess(GeomTransformRandomAccess<T> c) {
        super(c);
        this.sourceAccess = c.sourceAccess.copy();
        this.sourceInterval = c.sourceInterval;
        this.geomTransform = c.geomTransform;
        this.sourcePos = new long[c.sourcePos.length];
        this.zero = c.zero.createVariable();
    }

    @Override
    public T get() {
        geomTransform.apply(position, sourcePos);
        if (CoordUtils.contains(sourceInterval, sourcePos)) {
            return sourceAccess.setPositionAndGet(sourcePos);
        } else {
            return zero;
        }
    }

    @Override
    public GeomTransformRandomAccess<T> copy() {
        return new GeomTransformRandomAccess<>(this);
    }
}
