package org.janelia.medslice.image;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converter;
import net.imglib2.converter.Converters;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.real.DoubleType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageTransforms {

    private static final Logger LOG = LoggerFactory.getLogger(ImageTransforms.class);

    public static int angleToQuarterTurns(int angle) {
        if (angle % 90 != 0) {
            throw new IllegalArgumentException("Rotation angle must be a multiple of 90 degrees: " + angle);
        }
        return Math.floorMod(angle / 90, 4);
    }

    /**
     * Rotate a volume counter-clockwise in the (x, y) plane. Every slice of a 3D volume is rotated the same way
     * and the in-plane spacing is swapped when the rotation is an odd number of quarter turns.
     *
     * @param volume
     * @param angle rotation in degrees, must be a multiple of 90
     * @return a new volume
     */
    public static Volume rotateVolume(Volume volume, int angle) {
        int quarterTurns = angleToQuarterTurns(angle);
        if (quarterTurns == 0) {
            return volume;
        }
        long startTime = System.currentTimeMillis();
        QuarterTurnTransform transform = new QuarterTurnTransform(volume.getData().dimensionsAsLongArray(), quarterTurns);
        Img<DoubleType> rotated = ImageAccessUtils.copyToArrayImg(
                createGeomTransformation(volume.getData(), transform),
                new DoubleType());
        VoxelSpacing spacing = transform.swapsAxes()
                ? volume.getVoxelSpacing().swapWidthAndHeight()
                : volume.getVoxelSpacing();
        LOG.trace("Rotated {} by {} degrees in {}ms", volume, angle, System.currentTimeMillis() - startTime);
        return new Volume(rotated, spacing, volume.getSourceFormat());
    }

    public static <T extends NativeType<T>> RandomAccessibleInterval<T> rotateQuarterTurns(RandomAccessibleInterval<T> img, int quarterTurns) {
        return createGeomTransformation(img, new QuarterTurnTransform(img.dimensionsAsLongArray(), quarterTurns));
    }

    public static <T extends Type<T>> RandomAccessibleInterval<T> createGeomTransformation(RandomAccessibleInterval<T> img,
                                                                                         GeomTransform geomTransform) {
        return new GeomTransformRandomAccessibleInterval<>(img, geomTransform);
    }

    public static <S, T extends Type<T>> RandomAccessibleInterval<T> createPixelTransformation(RandomAccessibleInterval<S> img,
                                                                                             Converter<S, T> pixelConverter,
                                                                                             T targetType) {
        return Converters.convert(img, pixelConverter, targetType);
    }
}
