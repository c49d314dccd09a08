package org.janelia.medslice.registration;

import net.imglib2.Cursor;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;

/**
 * Registration that assumes both volumes share the same physical origin and orientation:
 * the moving volume is resampled onto the fixed grid with linear interpolation. Positions outside
 * the moving volume read as 0.
 */
public class SpacingResampler implements RegistrationCollaborator {

    @Override
    public VolumePayload register(RegistrationRequest request) {
        Volume fixed = request.getFixed().toVolume(SourceFormat.NIFTI);
        Volume moving = request.getMoving().toVolume(SourceFormat.NIFTI);
        return VolumePayload.fromVolume(resample(moving, fixed));
    }

    public Volume resample(Volume moving, Volume fixed) {
        if (moving.numDimensions() != fixed.numDimensions()) {
            throw new IllegalArgumentException("Cannot resample a " + moving.numDimensions() + "D volume onto a "
                    + fixed.numDimensions() + "D grid");
        }
        int ndims = fixed.numDimensions();
        double[] fixedSpacing = fixed.getVoxelSpacing().toArray();
        double[] movingSpacing = moving.getVoxelSpacing().toArray();
        Img<DoubleType> resampled = ArrayImgs.doubles(fixed.getData().dimensionsAsLongArray());
        RealRandomAccess<DoubleType> movingAccess = Views.interpolate(
                Views.extendZero(moving.getData()), new NLinearInterpolatorFactory<DoubleType>()).realRandomAccess();
        double[] movingPos = new double[ndims];
        Cursor<DoubleType> cursor = resampled.localizingCursor();
        while (cursor.hasNext()) {
            DoubleType px = cursor.next();
            for (int d = 0; d < ndims; d++) {
                movingPos[d] = cursor.getDoublePosition(d) * fixedSpacing[d] / movingSpacing[d];
            }
            movingAccess.setPosition(movingPos);
            px.set(movingAccess.get().get());
        }
        return new Volume(resampled, fixed.getVoxelSpacing(), fixed.getSourceFormat());
    }

}
