package org.janelia.medslice.image;

import java.util.Arrays;

/**
 * Counter-clockwise rotation in the (x, y) plane by a number of quarter turns.
 * Any axis beyond the first two is carried over unchanged, so a 3D image is rotated slice by slice.
 */
public class QuarterTurnTransform implements GeomTransform {
    private final long[] sourceMax;
    private final int quarterTurns;

    /**
     * @param sourceShape shape of the image to rotate, x axis first
     * @param quarterTurns number of counter-clockwise quarter turns; negative values turn clockwise
     */
    public QuarterTurnTransform(long[] sourceShape, int quarterTurns) {
        if (sourceShape.length < 2) {
            throw new IllegalArgumentException("Rotation requires at least 2 dimensions");
        }
        this.sourceMax = ImageAccessUtils.getMax(sourceShape);
        this.quarterTurns = Math.floorMod(quarterTurns, 4);
    }

    public int getQuarterTurns() {
        return quarterTurns;
    }

    public boolean swapsAxes() {
        return quarterTurns % 2 == 1;
    }

    @Override
    public long[] getTargetShape() {
        long[] shape = new long[sourceMax.length];
        for (int d = 0; d < shape.length; d++) {
            shape[d] = sourceMax[d] + 1;
        }
        if (swapsAxes()) {
            shape[0] = sourceMax[1] + 1;
            shape[1] = sourceMax[0] + 1;
        }
        return shape;
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        System.arraycopy(currentPos, 0, originPos, 0, currentPos.length);
        long x = currentPos[0];
        long y = currentPos[1];
        switch (quarterTurns) {
            case 1:
                originPos[0] = sourceMax[0] - y;
                originPos[1] = x;
                break;
            case 2:
                originPos[0] = sourceMax[0] - x;
                originPos[1] = sourceMax[1] - y;
                break;
            case 3:
                originPos[0] = y;
                originPos[1] = sourceMax[1] - x;
                break;
            default:
                break;
        }
    }

    @Override
    public String toString() {
        return "QuarterTurnTransform{" +
                "sourceShape=" + Arrays.toString(Arrays.stream(sourceMax).map(m -> m + 1).toArray()) +
                ", quarterTurns=" + quarterTurns +
                '}';
    }
}
