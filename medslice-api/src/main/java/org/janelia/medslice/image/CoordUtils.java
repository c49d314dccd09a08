package org.janelia.medslice.image;

import net.imglib2.Interval;

public class CoordUtils {

    public static boolean contains(Interval interval, long[] pos) {
        for (int d = 0; d < pos.length; d++) {
            if (pos[d] < interval.min(d) || pos[d] > interval.max(d)) {
                return false;
            }
        }
        return true;
    }
}
