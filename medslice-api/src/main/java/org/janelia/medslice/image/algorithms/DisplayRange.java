package org.janelia.medslice.image.algorithms;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Output intensity range of the window transform, within [0, 255].
 */
public class DisplayRange {

    public static final DisplayRange DEFAULT = new DisplayRange(0, 255);

    private final int min;
    private final int max;

    public DisplayRange(int min, int max) {
        if (min < 0 || max > 255 || min >= max) {
            throw new IllegalArgumentException("Invalid display range [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public int getRange() {
        return max - min;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("min", min)
                .append("max", max)
                .toString();
    }
}
