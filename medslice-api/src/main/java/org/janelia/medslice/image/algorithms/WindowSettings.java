package org.janelia.medslice.image.algorithms;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Window center and width. The width is never below {@link #MIN_WIDTH}.
 */
public class WindowSettings {

    public static final double MIN_WIDTH = 1.0;

    /**
     * Settings used when a volume has no finite samples.
     */
    public static final WindowSettings FALLBACK = new WindowSettings(128, 255);

    private final double center;
    private final double width;

    public WindowSettings(double center, double width) {
        if (!Double.isFinite(center) || !Double.isFinite(width)) {
            throw new IllegalArgumentException("Window center and width must be finite: center=" + center + ", width=" + width);
        }
        this.center = center;
        this.width = Math.max(width, MIN_WIDTH);
    }

    public double getCenter() {
        return center;
    }

    public double getWidth() {
        return width;
    }

    public double getLow() {
        return center - width / 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        WindowSettings that = (WindowSettings) o;

        return new EqualsBuilder()
                .append(center, that.center)
                .append(width, that.width)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(center)
                .append(width)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("center", center)
                .append("width", width)
                .toString();
    }
}
