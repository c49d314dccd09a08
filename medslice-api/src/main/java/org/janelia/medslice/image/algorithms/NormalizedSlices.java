package org.janelia.medslice.image.algorithms;

import java.util.Collections;
import java.util.List;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;

/**
 * The display bitmaps of every slice of a volume together with the window used to produce them.
 */
public class NormalizedSlices {

    private final List<Img<UnsignedByteType>> slices;
    private final WindowSettings windowSettings;
    private final double dataMin;
    private final double dataMax;

    public NormalizedSlices(List<Img<UnsignedByteType>> slices, WindowSettings windowSettings, double dataMin, double dataMax) {
        this.slices = Collections.unmodifiableList(slices);
        this.windowSettings = windowSettings;
        this.dataMin = dataMin;
        this.dataMax = dataMax;
    }

    public List<Img<UnsignedByteType>> getSlices() {
        return slices;
    }

    public int getNumSlices() {
        return slices.size();
    }

    public WindowSettings getWindowSettings() {
        return windowSettings;
    }

    /**
     * Min of the finite raw samples.
     */
    public double getDataMin() {
        return dataMin;
    }

    /**
     * Max of the finite raw samples.
     */
    public double getDataMax() {
        return dataMax;
    }
}
