package org.janelia.medslice.store;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.algorithms.WindowSettings;

/**
 * A stored image. The volume, the window and the display slices always change together:
 * a mutation builds a complete new {@link State} under the write lock and only then publishes it.
 */
class ImageRecord {

    static class State {
        final Volume volume;
        final WindowSettings windowSettings;
        final List<Img<UnsignedByteType>> normalizedSlices;
        final double dataMin;
        final double dataMax;

        State(Volume volume, WindowSettings windowSettings, List<Img<UnsignedByteType>> normalizedSlices, double dataMin, double dataMax) {
            if (normalizedSlices.size() != volume.getNumSlices()) {
                throw new IllegalArgumentException("Expected " + volume.getNumSlices() + " normalized slices but got " + normalizedSlices.size());
            }
            this.volume = volume;
            this.windowSettings = windowSettings;
            this.normalizedSlices = ImmutableList.copyOf(normalizedSlices);
            this.dataMin = dataMin;
            this.dataMax = dataMax;
        }

        int getTotalSlices() {
            return normalizedSlices.size();
        }
    }

    private final String imageId;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private State state;

    ImageRecord(String imageId, State state) {
        this.imageId = imageId;
        this.state = state;
    }

    String getImageId() {
        return imageId;
    }

    <R> R read(Function<State, R> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the state with the one computed from the current state. If the computation fails
     * the current state is kept.
     */
    void update(UnaryOperator<State> mutation) {
        lock.writeLock().lock();
        try {
            state = mutation.apply(state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("imageId", imageId)
                .toString();
    }
}
