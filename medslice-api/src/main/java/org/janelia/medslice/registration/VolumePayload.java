package org.janelia.medslice.registration;

import java.util.Arrays;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.medslice.codec.SliceCodec;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VoxelSpacing;

/**
 * A volume as exchanged with a registration collaborator: raw float32 samples plus shape and spacing.
 */
public class VolumePayload {

    public static VolumePayload fromVolume(Volume volume) {
        return new VolumePayload(SliceCodec.encodeVolume(volume), volume.getShape(), volume.getVoxelSpacing());
    }

    private final byte[] data;
    private final long[] shape;
    private final VoxelSpacing voxelSpacing;

    /**
     * @param data raw float32 slices in depth order
     * @param shape (rows, cols) or (rows, cols, depth)
     * @param voxelSpacing
     */
    public VolumePayload(byte[] data, long[] shape, VoxelSpacing voxelSpacing) {
        this.data = data;
        this.shape = shape;
        this.voxelSpacing = voxelSpacing;
    }

    public byte[] getData() {
        return data;
    }

    public long[] getShape() {
        return shape;
    }

    public VoxelSpacing getVoxelSpacing() {
        return voxelSpacing;
    }

    public Volume toVolume(SourceFormat sourceFormat) {
        return SliceCodec.decodeVolume(data, shape, voxelSpacing, sourceFormat);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("shape", Arrays.toString(shape))
                .append("voxelSpacing", voxelSpacing)
                .append("bytes", data == null ? 0 : data.length)
                .toString();
    }
}
