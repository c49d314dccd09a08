package org.janelia.medslice.image.io;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The fields of a NIfTI-1 header needed to decode the voxel data.
 */
class NiftiHeader {

    static final int HEADER_SIZE = 348;

    private static final int DIM_OFFSET = 40;
    private static final int DATATYPE_OFFSET = 70;
    private static final int BITPIX_OFFSET = 72;
    private static final int PIXDIM_OFFSET = 76;
    private static final int VOX_OFFSET_OFFSET = 108;
    private static final int SCL_SLOPE_OFFSET = 112;
    private static final int SCL_INTER_OFFSET = 116;
    private static final int MAGIC_OFFSET = 344;

    final ByteOrder byteOrder;
    final long[] dims;
    final double[] pixdims;
    final int datatype;
    final int bitpix;
    final long voxOffset;
    final double sclSlope;
    final double sclInter;

    private NiftiHeader(ByteOrder byteOrder, long[] dims, double[] pixdims, int datatype, int bitpix,
                        long voxOffset, double sclSlope, double sclInter) {
        this.byteOrder = byteOrder;
        this.dims = dims;
        this.pixdims = pixdims;
        this.datatype = datatype;
        this.bitpix = bitpix;
        this.voxOffset = voxOffset;
        this.sclSlope = sclSlope;
        this.sclInter = sclInter;
    }

    static NiftiHeader parse(byte[] content) {
        if (content.length < HEADER_SIZE) {
            throw new ImageFormatException("Content is too short for a NIfTI header: " + content.length + " bytes");
        }
        ByteBuffer hdr = ByteBuffer.wrap(content, 0, HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        if (hdr.getInt(0) != HEADER_SIZE) {
            hdr.order(ByteOrder.BIG_ENDIAN);
            if (hdr.getInt(0) != HEADER_SIZE) {
                throw new ImageFormatException("Not a NIfTI-1 header");
            }
        }
        String magic = new String(content, MAGIC_OFFSET, 3, StandardCharsets.US_ASCII);
        if (!"n+1".equals(magic)) {
            throw new ImageFormatException("Unsupported NIfTI magic '" + magic + "', only single file NIfTI-1 is supported");
        }
        int ndims = hdr.getShort(DIM_OFFSET);
        if (ndims < 1 || ndims > 7) {
            throw new ImageFormatException("Invalid number of NIfTI dimensions: " + ndims);
        }
        long[] dims = new long[ndims];
        double[] pixdims = new double[ndims];
        for (int d = 0; d < ndims; d++) {
            dims[d] = hdr.getShort(DIM_OFFSET + 2 * (d + 1));
            pixdims[d] = hdr.getFloat(PIXDIM_OFFSET + 4 * (d + 1));
        }
        return new NiftiHeader(
                hdr.order(),
                dims,
                pixdims,
                hdr.getShort(DATATYPE_OFFSET),
                hdr.getShort(BITPIX_OFFSET),
                (long) hdr.getFloat(VOX_OFFSET_OFFSET),
                hdr.getFloat(SCL_SLOPE_OFFSET),
                hdr.getFloat(SCL_INTER_OFFSET));
    }

    boolean hasScaling() {
        return sclSlope != 0 && Double.isFinite(sclSlope) && Double.isFinite(sclInter);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("byteOrder", byteOrder)
                .append("dims", Arrays.toString(dims))
                .append("pixdims", Arrays.toString(pixdims))
                .append("datatype", datatype)
                .append("bitpix", bitpix)
                .append("voxOffset", voxOffset)
                .append("sclSlope", sclSlope)
                .append("sclInter", sclInter)
                .toString();
    }
}
