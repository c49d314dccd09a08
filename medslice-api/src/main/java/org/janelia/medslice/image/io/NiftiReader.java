package org.janelia.medslice.image.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.IOUtils;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads single file NIfTI-1 content, plain or gzip compressed, in either byte order.
 */
class NiftiReader {

    private static final Logger LOG = LoggerFactory.getLogger(NiftiReader.class);

    private static final int DT_UINT8 = 2;
    private static final int DT_INT16 = 4;
    private static final int DT_INT32 = 8;
    private static final int DT_FLOAT32 = 16;
    private static final int DT_FLOAT64 = 64;
    private static final int DT_INT8 = 256;
    private static final int DT_UINT16 = 512;
    private static final int DT_UINT32 = 768;
    private static final int DT_INT64 = 1024;

    static Volume read(byte[] content) {
        byte[] niftiContent = isGzipped(content) ? gunzip(content) : content;
        NiftiHeader header = NiftiHeader.parse(niftiContent);
        LOG.debug("Read NIfTI header {}", header);
        int bytesPerVoxel = bytesPerVoxel(header.datatype);
        int nvoxels = (int) VolumeShapes.sampleCount(header.dims);
        long dataEnd = header.voxOffset + (long) nvoxels * bytesPerVoxel;
        if (header.voxOffset < NiftiHeader.HEADER_SIZE || dataEnd > niftiContent.length) {
            throw new ImageFormatException("NIfTI content is truncated: expected " + dataEnd + " bytes but found " + niftiContent.length);
        }
        ByteBuffer dataBuffer = ByteBuffer.wrap(niftiContent, (int) header.voxOffset, nvoxels * bytesPerVoxel).order(header.byteOrder);
        double[] samples = new double[nvoxels];
        for (int i = 0; i < nvoxels; i++) {
            samples[i] = readVoxel(dataBuffer, header.datatype);
        }
        if (header.hasScaling()) {
            for (int i = 0; i < nvoxels; i++) {
                samples[i] = samples[i] * header.sclSlope + header.sclInter;
            }
        }
        // NIfTI arrays are indexed (i, j, k) with i running down the rows of a slice
        return VolumeShapes.createRowsFirstVolume(samples, header.dims, header.pixdims, SourceFormat.NIFTI);
    }

    static boolean isGzipped(byte[] content) {
        return content.length >= 2 && (content[0] & 0xff) == 0x1f && (content[1] & 0xff) == 0x8b;
    }

    private static byte[] gunzip(byte[] content) {
        try (InputStream gzipStream = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return IOUtils.toByteArray(gzipStream);
        } catch (IOException e) {
            throw new ImageFormatException("Error decompressing NIfTI content", e);
        }
    }

    private static int bytesPerVoxel(int datatype) {
        switch (datatype) {
            case DT_UINT8:
            case DT_INT8:
                return 1;
            case DT_INT16:
            case DT_UINT16:
                return 2;
            case DT_INT32:
            case DT_UINT32:
            case DT_FLOAT32:
                return 4;
            case DT_INT64:
            case DT_FLOAT64:
                return 8;
            default:
                throw new ImageFormatException("Unsupported NIfTI datatype: " + datatype);
        }
    }

    private static double readVoxel(ByteBuffer buffer, int datatype) {
        switch (datatype) {
            case DT_UINT8:
                return buffer.get() & 0xff;
            case DT_INT8:
                return buffer.get();
            case DT_INT16:
                return buffer.getShort();
            case DT_UINT16:
                return buffer.getShort() & 0xffff;
            case DT_INT32:
                return buffer.getInt();
            case DT_UINT32:
                return buffer.getInt() & 0xffffffffL;
            case DT_INT64:
                return buffer.getLong();
            case DT_FLOAT32:
                return buffer.getFloat();
            case DT_FLOAT64:
                return buffer.getDouble();
            default:
                throw new ImageFormatException("Unsupported NIfTI datatype: " + datatype);
        }
    }
}
