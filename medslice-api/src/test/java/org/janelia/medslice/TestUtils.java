package org.janelia.medslice;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import javax.imageio.ImageIO;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VoxelSpacing;

public class TestUtils {

    /**
     * @param values indexed as [row][col]
     */
    public static Volume createVolume(double[][] values) {
        int rows = values.length;
        int cols = values[0].length;
        double[] samples = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values[r], 0, samples, r * cols, cols);
        }
        return new Volume(ArrayImgs.doubles(samples, cols, rows), VoxelSpacing.UNIT, SourceFormat.NIFTI);
    }

    /**
     * @param values indexed as [slice][row][col]
     */
    public static Volume createVolume(double[][][] values, VoxelSpacing voxelSpacing) {
        int depth = values.length;
        int rows = values[0].length;
        int cols = values[0][0].length;
        double[] samples = new double[depth * rows * cols];
        for (int z = 0; z < depth; z++) {
            for (int r = 0; r < rows; r++) {
                System.arraycopy(values[z][r], 0, samples, (z * rows + r) * cols, cols);
            }
        }
        return new Volume(ArrayImgs.doubles(samples, cols, rows, depth), voxelSpacing, SourceFormat.NIFTI);
    }

    /**
     * Volume with shape (rows, cols, depth) whose sample at (r, c, z) is 1 + r + 10 * c + 100 * z.
     */
    public static Volume createIndexedVolume(int rows, int cols, int depth) {
        double[][][] values = new double[depth][rows][cols];
        for (int z = 0; z < depth; z++) {
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    values[z][r][c] = 1 + r + 10 * c + 100 * z;
                }
            }
        }
        return createVolume(values, VoxelSpacing.UNIT);
    }

    public static <T extends RealType<T>> double valueAt(RandomAccessibleInterval<T> img, long... pos) {
        return img.getAt(pos).getRealDouble();
    }

    public static byte[] createPNG(BufferedImage image) {
        try {
            ByteArrayOutputStream pngStream = new ByteArrayOutputStream();
            ImageIO.write(image, "png", pngStream);
            return pngStream.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] gzip(byte[] content) {
        try {
            ByteArrayOutputStream gzipContent = new ByteArrayOutputStream();
            try (GZIPOutputStream gzipStream = new GZIPOutputStream(gzipContent)) {
                gzipStream.write(content);
            }
            return gzipContent.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Single file NIfTI-1 content with int16 samples.
     */
    public static byte[] createNiftiInt16(short[] dims, float[] pixdims, short[] samples, float sclSlope, float sclInter, ByteOrder byteOrder) {
        ByteBuffer buffer = createNiftiHeader(dims, pixdims, (short) 4, (short) 16, sclSlope, sclInter, samples.length * 2, byteOrder);
        for (short s : samples) {
            buffer.putShort(s);
        }
        return buffer.array();
    }

    /**
     * Single file NIfTI-1 content with float32 samples.
     */
    public static byte[] createNiftiFloat32(short[] dims, float[] pixdims, float[] samples, ByteOrder byteOrder) {
        ByteBuffer buffer = createNiftiHeader(dims, pixdims, (short) 16, (short) 32, 0, 0, samples.length * 4, byteOrder);
        for (float s : samples) {
            buffer.putFloat(s);
        }
        return buffer.array();
    }

    private static ByteBuffer createNiftiHeader(short[] dims, float[] pixdims, short datatype, short bitpix,
                                                float sclSlope, float sclInter, int dataBytes, ByteOrder byteOrder) {
        int voxOffset = 352;
        ByteBuffer buffer = ByteBuffer.allocate(voxOffset + dataBytes).order(byteOrder);
        buffer.putInt(0, 348);
        buffer.putShort(40, (short) dims.length);
        for (int d = 0; d < dims.length; d++) {
            buffer.putShort(42 + 2 * d, dims[d]);
        }
        buffer.putShort(70, datatype);
        buffer.putShort(72, bitpix);
        buffer.putFloat(76, 1f);
        for (int d = 0; d < pixdims.length; d++) {
            buffer.putFloat(80 + 4 * d, pixdims[d]);
        }
        buffer.putFloat(108, voxOffset);
        buffer.putFloat(112, sclSlope);
        buffer.putFloat(116, sclInter);
        byte[] magic = "n+1\0".getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < magic.length; i++) {
            buffer.put(344 + i, magic[i]);
        }
        buffer.position(voxOffset);
        return buffer;
    }

    /**
     * Minimal explicit VR little endian DICOM file with unsigned 16-bit samples.
     *
     * @param samples indexed as [row][col]
     */
    public static byte[] createDicom(int[][] samples, String pixelSpacing, String sliceThickness) {
        int rows = samples.length;
        int cols = samples[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(1024 + rows * cols * 2).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(128);
        buffer.put("DICM".getBytes(StandardCharsets.US_ASCII));
        putStringElement(buffer, 0x0002, 0x0010, "UI", "1.2.840.10008.1.2.1", (byte) 0);
        putStringElement(buffer, 0x0018, 0x0050, "DS", sliceThickness, (byte) ' ');
        putShortElement(buffer, 0x0028, 0x0002, 1);
        putStringElement(buffer, 0x0028, 0x0004, "CS", "MONOCHROME2", (byte) ' ');
        putShortElement(buffer, 0x0028, 0x0010, rows);
        putShortElement(buffer, 0x0028, 0x0011, cols);
        putStringElement(buffer, 0x0028, 0x0030, "DS", pixelSpacing, (byte) ' ');
        putShortElement(buffer, 0x0028, 0x0100, 16);
        putShortElement(buffer, 0x0028, 0x0101, 16);
        putShortElement(buffer, 0x0028, 0x0102, 15);
        putShortElement(buffer, 0x0028, 0x0103, 0);
        buffer.putShort((short) 0x7FE0);
        buffer.putShort((short) 0x0010);
        buffer.put("OW".getBytes(StandardCharsets.US_ASCII));
        buffer.putShort((short) 0);
        buffer.putInt(rows * cols * 2);
        for (int[] row : samples) {
            for (int v : row) {
                buffer.putShort((short) v);
            }
        }
        byte[] content = new byte[buffer.position()];
        System.arraycopy(buffer.array(), 0, content, 0, content.length);
        return content;
    }

    private static void putStringElement(ByteBuffer buffer, int group, int element, String vr, String value, byte padding) {
        byte[] valueBytes = value.getBytes(StandardCharsets.US_ASCII);
        int length = valueBytes.length + valueBytes.length % 2;
        buffer.putShort((short) group);
        buffer.putShort((short) element);
        buffer.put(vr.getBytes(StandardCharsets.US_ASCII));
        buffer.putShort((short) length);
        buffer.put(valueBytes);
        if (length > valueBytes.length) {
            buffer.put(padding);
        }
    }

    private static void putShortElement(ByteBuffer buffer, int group, int element, int value) {
        buffer.putShort((short) group);
        buffer.putShort((short) element);
        buffer.put("US".getBytes(StandardCharsets.US_ASCII));
        buffer.putShort((short) 2);
        buffer.putShort((short) value);
    }
}
