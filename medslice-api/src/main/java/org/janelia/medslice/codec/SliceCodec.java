package org.janelia.medslice.codec;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import javax.imageio.ImageIO;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.medslice.dto.SliceStackMetadata;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VoxelSpacing;

/**
 * Wire encoding of slices. A raw slice is rows * cols float32 values in row-major little-endian order;
 * a raw volume is its slices concatenated in depth order. Dimensions travel separately,
 * see {@link SliceStackMetadata}.
 */
public class SliceCodec {

    private static final int FLOAT32_BYTES = 4;
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static <T extends RealType<T>> byte[] encodeSlice(RandomAccessibleInterval<T> slice, TransferFormat format) {
        if (slice.numDimensions() != 2) {
            throw new SliceEncodingException("Expected a 2D slice but got " + slice.numDimensions() + " dimensions");
        }
        switch (format) {
            case RAW_FLOAT32:
                return encodeRaw(slice);
            case PNG:
                return encodePNG(slice);
            default:
                throw new SliceEncodingException("Unsupported transfer format " + format);
        }
    }

    /**
     * @return the decoded slice with axis 0 along the columns and axis 1 along the rows
     */
    public static Img<FloatType> decodeSlice(byte[] content, int rows, int cols, TransferFormat format) {
        switch (format) {
            case RAW_FLOAT32:
                return decodeRaw(content, new long[] {cols, rows});
            case PNG:
                return decodePNG(content, rows, cols);
            default:
                throw new SliceEncodingException("Unsupported transfer format " + format);
        }
    }

    public static byte[] encodeVolume(Volume volume) {
        return encodeRaw(volume.getData());
    }

    /**
     * @param content raw float32 slices in depth order
     * @param shape (rows, cols) or (rows, cols, depth)
     */
    public static Volume decodeVolume(byte[] content, long[] shape, VoxelSpacing voxelSpacing, SourceFormat sourceFormat) {
        if (shape.length != 2 && shape.length != 3) {
            throw new SliceEncodingException("Invalid volume shape " + Arrays.toString(shape));
        }
        long[] dims = shape.length == 3
                ? new long[] {shape[1], shape[0], shape[2]}
                : new long[] {shape[1], shape[0]};
        float[] values = readFloats(content, dims);
        double[] samples = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            samples[i] = values[i];
        }
        return new Volume(ArrayImgs.doubles(samples, dims), voxelSpacing, sourceFormat);
    }

    public static SliceStackMetadata describe(Volume volume) {
        return new SliceStackMetadata()
                .setRows(volume.getRows())
                .setCols(volume.getCols())
                .setSlices(volume.getNumSlices())
                .setMinValue(volume.getMinValue())
                .setMaxValue(volume.getMaxValue())
                .setVoxelSpacing(volume.getVoxelSpacing().toArray());
    }

    public static String writeMetadata(SliceStackMetadata metadata) {
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new SliceEncodingException("Error writing " + metadata, e);
        }
    }

    public static SliceStackMetadata readMetadata(String json) {
        try {
            return MAPPER.readValue(json, SliceStackMetadata.class);
        } catch (JsonProcessingException e) {
            throw new SliceEncodingException("Invalid slice stack metadata", e);
        }
    }

    private static <T extends RealType<T>> byte[] encodeRaw(RandomAccessibleInterval<T> img) {
        long n = Views.flatIterable(img).size();
        if (n * FLOAT32_BYTES > Integer.MAX_VALUE) {
            throw new SliceEncodingException("Image too large for raw encoding: " + n + " samples");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) n * FLOAT32_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        Cursor<T> cursor = Views.flatIterable(img).cursor();
        while (cursor.hasNext()) {
            buffer.putFloat(cursor.next().getRealFloat());
        }
        return buffer.array();
    }

    private static Img<FloatType> decodeRaw(byte[] content, long[] dims) {
        return ArrayImgs.floats(readFloats(content, dims), dims);
    }

    private static float[] readFloats(byte[] content, long[] dims) {
        long n = 1;
        for (long d : dims) {
            if (d <= 0) {
                throw new SliceEncodingException("Invalid dimensions " + Arrays.toString(dims));
            }
            n *= d;
        }
        long expectedLength = n * FLOAT32_BYTES;
        if (content == null || content.length != expectedLength) {
            throw new SliceEncodingException("Expected " + expectedLength + " bytes for dimensions " + Arrays.toString(dims)
                    + " but got " + (content == null ? 0 : content.length));
        }
        float[] values = new float[(int) n];
        ByteBuffer.wrap(content).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(values);
        return values;
    }

    private static <T extends RealType<T>> byte[] encodePNG(RandomAccessibleInterval<T> slice) {
        int cols = (int) slice.dimension(0);
        int rows = (int) slice.dimension(1);
        BufferedImage image = new BufferedImage(cols, rows, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        Cursor<T> cursor = Views.flatIterable(Views.zeroMin(slice)).localizingCursor();
        while (cursor.hasNext()) {
            double v = cursor.next().getRealDouble();
            if (!(v >= 0 && v <= 255)) {
                throw new SliceEncodingException("Value " + v + " cannot be encoded as an 8-bit PNG pixel");
            }
            raster.setSample(cursor.getIntPosition(0), cursor.getIntPosition(1), 0, (int) v);
        }
        ByteArrayOutputStream pngStream = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", pngStream)) {
                throw new SliceEncodingException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new SliceEncodingException("Error encoding PNG", e);
        }
        return pngStream.toByteArray();
    }

    private static Img<FloatType> decodePNG(byte[] content, int rows, int cols) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new SliceEncodingException("Error decoding PNG", e);
        }
        if (image == null) {
            throw new SliceEncodingException("Content is not a PNG image");
        }
        if (image.getWidth() != cols || image.getHeight() != rows) {
            throw new SliceEncodingException("Expected a " + rows + "x" + cols + " PNG but got "
                    + image.getHeight() + "x" + image.getWidth());
        }
        Raster raster = image.getRaster();
        float[] values = new float[rows * cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                values[y * cols + x] = raster.getSample(x, y, 0);
            }
        }
        return ArrayImgs.floats(values, cols, rows);
    }
}
