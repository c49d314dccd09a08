package org.janelia.medslice.store;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

/**
 * 8-bit display bitmap of one slice. Axis 0 runs along the columns and axis 1 along the rows.
 */
public class SliceBitmap {

    private final Img<UnsignedByteType> bitmap;

    SliceBitmap(Img<UnsignedByteType> bitmap) {
        this.bitmap = bitmap;
    }

    public Img<UnsignedByteType> getBitmap() {
        return bitmap;
    }

    public int getRows() {
        return (int) bitmap.dimension(1);
    }

    public int getCols() {
        return (int) bitmap.dimension(0);
    }

    public int getValue(int row, int col) {
        return bitmap.getAt(col, row).get();
    }

    /**
     * @return the pixels in row-major order
     */
    public byte[] toByteArray() {
        byte[] pixels = new byte[getRows() * getCols()];
        Cursor<UnsignedByteType> cursor = Views.flatIterable(bitmap).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            pixels[i++] = (byte) cursor.next().get();
        }
        return pixels;
    }
}
