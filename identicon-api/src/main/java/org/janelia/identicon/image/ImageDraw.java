package org.janelia.identicon.image;

import net.imglib2.RandomAccess;
import net.imglib2.type.Type;

public class ImageDraw {

    /**
     * Set every pixel in [x1, x2) x [y1, y2) to the given value. The caller is responsible for
     * keeping the rectangle inside the image.
     */
    public static <T extends Type<T>> void fillRect(RandomAccess<T> img,
                                                    int x1, int y1, int x2, int y2,
                                                    T value) {
        for (int y = y1; y < y2; y++) {
            for (int x = x1; x < x2; x++) {
                img.setPositionAndGet(x, y).set(value);
            }
        }
    }

    public static <T extends Type<T>> void fill(Iterable<T> img, T value) {
        for (T p : img) {
            p.set(value);
        }
    }
}
