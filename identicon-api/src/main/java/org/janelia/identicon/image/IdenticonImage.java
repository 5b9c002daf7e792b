package org.janelia.identicon.image;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.identicon.model.PixelColor;

/**
 * RGB pixel buffer of a rendered identicon. The buffer is only written by the {@link Rasterizer} that creates it;
 * every accessor exposed here is read-only.
 */
public class IdenticonImage {

    private final Img<ARGBType> pixels;
    private final PixelColor background;

    IdenticonImage(Img<ARGBType> pixels, PixelColor background) {
        this.pixels = pixels;
        this.background = background;
    }

    public int getWidth() {
        return (int) pixels.dimension(0);
    }

    public int getHeight() {
        return (int) pixels.dimension(1);
    }

    public PixelColor getBackground() {
        return background;
    }

    public int getARGB(int x, int y) {
        RandomAccess<ARGBType> pixelAccess = pixels.randomAccess();
        return pixelAccess.setPositionAndGet(x, y).get();
    }

    public PixelColor getPixel(int x, int y) {
        return PixelColor.fromARGB(getARGB(x, y));
    }

    public boolean isBackground(int x, int y) {
        return getARGB(x, y) == background.toARGB();
    }

    /**
     * Copy the pixels in row-major order.
     *
     * @return packed ARGB values, width * height long
     */
    public int[] toARGBArray() {
        int width = getWidth();
        int[] argbValues = new int[width * getHeight()];
        Cursor<ARGBType> cursor = pixels.localizingCursor();
        while (cursor.hasNext()) {
            ARGBType p = cursor.next();
            argbValues[cursor.getIntPosition(1) * width + cursor.getIntPosition(0)] = p.get();
        }
        return argbValues;
    }

    /**
     * @return number of pixels that are not background
     */
    public long countForegroundPixels() {
        int backgroundValue = background.toARGB();
        long count = 0;
        for (ARGBType p : pixels) {
            if (p.get() != backgroundValue) {
                count++;
            }
        }
        return count;
    }
}
