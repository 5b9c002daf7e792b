package org.janelia.identicon.image;

import java.util.List;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.model.CellRect;
import org.janelia.identicon.model.PixelColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paints cell rectangles with a single color onto a new square canvas.
 */
public class Rasterizer {

    private static final Logger LOG = LoggerFactory.getLogger(Rasterizer.class);

    private final int canvasSize;
    private final PixelColor background;

    public Rasterizer(int canvasSize, PixelColor background) {
        if (canvasSize <= 0) {
            throw new IllegalArgumentException("Invalid canvas size: " + canvasSize);
        }
        this.canvasSize = canvasSize;
        this.background = background;
    }

    /**
     * Rectangles are painted in list order so a later rectangle overwrites an earlier one where they overlap.
     *
     * @param color fill color used for every rectangle
     * @param rects rectangles to fill; each must lie within the canvas
     * @return a new image
     */
    public IdenticonImage draw(PixelColor color, List<CellRect> rects) {
        rects.forEach(this::checkBounds);

        Img<ARGBType> canvas = ArrayImgs.argbs(canvasSize, canvasSize);
        ImageDraw.fill(canvas, new ARGBType(background.toARGB()));

        ARGBType foreground = new ARGBType(color.toARGB());
        RandomAccess<ARGBType> canvasAccess = canvas.randomAccess();
        for (CellRect r : rects) {
            ImageDraw.fillRect(canvasAccess, r.getX1(), r.getY1(), r.getX2(), r.getY2(), foreground);
        }
        LOG.trace("Painted {} rectangles with {}", rects.size(), color);
        return new IdenticonImage(canvas, background);
    }

    private void checkBounds(CellRect r) {
        if (r.getX1() < 0 || r.getY1() < 0 || r.getX2() > canvasSize || r.getY2() > canvasSize
                || r.getX1() > r.getX2() || r.getY1() > r.getY2()) {
            throw new InvalidIdenticonInputException("Rectangle " + r + " is outside the "
                    + canvasSize + "x" + canvasSize + " canvas");
        }
    }
}
