package org.janelia.identicon.model;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.identicon.image.IdenticonImage;

/**
 * Result of generating an identicon for an input, including every intermediate value of the pipeline.
 */
public class Identicon {
    private final String input;
    private final HashBytes hash;
    private final PixelColor color;
    private final CellGrid grid;
    private final CellGrid paintedCells;
    private final List<CellRect> pixelMap;
    private final IdenticonImage image;

    public Identicon(String input,
                     HashBytes hash,
                     PixelColor color,
                     CellGrid grid,
                     CellGrid paintedCells,
                     List<CellRect> pixelMap,
                     IdenticonImage image) {
        this.input = input;
        this.hash = hash;
        this.color = color;
        this.grid = grid;
        this.paintedCells = paintedCells;
        this.pixelMap = ImmutableList.copyOf(pixelMap);
        this.image = image;
    }

    public String getInput() {
        return input;
    }

    public HashBytes getHash() {
        return hash;
    }

    public PixelColor getColor() {
        return color;
    }

    public CellGrid getGrid() {
        return grid;
    }

    public CellGrid getPaintedCells() {
        return paintedCells;
    }

    public List<CellRect> getPixelMap() {
        return pixelMap;
    }

    public IdenticonImage getImage() {
        return image;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("input", input)
                .append("hash", hash)
                .append("color", color)
                .append("paintedCells", paintedCells.size())
                .toString();
    }
}
