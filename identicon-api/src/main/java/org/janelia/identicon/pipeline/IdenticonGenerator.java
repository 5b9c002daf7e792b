package org.janelia.identicon.pipeline;

import java.util.List;

import org.janelia.identicon.image.IdenticonImage;
import org.janelia.identicon.image.Rasterizer;
import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.CellRect;
import org.janelia.identicon.model.HashBytes;
import org.janelia.identicon.model.Identicon;
import org.janelia.identicon.model.PixelColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for one input: hash, color, grid, filter, pixel map and rasterization.
 * Instances hold no mutable state and can be shared between threads.
 */
public class IdenticonGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(IdenticonGenerator.class);

    private final InputHasher hasher;
    private final ColorPicker colorPicker;
    private final GridBuilder gridBuilder;
    private final CellFilter cellFilter;
    private final PixelMapper pixelMapper;
    private final Rasterizer rasterizer;

    public IdenticonGenerator() {
        this(new InputHasher(),
                new ColorPicker(),
                new GridBuilder(),
                new CellFilter(),
                new PixelMapper(),
                new Rasterizer(IdenticonLayout.CANVAS_SIZE, PixelColor.WHITE));
    }

    public IdenticonGenerator(InputHasher hasher,
                              ColorPicker colorPicker,
                              GridBuilder gridBuilder,
                              CellFilter cellFilter,
                              PixelMapper pixelMapper,
                              Rasterizer rasterizer) {
        this.hasher = hasher;
        this.colorPicker = colorPicker;
        this.gridBuilder = gridBuilder;
        this.cellFilter = cellFilter;
        this.pixelMapper = pixelMapper;
        this.rasterizer = rasterizer;
    }

    public Identicon generate(String input) {
        HashBytes hash = hasher.hash(input);
        PixelColor color = colorPicker.pickColor(hash);
        CellGrid grid = gridBuilder.buildGrid(hash);
        CellGrid paintedCells = cellFilter.filterOddCells(grid);
        List<CellRect> pixelMap = pixelMapper.buildPixelMap(paintedCells);
        IdenticonImage image = rasterizer.draw(color, pixelMap);
        LOG.debug("Generated identicon for '{}': hash {}, color {}, {} painted cells",
                input, hash, color, paintedCells.size());
        return new Identicon(input, hash, color, grid, paintedCells, pixelMap, image);
    }
}
