package org.janelia.identicon.pipeline;

import java.util.List;
import java.util.stream.Collectors;

import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.image.RectCoordsHelper;
import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.CellRect;
import org.janelia.identicon.model.GridCell;

/**
 * Maps grid cells to the canvas square they occupy.
 */
public class PixelMapper {

    private final RectCoordsHelper gridCoords = new RectCoordsHelper(IdenticonLayout.GRID_SIZE, IdenticonLayout.GRID_SIZE);

    public List<CellRect> buildPixelMap(CellGrid cells) {
        return cells.stream().map(this::cellToRect).collect(Collectors.toList());
    }

    public CellRect cellToRect(GridCell cell) {
        if (!gridCoords.containsIndex(cell.getIndex())) {
            throw new InvalidIdenticonInputException("Cell index " + cell.getIndex() + " is outside the "
                    + IdenticonLayout.GRID_SIZE + "x" + IdenticonLayout.GRID_SIZE + " grid");
        }
        long[] colRow = gridCoords.linearIndexToRectCoords(cell.getIndex());
        int horizontal = (int) colRow[0] * IdenticonLayout.CELL_SIZE;
        int vertical = (int) colRow[1] * IdenticonLayout.CELL_SIZE;
        return new CellRect(horizontal, vertical,
                horizontal + IdenticonLayout.CELL_SIZE, vertical + IdenticonLayout.CELL_SIZE);
    }
}
