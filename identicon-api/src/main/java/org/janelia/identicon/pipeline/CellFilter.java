package org.janelia.identicon.pipeline;

import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.GridCell;

public class CellFilter {

    /**
     * Drop the cells with an odd value. Surviving cells keep their order and their original index.
     */
    public CellGrid filterOddCells(CellGrid grid) {
        return grid.select(GridCell::hasEvenValue);
    }
}
