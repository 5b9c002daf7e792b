package org.janelia.identicon.pipeline;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.GridCell;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CellFilterTest {

    private final CellFilter cellFilter = new CellFilter();

    @Test
    public void keepEvenCellsWithOriginalIndices() {
        CellGrid grid = new CellGrid(Arrays.asList(
                new GridCell(1, 0),
                new GridCell(4, 1),
                new GridCell(7, 2),
                new GridCell(0, 3),
                new GridCell(254, 4),
                new GridCell(255, 5)
        ));
        CellGrid filtered = cellFilter.filterOddCells(grid);
        assertEquals(Arrays.asList(new GridCell(4, 1), new GridCell(0, 3), new GridCell(254, 4)), filtered.getCells());
    }

    @Test
    public void filterKnownGrid() {
        CellGrid grid = new GridBuilder().buildGrid(new InputHasher().hash("identicon"));
        CellGrid filtered = cellFilter.filterOddCells(grid);
        assertArrayEquals(new int[] {6, 8, 10, 14, 20, 21, 22, 23, 24}, filtered.getIndices());
    }

    @Test
    public void noEvenCellIsDropped() {
        CellGrid grid = new GridBuilder().buildGrid(new InputHasher().hash("no even cell is dropped"));
        CellGrid filtered = cellFilter.filterOddCells(grid);
        List<GridCell> expected = grid.stream().filter(c -> c.getValue() % 2 == 0).collect(Collectors.toList());
        assertEquals(expected, filtered.getCells());
        assertTrue(filtered.stream().allMatch(GridCell::hasEvenValue));
    }

    @Test
    public void allOddCellsGiveEmptyGrid() {
        CellGrid grid = new CellGrid(Arrays.asList(new GridCell(1, 0), new GridCell(3, 1), new GridCell(255, 2)));
        CellGrid filtered = cellFilter.filterOddCells(grid);
        assertTrue(filtered.isEmpty());
        assertTrue(cellFilter.filterOddCells(new CellGrid(Collections.emptyList())).isEmpty());
    }

    @Test
    public void inputGridIsNotModified() {
        CellGrid grid = new GridBuilder().buildGrid(new InputHasher().hash("identicon"));
        cellFilter.filterOddCells(grid);
        assertEquals(25, grid.size());
    }
}
