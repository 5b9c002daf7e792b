package org.janelia.identicon.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.GridCell;
import org.janelia.identicon.model.HashBytes;

/**
 * Builds the horizontally symmetric cell grid from the hash. Each row is one group of
 * {@link IdenticonLayout#GROUP_SIZE} consecutive hash bytes mirrored around its last byte;
 * bytes beyond {@link IdenticonLayout#USED_HASH_BYTES} are ignored.
 */
public class GridBuilder {

    public CellGrid buildGrid(HashBytes hashBytes) {
        return buildGrid(hashBytes.toArray());
    }

    public CellGrid buildGrid(int[] values) {
        if (values == null || values.length < IdenticonLayout.USED_HASH_BYTES) {
            throw new InvalidIdenticonInputException("At least " + IdenticonLayout.USED_HASH_BYTES
                    + " values are required to build the grid but got " + (values == null ? "null" : values.length));
        }
        List<GridCell> cells = new ArrayList<>(IdenticonLayout.CELL_COUNT);
        int[] group = new int[IdenticonLayout.GROUP_SIZE];
        for (int row = 0; row < IdenticonLayout.GRID_SIZE; row++) {
            System.arraycopy(values, row * IdenticonLayout.GROUP_SIZE, group, 0, IdenticonLayout.GROUP_SIZE);
            for (int v : mirrorRow(group)) {
                cells.add(new GridCell(v, cells.size()));
            }
        }
        return new CellGrid(cells);
    }

    /**
     * Reflect a row around its last element: [a, b, c] becomes [a, b, c, b, a].
     *
     * @param row at least 2 values
     * @return a palindrome of length 2 * row.length - 1
     */
    public static int[] mirrorRow(int[] row) {
        if (row == null || row.length < 2) {
            throw new InvalidIdenticonInputException("A row needs at least 2 values to be mirrored");
        }
        int[] mirrored = new int[2 * row.length - 1];
        System.arraycopy(row, 0, mirrored, 0, row.length);
        for (int i = 0; i < row.length - 1; i++) {
            mirrored[mirrored.length - 1 - i] = row[i];
        }
        return mirrored;
    }
}
