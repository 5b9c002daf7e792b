package org.janelia.identicon.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.model.CellGrid;
import org.janelia.identicon.model.GridCell;
import org.janelia.identicon.model.HashBytes;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class GridBuilderTest {

    private final GridBuilder gridBuilder = new GridBuilder();

    @Test
    public void mirrorRow() {
        assertArrayEquals(new int[] {1, 2, 3, 2, 1}, GridBuilder.mirrorRow(new int[] {1, 2, 3}));
        assertArrayEquals(new int[] {7, 9, 7}, GridBuilder.mirrorRow(new int[] {7, 9}));
        assertArrayEquals(new int[] {0, 0, 0, 0, 0}, GridBuilder.mirrorRow(new int[] {0, 0, 0}));
    }

    @Test(expected = InvalidIdenticonInputException.class)
    public void mirrorRowNeedsTwoValues() {
        GridBuilder.mirrorRow(new int[] {5});
    }

    @Test
    public void buildKnownGrid() {
        HashBytes hash = HashBytes.fromValues(173, 43, 65, 97, 60, 135, 2, 181, 55, 43, 189, 201, 168, 16, 112, 64);
        int[] expectedValues = new int[] {
                173, 43, 65, 43, 173,
                97, 60, 135, 60, 97,
                2, 181, 55, 181, 2,
                43, 189, 201, 189, 43,
                168, 16, 112, 16, 168
        };
        List<GridCell> expectedCells = IntStream.range(0, expectedValues.length)
                .mapToObj(i -> new GridCell(expectedValues[i], i))
                .collect(Collectors.toList());

        CellGrid grid = gridBuilder.buildGrid(hash);

        assertEquals(expectedCells, grid.getCells());
    }

    @Test
    public void gridRowsArePalindromes() {
        InputHasher hasher = new InputHasher();
        for (String input : Arrays.asList("", "identicon", "palindrome", "0123456789")) {
            CellGrid grid = gridBuilder.buildGrid(hasher.hash(input));
            for (int row = 0; row < IdenticonLayout.GRID_SIZE; row++) {
                for (int col = 0; col < IdenticonLayout.GRID_SIZE; col++) {
                    int mirroredCol = IdenticonLayout.GRID_SIZE - 1 - col;
                    assertEquals(input,
                            grid.get(row * IdenticonLayout.GRID_SIZE + col).getValue(),
                            grid.get(row * IdenticonLayout.GRID_SIZE + mirroredCol).getValue());
                }
            }
        }
    }

    @Test
    public void gridAlwaysHasAllIndicesInOrder() {
        InputHasher hasher = new InputHasher();
        int[] expectedIndices = IntStream.range(0, 25).toArray();
        for (String input : Arrays.asList("", " ", "x", "identicon", "another input")) {
            CellGrid grid = gridBuilder.buildGrid(hasher.hash(input));
            assertEquals(25, grid.size());
            assertArrayEquals(expectedIndices, grid.getIndices());
        }
    }

    @Test
    public void lastHashByteIsIgnored() {
        int[] values = new int[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16};
        int[] otherLastValue = values.clone();
        otherLastValue[15] = 200;
        assertEquals(gridBuilder.buildGrid(values), gridBuilder.buildGrid(otherLastValue));
    }

    @Test(expected = InvalidIdenticonInputException.class)
    public void tooFewValues() {
        gridBuilder.buildGrid(new int[14]);
    }
}
