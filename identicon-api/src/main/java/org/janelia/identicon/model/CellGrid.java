package org.janelia.identicon.model;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Ordered, immutable sequence of grid cells. A complete grid holds every cell of the layout,
 * a filtered grid holds a subset that keeps the original cell indices.
 */
public class CellGrid implements Iterable<GridCell> {
    private final List<GridCell> cells;

    public CellGrid(List<GridCell> cells) {
        this.cells = ImmutableList.copyOf(cells);
    }

    public List<GridCell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public GridCell get(int i) {
        return cells.get(i);
    }

    public Stream<GridCell> stream() {
        return cells.stream();
    }

    public CellGrid select(Predicate<GridCell> cellFilter) {
        return new CellGrid(cells.stream().filter(cellFilter).collect(Collectors.toList()));
    }

    public int[] getIndices() {
        return cells.stream().mapToInt(GridCell::getIndex).toArray();
    }

    @Override
    public Iterator<GridCell> iterator() {
        return cells.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        CellGrid that = (CellGrid) o;

        return new EqualsBuilder().append(cells, that.cells).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(cells).toHashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
