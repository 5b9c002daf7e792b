package org.janelia.identicon.model;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.janelia.identicon.InvalidIdenticonInputException;

/**
 * One cell of the logical grid: a hash derived value and the cell's row-major position.
 */
public class GridCell {
    private final int value;
    private final int index;

    public GridCell(int value, int index) {
        if (value < 0 || value > 255) {
            throw new InvalidIdenticonInputException("Cell value " + value + " is not an unsigned byte");
        }
        if (index < 0) {
            throw new InvalidIdenticonInputException("Negative cell index: " + index);
        }
        this.value = value;
        this.index = index;
    }

    public int getValue() {
        return value;
    }

    public int getIndex() {
        return index;
    }

    public boolean hasEvenValue() {
        return value % 2 == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        GridCell gridCell = (GridCell) o;

        return new EqualsBuilder()
                .append(value, gridCell.value)
                .append(index, gridCell.index)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(value)
                .append(index)
                .toHashCode();
    }

    @Override
    public String toString() {
        return "(" + value + "," + index + ")";
    }
}
