package org.janelia.identicon.model;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Rectangle given by its top-left corner (inclusive) and bottom-right corner (exclusive).
 */
public class CellRect {
    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public CellRect(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public int getX1() {
        return x1;
    }

    public int getY1() {
        return y1;
    }

    public int getX2() {
        return x2;
    }

    public int getY2() {
        return y2;
    }

    public int getWidth() {
        return x2 - x1;
    }

    public int getHeight() {
        return y2 - y1;
    }

    public boolean contains(int x, int y) {
        return x >= x1 && x < x2 && y >= y1 && y < y2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        CellRect cellRect = (CellRect) o;

        return new EqualsBuilder()
                .append(x1, cellRect.x1)
                .append(y1, cellRect.y1)
                .append(x2, cellRect.x2)
                .append(y2, cellRect.y2)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(x1)
                .append(y1)
                .append(x2)
                .append(y2)
                .toHashCode();
    }

    @Override
    public String toString() {
        return "{(" + x1 + "," + y1 + "),(" + x2 + "," + y2 + ")}";
    }
}
