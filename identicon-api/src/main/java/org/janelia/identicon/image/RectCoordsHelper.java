package org.janelia.identicon.image;

import java.util.Arrays;

/**
 * Converts between a linear row-major index and rectangular coordinates for a given shape.
 * Axis 0 varies fastest, so for a 2D shape coordinates are returned as [column, row].
 */
public class RectCoordsHelper {

    private final long[] shape;
    private final long[] stride;
    private final long size;

    public RectCoordsHelper(long... shape) {
        assert shape.length > 0;
        this.shape = shape.clone();
        this.stride = new long[shape.length];
        long strideAccumulator = 1;
        for (int d = 0; d < stride.length; d++) {
            stride[d] = strideAccumulator;
            if (shape[d] <= 0) {
                throw new IllegalArgumentException("Invalid shape axis dimension: dimension for " + d + " axis is " + shape[d]);
            }
            strideAccumulator *= shape[d];
        }
        this.size = strideAccumulator;
    }

    public long[] linearIndexToRectCoords(long index) {
        long[] coords = new long[shape.length];
        unsafeLinearIndexToRectCoords(index, coords);
        return coords;
    }

    public void unsafeLinearIndexToRectCoords(long index, long[] coords) {
        assert coords.length == shape.length;
        long remainder = index;
        for (int i = coords.length - 1; i > 0; i--) {
            coords[i] = remainder / stride[i];
            remainder = remainder - coords[i] * stride[i];
        }
        coords[0] = remainder;
        assert coords[0] < shape[0];
    }

    public long rectCoordsToLinearIndex(long[] coords) {
        assert coords.length == shape.length;
        long index = 0;
        for (int i = 0; i < coords.length; i++) {
            index += coords[i] * stride[i];
        }
        return index;
    }

    public boolean containsIndex(long index) {
        return index >= 0 && index < size;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "RectCoordsHelper" + Arrays.toString(shape);
    }
}
