package org.janelia.identicon.pipeline;

import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.model.HashBytes;
import org.janelia.identicon.model.PixelColor;

/**
 * The first three hash bytes give the red, green and blue channels.
 */
public class ColorPicker {

    public PixelColor pickColor(HashBytes hashBytes) {
        return pickColor(hashBytes.toArray());
    }

    public PixelColor pickColor(int[] values) {
        if (values == null || values.length < 3) {
            throw new InvalidIdenticonInputException("At least 3 values are required to pick a color but got "
                    + (values == null ? "null" : values.length));
        }
        return new PixelColor(values[0], values[1], values[2]);
    }
}
