package org.janelia.identicon.model;

import net.imglib2.type.numeric.ARGBType;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.identicon.InvalidIdenticonInputException;

public class PixelColor {
    public static final PixelColor WHITE = new PixelColor(255, 255, 255);

    private final int red;
    private final int green;
    private final int blue;

    public static PixelColor fromARGB(int argb) {
        return new PixelColor(ARGBType.red(argb), ARGBType.green(argb), ARGBType.blue(argb));
    }

    public PixelColor(int red, int green, int blue) {
        this.red = checkChannel("red", red);
        this.green = checkChannel("green", green);
        this.blue = checkChannel("blue", blue);
    }

    private static int checkChannel(String channel, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidIdenticonInputException("Invalid " + channel + " value: " + value);
        }
        return value;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    /**
     * @return the color packed as an opaque ARGB int
     */
    public int toARGB() {
        return ARGBType.rgba(red, green, blue, 0xff);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        PixelColor that = (PixelColor) o;

        return new EqualsBuilder()
                .append(red, that.red)
                .append(green, that.green)
                .append(blue, that.blue)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(red)
                .append(green)
                .append(blue)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("r", red)
                .append("g", green)
                .append("b", blue)
                .toString();
    }
}
