package org.janelia.identicon.model;

import java.util.Arrays;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.janelia.identicon.InvalidIdenticonInputException;

/**
 * The 16 unsigned bytes of the input digest, in digest order.
 */
public class HashBytes {
    public static final int LENGTH = 16;

    private final int[] values;

    public static HashBytes fromDigest(byte[] digest) {
        if (digest == null || digest.length != LENGTH) {
            throw new InvalidIdenticonInputException("Expected a " + LENGTH + " bytes digest but got "
                    + (digest == null ? "null" : digest.length + " bytes"));
        }
        int[] unsignedValues = new int[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            unsignedValues[i] = digest[i] & 0xff;
        }
        return new HashBytes(unsignedValues);
    }

    public static HashBytes fromValues(int... values) {
        if (values == null || values.length != LENGTH) {
            throw new InvalidIdenticonInputException("Expected " + LENGTH + " hash values but got "
                    + (values == null ? "null" : values.length + " values"));
        }
        for (int v : values) {
            if (v < 0 || v > 255) {
                throw new InvalidIdenticonInputException("Hash value " + v + " is not an unsigned byte");
            }
        }
        return new HashBytes(values.clone());
    }

    private HashBytes(int[] values) {
        this.values = values;
    }

    public int get(int i) {
        return values[i];
    }

    public int size() {
        return values.length;
    }

    public int[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        HashBytes that = (HashBytes) o;

        return new EqualsBuilder().append(values, that.values).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(values).toHashCode();
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
