package org.janelia.identicon;

/**
 * Raised when a pipeline stage receives intermediate data that the previous stage could never have produced,
 * e.g. a hash shorter than the bytes it needs or a cell index outside the grid.
 */
public class InvalidIdenticonInputException extends IllegalArgumentException {

    public InvalidIdenticonInputException(String message) {
        super(message);
    }
}
