package org.janelia.identicon.pipeline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.janelia.identicon.InvalidIdenticonInputException;
import org.janelia.identicon.model.HashBytes;

/**
 * MD5 digest of the input. The digest only seeds the pattern and carries no security property.
 */
public class InputHasher {
    private static final String DIGEST_ALGORITHM = "MD5";

    public HashBytes hash(String input) {
        if (input == null) {
            throw new InvalidIdenticonInputException("Input string cannot be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HashBytes.fromDigest(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
