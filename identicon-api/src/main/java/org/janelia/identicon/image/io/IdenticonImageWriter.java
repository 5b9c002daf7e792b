package org.janelia.identicon.image.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import javax.imageio.ImageIO;

import ij.ImagePlus;
import ij.process.ColorProcessor;
import org.apache.commons.lang3.StringUtils;
import org.janelia.identicon.image.IdenticonImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IdenticonImageWriter {
    private static final Logger LOG = LoggerFactory.getLogger(IdenticonImageWriter.class);

    public static final String PNG_FORMAT = "png";
    public static final String PNG_EXTENSION = "." + PNG_FORMAT;

    /**
     * File name used for an input: the input itself with a ".png" extension. Path separators
     * are replaced so the file always lands directly in the target directory.
     */
    public static String defaultFileName(String input) {
        return StringUtils.replaceChars(StringUtils.defaultString(input), "/\\\0", "___") + PNG_EXTENSION;
    }

    public static ImagePlus toImagePlus(String title, IdenticonImage image) {
        ColorProcessor colorProcessor = new ColorProcessor(image.getWidth(), image.getHeight(), image.toARGBArray());
        return new ImagePlus(title, colorProcessor);
    }

    public static void writePNG(IdenticonImage image, OutputStream outputStream) {
        ImagePlus imagePlus = toImagePlus("identicon", image);
        try {
            if (!ImageIO.write(imagePlus.getProcessor().getBufferedImage(), PNG_FORMAT, outputStream)) {
                throw new IllegalStateException("No PNG encoder available");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * The image is encoded into a temporary file next to the target which is then moved into place,
     * so the target is either the previous content or the complete new image.
     */
    public static Path writePNGFile(IdenticonImage image, Path imagePath) {
        Path parentDir = imagePath.toAbsolutePath().getParent();
        Path tmpImagePath = null;
        try {
            Files.createDirectories(parentDir);
            tmpImagePath = Files.createTempFile(parentDir, ".identicon-", PNG_EXTENSION + ".tmp");
            try (OutputStream outputStream = Files.newOutputStream(tmpImagePath)) {
                writePNG(image, outputStream);
            }
            Files.move(tmpImagePath, imagePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            tmpImagePath = null;
            LOG.debug("Wrote {}", imagePath);
            return imagePath;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + imagePath, e);
        } finally {
            if (tmpImagePath != null) {
                deleteTmpFile(tmpImagePath);
            }
        }
    }

    private static void deleteTmpFile(Path tmpPath) {
        try {
            Files.deleteIfExists(tmpPath);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}", tmpPath, e);
        }
    }
}
