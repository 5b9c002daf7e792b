package org.janelia.identicon.image.io;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.imageio.ImageIO;

import org.janelia.identicon.image.IdenticonImage;
import org.janelia.identicon.pipeline.IdenticonGenerator;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class IdenticonImageWriterTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void pngKeepsPixelValues() throws IOException {
        IdenticonImage image = new IdenticonGenerator().generate("identicon").getImage();
        ByteArrayOutputStream pngBytes = new ByteArrayOutputStream();

        IdenticonImageWriter.writePNG(image, pngBytes);

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(pngBytes.toByteArray()));
        assertEquals(250, decoded.getWidth());
        assertEquals(250, decoded.getHeight());
        int[] expected = image.toARGBArray();
        for (int y = 0; y < 250; y++) {
            for (int x = 0; x < 250; x++) {
                assertEquals((expected[y * 250 + x] & 0xffffff), (decoded.getRGB(x, y) & 0xffffff));
            }
        }
    }

    @Test
    public void pngEncodingIsReproducible() {
        IdenticonGenerator generator = new IdenticonGenerator();
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        IdenticonImageWriter.writePNG(generator.generate("reproducible").getImage(), first);
        IdenticonImageWriter.writePNG(generator.generate("reproducible").getImage(), second);
        assertArrayEquals(first.toByteArray(), second.toByteArray());
    }

    @Test
    public void writeFileInNewDirectory() throws IOException {
        IdenticonImage image = new IdenticonGenerator().generate("file").getImage();
        Path imagePath = testFolder.getRoot().toPath().resolve("nested").resolve(IdenticonImageWriter.defaultFileName("file"));

        Path written = IdenticonImageWriter.writePNGFile(image, imagePath);

        assertEquals(imagePath, written);
        assertTrue(Files.size(written) > 0);
        BufferedImage decoded = ImageIO.read(new File(written.toString()));
        assertEquals(250, decoded.getWidth());
    }

    @Test
    public void replaceExistingFileWithoutLeavingTemporaryFiles() throws IOException {
        IdenticonGenerator generator = new IdenticonGenerator();
        Path imagePath = testFolder.getRoot().toPath().resolve("replaced.png");
        Files.write(imagePath, new byte[] {1, 2, 3});

        IdenticonImageWriter.writePNGFile(generator.generate("replaced").getImage(), imagePath);

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        IdenticonImageWriter.writePNG(generator.generate("replaced").getImage(), expected);
        assertArrayEquals(expected.toByteArray(), Files.readAllBytes(imagePath));
        try (Stream<Path> dirContent = Files.list(testFolder.getRoot().toPath())) {
            assertEquals(Collections.singletonList(imagePath), dirContent.collect(Collectors.toList()));
        }
    }

    @Test
    public void defaultFileNames() {
        assertEquals("identicon.png", IdenticonImageWriter.defaultFileName("identicon"));
        assertEquals(".png", IdenticonImageWriter.defaultFileName(""));
        assertEquals("a_b_c.png", IdenticonImageWriter.defaultFileName("a/b\\c"));
    }
}
