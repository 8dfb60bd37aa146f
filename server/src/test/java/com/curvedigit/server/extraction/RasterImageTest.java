package com.curvedigit.server.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RasterImageTest {

    @TempDir
    Path tempDir;

    @Test
    public void testPixelsAreStoredAsBgr() {
        BufferedImage img = new BufferedImage(8, 6, BufferedImage.TYPE_INT_RGB);
        img.setRGB(3, 2, 0xFF8000);
        try (RasterImage image = RasterImage.fromBufferedImage(img)) {
            assertEquals(8, image.getWidth());
            assertEquals(6, image.getHeight());
            double[] px = image.getMat().get(2, 3);
            assertArrayEquals(new double[] { 0, 128, 255 }, px);
        }
    }

    @Test
    public void testReadAndDecodePng() throws IOException {
        Path file = tempDir.resolve("graph.png");
        ImageIO.write(SyntheticGraphs.framedPage(), "png", file.toFile());

        try (RasterImage fromFile = RasterImage.read(file);
             RasterImage fromBytes = RasterImage.decode(Files.readAllBytes(file))) {
            assertEquals(SyntheticGraphs.PAGE, fromFile.getWidth());
            assertEquals(SyntheticGraphs.PAGE, fromBytes.getHeight());
            assertArrayEquals(fromFile.getMat().get(100, 100), fromBytes.getMat().get(100, 100));
        }
    }

    @Test
    public void testGarbageIsRejected() throws IOException {
        byte[] text = "not an image".getBytes(StandardCharsets.UTF_8);
        assertThrows(IllegalArgumentException.class, () -> RasterImage.decode(text));
        assertThrows(IllegalArgumentException.class, () -> RasterImage.decode(new byte[0]));

        Path file = tempDir.resolve("notes.txt");
        Files.write(file, text);
        assertThrows(IOException.class, () -> RasterImage.read(file));
    }
}
