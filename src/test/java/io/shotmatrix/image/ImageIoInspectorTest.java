package io.shotmatrix.image;

import io.shotmatrix.ConfigFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

final class ImageIoInspectorTest {
    private final ImageIoInspector inspector = new ImageIoInspector();

    @Test
    void readsPngDimensions() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-image-");
        try {
            Path png = dir.resolve("home_en-US.png");
            Assertions.assertTrue(ImageIO.write(new BufferedImage(36, 78, BufferedImage.TYPE_INT_RGB), "png", png.toFile()));

            Optional<ImageInspector.ImageDimensions> dimensions = inspector.dimensions(png);

            Assertions.assertEquals(Optional.of(new ImageInspector.ImageDimensions(36, 78)), dimensions);
            Assertions.assertTrue(dimensions.get().matches(36, 78));
            Assertions.assertFalse(dimensions.get().matches(78, 36));
            Assertions.assertEquals("36x78", dimensions.get().toString());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void unreadableFilesHaveNoDimensions() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-image-bad-");
        try {
            Path text = dir.resolve("not-an-image.png");
            Files.writeString(text, "hello");

            Assertions.assertTrue(inspector.dimensions(text).isEmpty());
            Assertions.assertTrue(inspector.dimensions(dir.resolve("missing.png")).isEmpty());
            Assertions.assertTrue(inspector.dimensions(dir).isEmpty());
            Assertions.assertTrue(inspector.dimensions(null).isEmpty());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }
}
