package io.shotmatrix.image;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads image dimensions without decoding pixels.
 */
public interface ImageInspector {
    Optional<ImageDimensions> dimensions(Path image);

    record ImageDimensions(int width, int height) {
        public boolean matches(int expectedWidth, int expectedHeight) {
            return width == expectedWidth && height == expectedHeight;
        }

        @Override
        public String toString() {
            return width + "x" + height;
        }
    }
}
