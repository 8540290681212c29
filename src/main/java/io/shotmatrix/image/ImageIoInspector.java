package io.shotmatrix.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

/**
 * Uses the ImageIO reader registry and only touches the header.
 */
public final class ImageIoInspector implements ImageInspector {
    private static final Logger log = LoggerFactory.getLogger(ImageIoInspector.class);

    @Override
    public Optional<ImageDimensions> dimensions(Path image) {
        if (image == null || !Files.isRegularFile(image)) {
            return Optional.empty();
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(image.toFile())) {
            if (in == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                log.debug("No image reader for {}", image);
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new ImageDimensions(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.debug("Cannot read image header of {}: {}", image, e.getMessage());
            return Optional.empty();
        }
    }
}
