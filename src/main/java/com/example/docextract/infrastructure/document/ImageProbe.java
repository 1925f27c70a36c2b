package com.example.docextract.infrastructure.document;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Reads the encoding and pixel size of an embedded image without decoding the whole raster.
 * Formats ImageIO does not understand (EMF, WMF, ...) keep the caller's fallback format and a 0x0 size.
 */
public final class ImageProbe {

    private ImageProbe() {
    }

    /**
     * @param format lower-case encoding name
     * @param width  width in pixels
     * @param height height in pixels
     */
    public record ImageInfo(String format, int width, int height) {
    }

    /**
     * Probes the image bytes.
     *
     * @param data           encoded image
     * @param fallbackFormat format reported by the document library, used when ImageIO has no reader
     * @return probed information
     * @throws IOException when a reader exists but the header is unreadable
     */
    public static ImageInfo probe(byte[] data, String fallbackFormat) throws IOException {
        String fallback = normalizeFormat(fallbackFormat);
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (input == null) {
                return new ImageInfo(fallback, 0, 0);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return new ImageInfo(fallback, 0, 0);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new ImageInfo(normalizeFormat(reader.getFormatName()), reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Maps library-specific names onto the short lower-case names used in output file names.
     *
     * @param format raw format or extension
     * @return normalized format, {@code bin} when unknown
     */
    public static String normalizeFormat(String format) {
        if (format == null || format.isBlank()) {
            return "bin";
        }
        String value = format.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith(".")) {
            value = value.substring(1);
        }
        return switch (value) {
            case "jpg", "jpe", "jfif" -> "jpeg";
            case "tif" -> "tiff";
            default -> value;
        };
    }
}
