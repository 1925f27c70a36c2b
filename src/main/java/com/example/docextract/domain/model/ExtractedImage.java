package com.example.docextract.domain.model;

/**
 * Embedded image payload together with its descriptive metadata.
 *
 * @param sequence 1-based position of the image in the document
 * @param location 1-based page or slide number
 * @param data     encoded image bytes
 * @param width    width in pixels, {@code 0} when unknown
 * @param height   height in pixels, {@code 0} when unknown
 * @param format   lower-case encoding name such as {@code png} or {@code jpeg}
 */
public record ExtractedImage(
        int sequence,
        int location,
        byte[] data,
        int width,
        int height,
        String format
) {

    public ExtractedImage {
        data = data == null ? new byte[0] : data;
        format = format == null || format.isBlank() ? "bin" : format;
    }

    public String resolution() {
        return width + "x" + height;
    }

    /**
     * File extension matching {@link #format()}.
     *
     * @return extension without the leading dot
     */
    public String fileExtension() {
        return "jpeg".equals(format) ? "jpg" : format;
    }
}
