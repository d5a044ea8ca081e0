package au.org.ala.pixels.codec;

import java.io.IOException;

/**
 * The bytes offered for loading are not an image this codec can read. Raised before any pixel
 * buffer is created.
 */
public class UnsupportedFileTypeException extends IOException {

    private final String contentType;

    public UnsupportedFileTypeException(String filename, String contentType) {
        super("Unsupported file type " + contentType + (filename != null ? " for " + filename : ""));
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
