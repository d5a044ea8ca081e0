package au.org.ala.pixels.codec;

import au.org.ala.pixels.raster.PixelBuffer;
import au.org.ala.pixels.util.DefaultImageReaderSelectionStrategy;
import au.org.ala.pixels.util.ImageReaderSelectionStrategy;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.AutoDetectParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.Objects;

/**
 * Turns encoded image bytes into {@link PixelBuffer}s and back.
 * <p>
 * Decoding sniffs the content type first and refuses anything that is not an image before a
 * single pixel is read. The stored EXIF orientation is applied so the buffer is upright, the way a
 * browser would show it.
 */
public class ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    private final ImageReaderSelectionStrategy selectionStrategy;
    private final Detector detector;
    private final Color flattenBackground;

    public ImageCodec() {
        this(DefaultImageReaderSelectionStrategy.INSTANCE, Color.white);
    }

    /**
     * @param flattenBackground colour painted under translucent pixels when exporting to a format
     *                          without alpha
     */
    public ImageCodec(ImageReaderSelectionStrategy selectionStrategy, Color flattenBackground) {
        this.selectionStrategy = selectionStrategy;
        this.detector = new AutoDetectParser().getDetector();
        this.flattenBackground = flattenBackground;
    }

    public PixelBuffer decode(File file) throws IOException {
        return decode(Files.asByteSource(file), file.getName());
    }

    public PixelBuffer decode(byte[] bytes, String filename) throws IOException {
        return decode(ByteSource.wrap(bytes), filename);
    }

    /**
     * @param filename used as a hint for content type detection, may be null
     * @throws UnsupportedFileTypeException if the bytes are not an image or no installed reader can read them
     * @throws IOException if reading fails part way through
     */
    public PixelBuffer decode(ByteSource imageBytes, String filename) throws IOException {
        String contentType = detectContentType(imageBytes, filename);
        if (!StringUtils.startsWith(contentType, "image/")) {
            throw new UnsupportedFileTypeException(filename, contentType);
        }

        BufferedImage image;
        try (InputStream is = imageBytes.openBufferedStream();
             ImageInputStream iis = ImageIO.createImageInputStream(is)) {
            if (iis == null) {
                throw new IOException("No ImageInputStream could be created for " + filename);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            ImageReader reader = selectionStrategy.selectImageReader(readers);
            if (reader == null) {
                throw new UnsupportedFileTypeException(filename, contentType);
            }

            try {
                reader.setInput(iis, true, true);
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        }

        try {
            PixelBuffer decoded = PixelBuffer.fromBufferedImage(image);
            ExifOrientation orientation = readOrientation(imageBytes);
            log.debug("Decoded {} ({}) {}x{} orientation={}", filename, contentType, decoded.getWidth(), decoded.getHeight(), orientation);
            return orientation.apply(decoded);
        } finally {
            image.flush();
        }
    }

    /**
     * @return the detected MIME type, never null; {@code application/octet-stream} when unknown
     */
    public String detectContentType(ByteSource byteSource, String filename) throws IOException {
        try (InputStream bis = byteSource.openBufferedStream()) {
            Metadata md = new Metadata();
            if (filename != null) {
                md.add(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            }
            MediaType mediaType = detector.detect(bis, md);
            IOUtils.consume(bis);
            return mediaType.toString();
        }
    }

    ExifOrientation readOrientation(ByteSource byteSource) {
        com.drew.metadata.Metadata metadata;
        try (InputStream bis = byteSource.openBufferedStream()) {
            metadata = ImageMetadataReader.readMetadata(bis);
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata, assuming normal orientation: {}", e.getMessage());
            return ExifOrientation.Normal;
        }
        for (ExifIFD0Directory exif : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
            if (exif.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                try {
                    return ExifOrientation.fromExifOrientation(exif.getInt(ExifIFD0Directory.TAG_ORIENTATION));
                } catch (MetadataException e) {
                    log.debug("Error reading orientation tag", e);
                }
            }
        }
        return ExifOrientation.Normal;
    }

    /**
     * Encode the buffer. The output stream is not closed by this method.
     */
    public Result encode(PixelBuffer buffer, ExportFormat format, OutputStream out) throws IOException {
        Objects.requireNonNull(format, "format");
        BufferedImage image = buffer.toBufferedImage();
        BufferedImage encoded = image;
        try {
            if (!format.supportsAlpha()) {
                encoded = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
                Graphics2D g = encoded.createGraphics();
                try {
                    g.setColor(flattenBackground);
                    g.fillRect(0, 0, image.getWidth(), image.getHeight());
                    g.drawImage(image, 0, 0, null);
                } finally {
                    g.dispose();
                }
            }
            boolean ok = ImageIO.write(encoded, format.getFormatName(), out);
            if (!ok) {
                throw new IOException("No ImageIO writer for format: " + format.getFormatName());
            }
            return new Result(encoded.getWidth(), encoded.getHeight(), format.getMimeType());
        } finally {
            if (encoded != image) encoded.flush();
            image.flush();
        }
    }

    public byte[] encode(PixelBuffer buffer, ExportFormat format) throws IOException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            encode(buffer, format, out);
            return out.toByteArray();
        }
    }

    public static class Result {
        public final int width;
        public final int height;
        public final String mimeType;

        public Result(int width, int height, String mimeType) {
            this.width = width; this.height = height; this.mimeType = mimeType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Result)) return false;
            Result result = (Result) o;
            return width == result.width && height == result.height && Objects.equals(mimeType, result.mimeType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(width, height, mimeType);
        }

        @Override
        public String toString() {
            return "Result{" +
                    "width=" + width +
                    ", height=" + height +
                    ", mimeType='" + mimeType + '\'' +
                    '}';
        }
    }
}
