package au.org.ala.pixels.util;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Prefers readers from a given plugin vendor (TwelveMonkeys by default), falling back to the first
 * candidate. Readers that are passed over are disposed.
 */
public class DefaultImageReaderSelectionStrategy implements ImageReaderSelectionStrategy {

    public static final String TWELVEMONKEYS = "twelvemonkeys";

    public static final DefaultImageReaderSelectionStrategy INSTANCE = new DefaultImageReaderSelectionStrategy(TWELVEMONKEYS);

    private final String preferredPackage;

    public DefaultImageReaderSelectionStrategy(String preferredPackage) {
        this.preferredPackage = preferredPackage;
    }

    public ImageReader selectImageReader(Iterator<ImageReader> candidates) {

        if (candidates == null) {
            return null;
        }

        ImageReader first = null;
        ImageReader preferred = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (preferred == null && isPreferred(reader)) {
                preferred = reader;
            } else if (first == null) {
                first = reader;
            } else {
                reader.dispose();
            }
        }

        if (preferred != null) {
            if (first != null) {
                first.dispose();
            }
            return preferred;
        }
        return first;
    }

    private boolean isPreferred(ImageReader reader) {
        String name = reader.getClass().getCanonicalName();
        return preferredPackage != null && name != null && name.contains(preferredPackage);
    }

}
