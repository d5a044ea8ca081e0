package au.org.ala.pixels.util;

import javax.imageio.ImageReader;
import java.util.Iterator;

public interface ImageReaderSelectionStrategy {

    default ImageReader selectImageReader(Iterable<ImageReader> candidates) {
        return selectImageReader(candidates.iterator());
    }
    ImageReader selectImageReader(Iterator<ImageReader> candidates);

}
