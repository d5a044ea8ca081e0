package au.org.ala.pixels.history;

import au.org.ala.pixels.filter.FilterState;
import au.org.ala.pixels.raster.PixelBuffer;
import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * An immutable record of one committed edit: a private copy of the source pixels and the filter
 * settings in force, which together reproduce the rendered image exactly.
 */
public final class HistorySnapshot {

    private final String label;
    private final PixelBuffer source;
    private final FilterState filters;

    public HistorySnapshot(String label, PixelBuffer source, FilterState filters) {
        this.label = Objects.requireNonNull(label, "label");
        this.source = Objects.requireNonNull(source, "source").copy();
        this.filters = Objects.requireNonNull(filters, "filters");
    }

    /**
     * @return the edit that produced this snapshot, e.g. "load" or "crop"
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return a fresh copy of the source pixels, owned by the caller
     */
    public PixelBuffer getSource() {
        return source.copy();
    }

    public FilterState getFilters() {
        return filters;
    }

    public int getWidth() {
        return source.getWidth();
    }

    public int getHeight() {
        return source.getHeight();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("label", label)
                .add("width", source.getWidth())
                .add("height", source.getHeight())
                .add("filters", filters)
                .toString();
    }
}
