package au.org.ala.pixels.filter;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of every editor control: the eight continuous parameters of
 * {@link FilterParameter} plus the two flip toggles.
 */
public final class FilterState {

    private static final FilterState DEFAULTS = new FilterState(defaultValues(), false, false);

    private final double[] values;
    private final boolean flipHorizontal;
    private final boolean flipVertical;

    private FilterState(double[] values, boolean flipHorizontal, boolean flipVertical) {
        this.values = values;
        this.flipHorizontal = flipHorizontal;
        this.flipVertical = flipVertical;
    }

    public static FilterState defaults() {
        return DEFAULTS;
    }

    private static double[] defaultValues() {
        FilterParameter[] params = FilterParameter.values();
        double[] v = new double[params.length];
        for (FilterParameter p : params) {
            v[p.ordinal()] = p.getDefaultValue();
        }
        return v;
    }

    public double get(FilterParameter parameter) {
        return values[parameter.ordinal()];
    }

    /**
     * @throws IllegalArgumentException if the value is outside the parameter's range
     */
    public FilterState with(FilterParameter parameter, double value) {
        parameter.validate(value);
        if (values[parameter.ordinal()] == value) {
            return this;
        }
        double[] copy = values.clone();
        copy[parameter.ordinal()] = value;
        return new FilterState(copy, flipHorizontal, flipVertical);
    }

    public FilterState withFlips(boolean horizontal, boolean vertical) {
        return new FilterState(values, horizontal, vertical);
    }

    public FilterState toggleFlipHorizontal() {
        return withFlips(!flipHorizontal, flipVertical);
    }

    public FilterState toggleFlipVertical() {
        return withFlips(flipHorizontal, !flipVertical);
    }

    public boolean isDefault(FilterParameter parameter) {
        return get(parameter) == parameter.getDefaultValue();
    }

    public boolean isDefault() {
        return equals(DEFAULTS);
    }

    public boolean hasGeometry() {
        return flipHorizontal || flipVertical || get(FilterParameter.ROTATE) % 360.0 != 0.0;
    }

    public double getBrightness() { return get(FilterParameter.BRIGHTNESS); }
    public double getContrast() { return get(FilterParameter.CONTRAST); }
    public double getSaturation() { return get(FilterParameter.SATURATION); }
    public double getBlur() { return get(FilterParameter.BLUR); }
    public double getHue() { return get(FilterParameter.HUE); }
    public double getRotate() { return get(FilterParameter.ROTATE); }
    public double getOpacity() { return get(FilterParameter.OPACITY); }
    public double getSharpen() { return get(FilterParameter.SHARPEN); }
    public boolean isFlipHorizontal() { return flipHorizontal; }
    public boolean isFlipVertical() { return flipVertical; }

    public Map<FilterParameter, Double> asMap() {
        Map<FilterParameter, Double> map = new EnumMap<>(FilterParameter.class);
        for (FilterParameter p : FilterParameter.values()) {
            map.put(p, get(p));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterState)) return false;
        FilterState that = (FilterState) o;
        return flipHorizontal == that.flipHorizontal &&
                flipVertical == that.flipVertical &&
                Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + (flipHorizontal ? 2 : 0) + (flipVertical ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FilterState{");
        for (FilterParameter p : FilterParameter.values()) {
            sb.append(p.getKey()).append('=').append(get(p)).append(", ");
        }
        return sb.append("flipH=").append(flipHorizontal)
                .append(", flipV=").append(flipVertical)
                .append('}')
                .toString();
    }
}
