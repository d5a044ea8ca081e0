package au.org.ala.pixels.filter;

/**
 * The continuous editor controls, with their identity (default) value and accepted range.
 */
public enum FilterParameter {
    BRIGHTNESS("brightness", 100, 0, 200),
    CONTRAST("contrast", 100, 0, 200),
    SATURATION("saturation", 100, 0, 200),
    BLUR("blur", 0, 0, 20),
    HUE("hue", 0, 0, 360),
    ROTATE("rotate", 0, 0, 360),
    OPACITY("opacity", 100, 0, 100),
    SHARPEN("sharpen", 0, 0, 100);

    private final String key;
    private final double defaultValue;
    private final double min;
    private final double max;

    FilterParameter(String key, double defaultValue, double min, double max) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.min = min;
        this.max = max;
    }

    public String getKey() { return key; }
    public double getDefaultValue() { return defaultValue; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    /**
     * @throws IllegalArgumentException if the value is NaN or outside this parameter's range
     */
    public double validate(double value) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + " but was " + value);
        }
        return value;
    }

    /**
     * Parse a control name, case-insensitive.
     */
    public static FilterParameter parse(String s) {
        if (s == null) throw new IllegalArgumentException("Filter parameter is null");
        String in = s.trim().toLowerCase();
        for (FilterParameter p : values()) {
            if (p.key.equals(in)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown filter parameter: " + s);
    }
}
