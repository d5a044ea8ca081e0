package au.org.ala.pixels.filter;

/**
 * Named looks. A preset sets brightness, contrast, saturation, blur and hue; rotation, opacity,
 * sharpening and the flips are left as they are.
 */
public enum Preset {
    NONE(100, 100, 100, 0, 0),
    GRAYSCALE(100, 100, 0, 0, 0),
    SEPIA(110, 90, 80, 0, 20),
    VINTAGE(95, 85, 70, 0.5, 10),
    COLD(105, 110, 120, 0, 200),
    WARM(110, 105, 130, 0, 30);

    private final double brightness;
    private final double contrast;
    private final double saturation;
    private final double blur;
    private final double hue;

    Preset(double brightness, double contrast, double saturation, double blur, double hue) {
        this.brightness = brightness;
        this.contrast = contrast;
        this.saturation = saturation;
        this.blur = blur;
        this.hue = hue;
    }

    public FilterState applyTo(FilterState state) {
        return state
                .with(FilterParameter.BRIGHTNESS, brightness)
                .with(FilterParameter.CONTRAST, contrast)
                .with(FilterParameter.SATURATION, saturation)
                .with(FilterParameter.BLUR, blur)
                .with(FilterParameter.HUE, hue);
    }

    public String canonical() { return name().toLowerCase(); }

    /**
     * Parse a preset name. Accepts case-insensitive names and "greyscale".
     */
    public static Preset parse(String s) {
        if (s == null) throw new IllegalArgumentException("Preset string is null");
        String in = s.trim().toLowerCase();
        switch (in) {
            case "none":
            case "":
                return NONE;
            case "grayscale":
            case "greyscale":
                return GRAYSCALE;
            case "sepia":
                return SEPIA;
            case "vintage":
                return VINTAGE;
            case "cold":
                return COLD;
            case "warm":
                return WARM;
            default:
                throw new IllegalArgumentException("Unknown preset: " + s);
        }
    }
}
