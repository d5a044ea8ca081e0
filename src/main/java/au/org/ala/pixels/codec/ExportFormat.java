package au.org.ala.pixels.codec;

/**
 * Encodings offered on download.
 */
public enum ExportFormat {
    PNG("png", "image/png", true),
    JPG("jpg", "image/jpeg", false);

    private final String formatName;
    private final String mimeType;
    private final boolean supportsAlpha;

    ExportFormat(String formatName, String mimeType, boolean supportsAlpha) {
        this.formatName = formatName;
        this.mimeType = mimeType;
        this.supportsAlpha = supportsAlpha;
    }

    public String getFormatName() { return formatName; }
    public String getMimeType() { return mimeType; }
    public boolean supportsAlpha() { return supportsAlpha; }

    /**
     * File name extension, without the dot.
     */
    public String extension() { return formatName; }

    /**
     * Parse a format token. Accepts jpg/jpeg and png, case-insensitive.
     */
    public static ExportFormat parse(String s) {
        if (s == null) throw new IllegalArgumentException("Format string is null");
        String in = s.trim().toLowerCase();
        switch (in) {
            case "png":
                return PNG;
            case "jpg":
            case "jpeg":
                return JPG;
            default:
                throw new IllegalArgumentException("Unknown format: " + s);
        }
    }
}
