package au.org.ala.pixels.crop;

import au.org.ala.pixels.InvalidRectException;

import java.util.Objects;

/**
 * A crop rectangle in image pixel coordinates.
 */
public final class CropRect {

    public static final int MIN_SIZE = 50;

    public final int x, y, width, height;

    private CropRect(int x, int y, int width, int height) {
        this.x = x; this.y = y; this.width = width; this.height = height;
    }

    public static CropRect of(int x, int y, int width, int height) {
        return new CropRect(x, y, width, height);
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public boolean contains(double px, double py) {
        return px >= x && px <= right() && py >= y && py <= bottom();
    }

    public CropRect withPosition(int newX, int newY) {
        return new CropRect(newX, newY, width, height);
    }

    /**
     * Check the rectangle fits a canvas of the given size and is at least {@code minSize} on each side.
     *
     * @throws InvalidRectException naming the first broken constraint
     */
    public CropRect validate(int canvasWidth, int canvasHeight, int minSize) {
        if (x < 0 || y < 0) {
            throw new InvalidRectException(this, "Crop origin must not be negative: " + this);
        }
        if (width < minSize || height < minSize) {
            throw new InvalidRectException(this, "Crop must be at least " + minSize + "x" + minSize + ": " + this);
        }
        if (right() > canvasWidth || bottom() > canvasHeight) {
            throw new InvalidRectException(this, "Crop exceeds " + canvasWidth + "x" + canvasHeight + " canvas: " + this);
        }
        return this;
    }

    public CropRect validate(int canvasWidth, int canvasHeight) {
        return validate(canvasWidth, canvasHeight, MIN_SIZE);
    }

    /**
     * Parse "x,y,w,h".
     */
    public static CropRect parse(String s) {
        if (s == null) throw new IllegalArgumentException("Crop string is null");
        String[] parts = s.trim().split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid crop string: " + s);
        }
        try {
            return of(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in crop string: " + s, e);
        }
    }

    public String canonical() {
        return x + "," + y + "," + width + "," + height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CropRect)) return false;
        CropRect that = (CropRect) o;
        return x == that.x && y == that.y && width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "CropRect{" +
                "x=" + x +
                ", y=" + y +
                ", width=" + width +
                ", height=" + height +
                '}';
    }
}
