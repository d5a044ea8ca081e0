package au.org.ala.pixels;

public class InvalidDimensionsException extends EditorException {

    private final int width;
    private final int height;

    public InvalidDimensionsException(int width, int height) {
        this(width, height, "Invalid dimensions " + width + "x" + height);
    }

    public InvalidDimensionsException(int width, int height, String message) {
        super(Reason.INVALID_DIMENSIONS, message);
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
