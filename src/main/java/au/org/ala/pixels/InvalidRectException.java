package au.org.ala.pixels;

import au.org.ala.pixels.crop.CropRect;

public class InvalidRectException extends EditorException {

    private final CropRect rect;

    public InvalidRectException(CropRect rect, String message) {
        super(Reason.INVALID_RECT, message);
        this.rect = rect;
    }

    public CropRect getRect() {
        return rect;
    }
}
