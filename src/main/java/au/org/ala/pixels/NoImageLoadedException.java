package au.org.ala.pixels;

public class NoImageLoadedException extends EditorException {

    public NoImageLoadedException(String operation) {
        super(Reason.NO_IMAGE_LOADED, "Cannot " + operation + ": no image loaded");
    }
}
