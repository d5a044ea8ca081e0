package au.org.ala.pixels.crop;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * What the crop tool looks like after an input message: whether it is active, which gesture is in
 * progress and where the pending rectangle is. Returned by every {@link CropController} method.
 */
public final class CropState {

    public enum Mode { IDLE, ACTIVE }

    public enum Gesture { NONE, DRAGGING, RESIZING }

    public static final CropState IDLE = new CropState(Mode.IDLE, Gesture.NONE, null, null);

    private final Mode mode;
    private final Gesture gesture;
    private final CropRect rect;
    private final CropHandle handle;

    CropState(Mode mode, Gesture gesture, CropRect rect, CropHandle handle) {
        this.mode = mode;
        this.gesture = gesture;
        this.rect = rect;
        this.handle = handle;
    }

    public Mode getMode() { return mode; }
    public Gesture getGesture() { return gesture; }

    /**
     * @return the pending rectangle, or null when idle
     */
    public CropRect getRect() { return rect; }

    /**
     * @return the handle being dragged, or null unless resizing
     */
    public CropHandle getHandle() { return handle; }

    public boolean isActive() { return mode == Mode.ACTIVE; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CropState)) return false;
        CropState that = (CropState) o;
        return mode == that.mode && gesture == that.gesture && handle == that.handle && Objects.equals(rect, that.rect);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, gesture, rect, handle);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("mode", mode)
                .add("gesture", gesture)
                .add("rect", rect)
                .add("handle", handle)
                .omitNullValues()
                .toString();
    }
}
