package au.org.ala.pixels.crop;

import au.org.ala.pixels.InvalidDimensionsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State machine behind the interactive crop tool.
 * <p>
 * {@code IDLE -> ACTIVE} on {@link #start(int, int)}, back to {@code IDLE} on {@link #cancel()} or
 * {@link #commit()}. While active, pointer messages either drag the rectangle by its body or move
 * the edges named by one of the eight {@link CropHandle}s. Only one gesture runs at a time and
 * {@link #pointerUp()} always ends it.
 * <p>
 * The rectangle always lies inside the canvas and is never smaller than the minimum size. Pointer
 * positions that would break that are clamped, never rejected. Coordinates are image pixels; any
 * mapping from screen space happens before they get here.
 */
public class CropController {

    private static final Logger log = LoggerFactory.getLogger(CropController.class);

    public static final double DEFAULT_INSET = 0.1;

    private final int minSize;
    private final double inset;

    private CropState.Mode mode = CropState.Mode.IDLE;
    private CropState.Gesture gesture = CropState.Gesture.NONE;
    private CropRect rect;
    private CropHandle handle;
    private int canvasWidth;
    private int canvasHeight;

    // drag: pointer offset inside the rect; resize: previous pointer position
    private double anchorX;
    private double anchorY;

    public CropController() {
        this(CropRect.MIN_SIZE, DEFAULT_INSET);
    }

    public CropController(int minSize, double inset) {
        if (minSize < 1) {
            throw new IllegalArgumentException("Minimum crop size must be positive: " + minSize);
        }
        if (inset < 0 || inset >= 0.5) {
            throw new IllegalArgumentException("Crop inset must be in [0, 0.5): " + inset);
        }
        this.minSize = minSize;
        this.inset = inset;
    }

    /**
     * Enter crop mode with the rectangle inset from each canvas edge. Calling it again while active
     * starts over with a fresh rectangle.
     *
     * @throws InvalidDimensionsException if the canvas is smaller than the minimum crop size
     */
    public CropState start(int canvasWidth, int canvasHeight) {
        if (canvasWidth < minSize || canvasHeight < minSize) {
            throw new InvalidDimensionsException(canvasWidth, canvasHeight,
                    "Image " + canvasWidth + "x" + canvasHeight + " is smaller than the " + minSize + "px minimum crop");
        }
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;

        int w = Math.max(minSize, (int) Math.round(canvasWidth * (1 - 2 * inset)));
        int h = Math.max(minSize, (int) Math.round(canvasHeight * (1 - 2 * inset)));
        int x = Math.min((int) Math.round(canvasWidth * inset), canvasWidth - w);
        int y = Math.min((int) Math.round(canvasHeight * inset), canvasHeight - h);

        mode = CropState.Mode.ACTIVE;
        rect = CropRect.of(x, y, w, h);
        endGesture();
        log.debug("Crop mode started with {}", rect);
        return state();
    }

    /**
     * Begin a gesture. With a handle this starts a resize; without one, a press inside the
     * rectangle starts a drag and a press outside it does nothing. Ignored while idle or while
     * another gesture is in progress.
     */
    public CropState pointerDown(double x, double y, CropHandle handle) {
        if (mode != CropState.Mode.ACTIVE || gesture != CropState.Gesture.NONE) {
            return state();
        }
        if (handle != null) {
            gesture = CropState.Gesture.RESIZING;
            this.handle = handle;
            anchorX = x;
            anchorY = y;
        } else if (rect.contains(x, y)) {
            gesture = CropState.Gesture.DRAGGING;
            anchorX = x - rect.x;
            anchorY = y - rect.y;
        }
        return state();
    }

    public CropState pointerDown(double x, double y) {
        return pointerDown(x, y, null);
    }

    public CropState pointerMove(double x, double y) {
        if (gesture == CropState.Gesture.DRAGGING) {
            int nx = clamp((int) Math.round(x - anchorX), 0, canvasWidth - rect.width);
            int ny = clamp((int) Math.round(y - anchorY), 0, canvasHeight - rect.height);
            rect = rect.withPosition(nx, ny);
        } else if (gesture == CropState.Gesture.RESIZING) {
            // incremental: the delta is taken from the previous move, not from where the press began
            int dx = (int) Math.round(x) - (int) Math.round(anchorX);
            int dy = (int) Math.round(y) - (int) Math.round(anchorY);
            resize(dx, dy);
            anchorX = x;
            anchorY = y;
        }
        return state();
    }

    private void resize(int dx, int dy) {
        int left = rect.x;
        int top = rect.y;
        int right = rect.right();
        int bottom = rect.bottom();

        if (handle.movesEast()) {
            right = clamp(right + dx, left + minSize, canvasWidth);
        }
        if (handle.movesWest()) {
            left = clamp(left + dx, 0, right - minSize);
        }
        if (handle.movesSouth()) {
            bottom = clamp(bottom + dy, top + minSize, canvasHeight);
        }
        if (handle.movesNorth()) {
            top = clamp(top + dy, 0, bottom - minSize);
        }
        rect = CropRect.of(left, top, right - left, bottom - top);
    }

    public CropState pointerUp() {
        endGesture();
        return state();
    }

    /**
     * Leave crop mode and discard the rectangle.
     */
    public CropState cancel() {
        if (mode == CropState.Mode.ACTIVE) {
            log.debug("Crop cancelled");
        }
        mode = CropState.Mode.IDLE;
        rect = null;
        endGesture();
        return state();
    }

    /**
     * Leave crop mode, handing back the rectangle to crop to.
     *
     * @throws IllegalStateException if crop mode is not active
     */
    public CropRect commit() {
        if (mode != CropState.Mode.ACTIVE) {
            throw new IllegalStateException("Crop mode is not active");
        }
        CropRect result = rect.validate(canvasWidth, canvasHeight, minSize);
        mode = CropState.Mode.IDLE;
        rect = null;
        endGesture();
        return result;
    }

    /**
     * Find the handle whose anchor point lies within {@code tolerance} pixels of the pointer.
     *
     * @return the nearest handle in range, or null if there is none or crop mode is idle
     */
    public CropHandle handleAt(double x, double y, double tolerance) {
        if (mode != CropState.Mode.ACTIVE) {
            return null;
        }
        CropHandle best = null;
        double bestDistance = tolerance;
        for (CropHandle candidate : CropHandle.values()) {
            double distance = Math.hypot(candidate.anchorX(rect) - x, candidate.anchorY(rect) - y);
            if (distance <= bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    public CropState state() {
        if (mode == CropState.Mode.IDLE) {
            return CropState.IDLE;
        }
        return new CropState(mode, gesture, rect, handle);
    }

    public boolean isActive() {
        return mode == CropState.Mode.ACTIVE;
    }

    public int getMinSize() {
        return minSize;
    }

    private void endGesture() {
        gesture = CropState.Gesture.NONE;
        handle = null;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
