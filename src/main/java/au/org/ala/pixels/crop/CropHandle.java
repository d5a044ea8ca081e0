package au.org.ala.pixels.crop;

/**
 * The eight resize handles of the crop overlay. A handle moves the edges named by its compass
 * letters, so {@code SE} changes width and height but never the origin.
 */
public enum CropHandle {
    N(true, false, false, false),
    S(false, true, false, false),
    E(false, false, true, false),
    W(false, false, false, true),
    NE(true, false, true, false),
    NW(true, false, false, true),
    SE(false, true, true, false),
    SW(false, true, false, true);

    private final boolean north;
    private final boolean south;
    private final boolean east;
    private final boolean west;

    CropHandle(boolean north, boolean south, boolean east, boolean west) {
        this.north = north;
        this.south = south;
        this.east = east;
        this.west = west;
    }

    public boolean movesNorth() { return north; }
    public boolean movesSouth() { return south; }
    public boolean movesEast() { return east; }
    public boolean movesWest() { return west; }

    /**
     * @return x of this handle's anchor on the given rectangle: an edge or the horizontal midpoint
     */
    public double anchorX(CropRect rect) {
        if (east) return rect.right();
        if (west) return rect.x;
        return rect.x + rect.width / 2.0;
    }

    public double anchorY(CropRect rect) {
        if (south) return rect.bottom();
        if (north) return rect.y;
        return rect.y + rect.height / 2.0;
    }

    public static CropHandle parse(String s) {
        if (s == null) throw new IllegalArgumentException("Crop handle is null");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown crop handle: " + s, e);
        }
    }
}
