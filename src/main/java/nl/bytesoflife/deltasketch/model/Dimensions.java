package nl.bytesoflife.deltasketch.model;

/**
 * Width and height, with an optional depth. Fixture dimensions are in inches, room dimensions in feet.
 */
public record Dimensions(double width, double height, Double depth) {

    public static final Dimensions ZERO = new Dimensions(0, 0, null);

    public Dimensions(double width, double height) {
        this(width, height, null);
    }

    /**
     * Width and height are positive, and so is depth when it is given.
     */
    public boolean isPositive() {
        return width > 0 && height > 0 && (depth == null || depth > 0);
    }
}
