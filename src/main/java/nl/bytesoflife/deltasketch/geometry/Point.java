package nl.bytesoflife.deltasketch.geometry;

/**
 * A point or vector in document-local drawing space (pixels).
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
