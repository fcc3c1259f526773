package nl.bytesoflife.deltasketch.model;

import nl.bytesoflife.deltasketch.geometry.GeometryUtils;
import nl.bytesoflife.deltasketch.geometry.Point;

/**
 * Conversion between drawing space and physical space for one document.
 *
 * @param pixelsPerFoot drawing units per physical foot, must be positive
 * @param gridSize      snapping grid spacing in drawing units; 0 disables snapping
 */
public record Scale(double pixelsPerFoot, double gridSize) {

    public static final Scale DEFAULT = new Scale(50, 1);

    public Scale {
        if (!(pixelsPerFoot > 0) || Double.isInfinite(pixelsPerFoot)) {
            throw new IllegalArgumentException("pixelsPerFoot must be a positive number");
        }
        if (!(gridSize >= 0) || Double.isInfinite(gridSize)) {
            throw new IllegalArgumentException("gridSize must be a non-negative number");
        }
    }

    public Scale(double pixelsPerFoot) {
        this(pixelsPerFoot, 1);
    }

    public Point snapToGrid(Point point) {
        return GeometryUtils.snapToGrid(point, gridSize);
    }
}
