package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.model.SketchDefaults;

/**
 * @param tolerance maximum distance, in drawing units, at which two wall endpoints count as the same point
 */
public record TopologyOptions(double tolerance) {

    public static final double DEFAULT_TOLERANCE = SketchDefaults.DEFAULT_SNAP_TOLERANCE;
    public static final TopologyOptions DEFAULT = new TopologyOptions(DEFAULT_TOLERANCE);

    public TopologyOptions {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be > 0");
        }
    }
}
