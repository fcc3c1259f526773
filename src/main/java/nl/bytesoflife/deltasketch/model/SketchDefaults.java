package nl.bytesoflife.deltasketch.model;

import nl.bytesoflife.deltasketch.measurement.Measurement;
import nl.bytesoflife.deltasketch.measurement.Measurements;

/**
 * Default values for newly drawn sketch elements.
 */
public final class SketchDefaults {

    public static final double DEFAULT_WALL_THICKNESS_INCHES = 4;
    public static final Measurement DEFAULT_WALL_HEIGHT = Measurements.fromFeet(8);
    public static final Measurement DEFAULT_CEILING_HEIGHT = Measurements.fromFeet(8);
    public static final double DEFAULT_SNAP_TOLERANCE = 5;
    public static final String DEFAULT_DOCUMENT_NAME = "Untitled Sketch";
    public static final String DEFAULT_ROOM_NAME = "Room";

    private SketchDefaults() {
    }
}
