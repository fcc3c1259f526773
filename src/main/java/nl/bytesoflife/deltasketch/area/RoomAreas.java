package nl.bytesoflife.deltasketch.area;

import nl.bytesoflife.deltasketch.model.AreaCalculation;
import nl.bytesoflife.deltasketch.model.Dimensions;

/**
 * Recomputed values for one room, to be merged into the room by the host.
 *
 * @param dimensions bounding-box width and height in feet
 */
public record RoomAreas(String roomId, AreaCalculation areas, Dimensions dimensions) {
}
