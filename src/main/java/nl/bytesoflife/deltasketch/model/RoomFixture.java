package nl.bytesoflife.deltasketch.model;

import nl.bytesoflife.deltasketch.geometry.Point;

/**
 * A fixture placed freely inside a room, such as a cabinet or appliance.
 *
 * @param position absolute location in drawing space
 * @param rotation rotation in degrees
 */
public record RoomFixture(
        String id,
        FixtureCategory category,
        Point position,
        Dimensions dimensions,
        double rotation,
        String roomId
) {
    public RoomFixture {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Fixture id must not be blank");
        }
        if (category == null) {
            category = FixtureCategory.OTHER;
        }
        if (position == null) {
            position = Point.ORIGIN;
        }
        if (dimensions == null) {
            dimensions = FixtureDefaults.dimensionsFor(category);
        }
    }
}
