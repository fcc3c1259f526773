package nl.bytesoflife.deltasketch.model;

/**
 * A fixture mounted on a wall, such as a door or window.
 *
 * @param position          location along the owning wall, 0 at its start and 1 at its end
 * @param dimensions        fixture size in inches
 * @param opening           whether the fixture cuts an opening into the wall
 * @param openingDimensions size of the cut-out when it differs from {@code dimensions}, or null
 */
public record WallFixture(
        String id,
        FixtureCategory category,
        double position,
        Dimensions dimensions,
        boolean opening,
        Dimensions openingDimensions,
        String wallId
) {
    public WallFixture {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Fixture id must not be blank");
        }
        if (category == null) {
            category = FixtureCategory.OTHER;
        }
        if (dimensions == null) {
            dimensions = Dimensions.ZERO;
        }
    }

    public WallFixture(String id, FixtureCategory category, double position, Dimensions dimensions, boolean opening) {
        this(id, category, position, dimensions, opening, null, null);
    }

    /**
     * Door or window with the default size for its category, placed mid-wall.
     */
    public static WallFixture opening(String id, FixtureCategory category) {
        return new WallFixture(id, category, 0.5, FixtureDefaults.dimensionsFor(category), true);
    }

    public Dimensions effectiveOpeningDimensions() {
        return openingDimensions != null ? openingDimensions : dimensions;
    }
}
