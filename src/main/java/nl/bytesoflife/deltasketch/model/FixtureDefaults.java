package nl.bytesoflife.deltasketch.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default fixture sizes in inches, per category.
 */
public final class FixtureDefaults {

    private static final Dimensions FALLBACK = new Dimensions(24, 24);

    private static final Map<FixtureCategory, Dimensions> DIMENSIONS = new EnumMap<>(Map.of(
            FixtureCategory.DOOR, new Dimensions(36, 84),
            FixtureCategory.WINDOW, new Dimensions(48, 48),
            FixtureCategory.CABINET, new Dimensions(24, 36, 18.0),
            FixtureCategory.VANITY, new Dimensions(48, 36, 24.0),
            FixtureCategory.APPLIANCE, new Dimensions(36, 72, 30.0),
            FixtureCategory.ELECTRICAL, new Dimensions(4, 4),
            FixtureCategory.PLUMBING, new Dimensions(6, 6)
    ));

    private FixtureDefaults() {
    }

    public static Dimensions dimensionsFor(FixtureCategory category) {
        return DIMENSIONS.getOrDefault(category, FALLBACK);
    }
}
