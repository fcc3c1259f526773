package nl.bytesoflife.deltasketch.model;

/**
 * Derived room or document quantities. Areas in square feet, volume in cubic feet, perimeter in feet.
 */
public record AreaCalculation(
        double floorArea,
        double ceilingArea,
        double wallArea,
        double netWallArea,
        double volume,
        double perimeter
) {
    public static final AreaCalculation ZERO = new AreaCalculation(0, 0, 0, 0, 0, 0);

    public AreaCalculation plus(AreaCalculation other) {
        return new AreaCalculation(
                floorArea + other.floorArea,
                ceilingArea + other.ceilingArea,
                wallArea + other.wallArea,
                netWallArea + other.netWallArea,
                volume + other.volume,
                perimeter + other.perimeter);
    }
}
