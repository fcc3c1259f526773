package nl.bytesoflife.deltasketch.estimate;

/**
 * Settings for material take-off.
 *
 * @param flooringWastePercent extra flooring ordered for cuts and waste, in percent
 * @param paintCoverage        square feet covered per gallon of paint
 * @param ceilingTileSize      edge length of a square ceiling tile, in inches
 * @param includeTrim          whether baseboard, crown molding and casing are calculated
 */
public record MaterialOptions(
        double flooringWastePercent,
        double paintCoverage,
        double ceilingTileSize,
        boolean includeTrim
) {
    public static final MaterialOptions DEFAULT = new MaterialOptions(10, 350, 24, true);

    public MaterialOptions {
        if (flooringWastePercent < 0) {
            throw new IllegalArgumentException("Waste percentage must be >= 0");
        }
        if (!(paintCoverage > 0)) {
            throw new IllegalArgumentException("Paint coverage must be > 0");
        }
        if (!(ceilingTileSize > 0)) {
            throw new IllegalArgumentException("Ceiling tile size must be > 0");
        }
    }

    public MaterialOptions withFlooringWastePercent(double percent) {
        return new MaterialOptions(percent, paintCoverage, ceilingTileSize, includeTrim);
    }

    public MaterialOptions withPaintCoverage(double squareFeetPerGallon) {
        return new MaterialOptions(flooringWastePercent, squareFeetPerGallon, ceilingTileSize, includeTrim);
    }

    public MaterialOptions withCeilingTileSize(double inches) {
        return new MaterialOptions(flooringWastePercent, paintCoverage, inches, includeTrim);
    }

    public MaterialOptions withIncludeTrim(boolean include) {
        return new MaterialOptions(flooringWastePercent, paintCoverage, ceilingTileSize, include);
    }
}
