package nl.bytesoflife.deltasketch.area;

/**
 * Area figures for a single wall, in feet and square feet.
 */
public record WallAreaDetail(
        String wallId,
        double area,
        double netArea,
        double length,
        double height,
        double openingArea
) {
}
