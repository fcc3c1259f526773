package nl.bytesoflife.deltasketch.estimate;

import nl.bytesoflife.deltasketch.model.AreaCalculation;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.model.WallFixture;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives material quantities from a room's calculated areas.
 *
 * <pre>
 * MaterialCalculation materials = new MaterialCalculator()
 *     .withOptions(MaterialOptions.DEFAULT.withFlooringWastePercent(15))
 *     .calculate(room, document.getWalls(), document.getWallFixtures());
 * </pre>
 */
public class MaterialCalculator {

    private static final double PRIMER_RATIO = 0.8;

    private MaterialOptions options = MaterialOptions.DEFAULT;

    public MaterialCalculator withOptions(MaterialOptions options) {
        this.options = options;
        return this;
    }

    public MaterialOptions getOptions() {
        return options;
    }

    /**
     * @param room     room whose {@link SketchRoom#areas()} are already calculated
     * @param walls    candidate walls; only the room's own walls contribute casing
     * @param fixtures wall fixtures to resolve fixture ids against
     */
    public MaterialCalculation calculate(SketchRoom room, List<Wall> walls, List<WallFixture> fixtures) {
        AreaCalculation areas = room.areas();

        double flooringSquareFeet = areas.floorArea();
        double flooringWaste = flooringSquareFeet * (options.flooringWastePercent() / 100);
        double flooringTotal = flooringSquareFeet + flooringWaste;

        double paintableArea = areas.netWallArea();
        int paintGallons = (int) Math.ceil(paintableArea / options.paintCoverage());
        int primerGallons = (int) Math.ceil(paintGallons * PRIMER_RATIO);

        double baseboard = 0;
        double crown = 0;
        double casing = 0;
        if (options.includeTrim()) {
            baseboard = areas.perimeter();
            crown = areas.perimeter();
            casing = calculateCasing(room, walls, fixtures);
        }

        double ceilingSquareFeet = areas.ceilingArea();
        double tileSquareFeet = options.ceilingTileSize() * options.ceilingTileSize() / 144;
        int ceilingTiles = (int) Math.ceil(ceilingSquareFeet / tileSquareFeet);

        return new MaterialCalculation(
                flooringSquareFeet, flooringWaste, flooringTotal,
                paintableArea, paintGallons, primerGallons,
                baseboard, crown, casing,
                ceilingSquareFeet, ceilingTiles);
    }

    // Two sides plus the head of every opening on the room's walls
    private double calculateCasing(SketchRoom room, List<Wall> walls, List<WallFixture> fixtures) {
        Map<String, WallFixture> fixturesById = new HashMap<>();
        for (WallFixture fixture : fixtures) {
            fixturesById.putIfAbsent(fixture.id(), fixture);
        }
        Set<String> roomWallIds = Set.copyOf(room.wallIds());

        double casing = 0;
        for (Wall wall : walls) {
            if (!roomWallIds.contains(wall.id())) continue;
            for (String fixtureId : wall.fixtureIds()) {
                WallFixture fixture = fixturesById.get(fixtureId);
                if (fixture != null && fixture.opening()) {
                    double width = fixture.dimensions().width() / 12;
                    double height = fixture.dimensions().height() / 12;
                    casing += height * 2 + width;
                }
            }
        }
        return casing;
    }
}
