package nl.bytesoflife.deltasketch.estimate;

import nl.bytesoflife.deltasketch.model.AreaCalculation;
import nl.bytesoflife.deltasketch.model.Dimensions;
import nl.bytesoflife.deltasketch.model.FixtureCategory;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.model.WallFixture;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaterialCalculatorTest {

    private static final double EPS = 1e-9;

    // 10' x 10' room with 8' walls and one 3' x 7' door
    static final AreaCalculation BEDROOM_AREAS = new AreaCalculation(100, 100, 320, 299, 800, 40);

    static SketchRoom bedroom() {
        return SketchRoom.builder("r1")
                .name("Bedroom")
                .walls("w1", "w2", "w3", "w4")
                .areas(BEDROOM_AREAS)
                .build();
    }

    static List<Wall> bedroomWalls() {
        return List.of(
                Wall.builder("w1").from(0, 0).to(500, 0).fixture("d1").build(),
                Wall.builder("w2").from(500, 0).to(500, 500).build(),
                Wall.builder("w3").from(500, 500).to(0, 500).build(),
                Wall.builder("w4").from(0, 500).to(0, 0).build());
    }

    static List<WallFixture> bedroomFixtures() {
        return List.of(WallFixture.opening("d1", FixtureCategory.DOOR));
    }

    @Test
    void defaultTakeOff() {
        MaterialCalculation materials = new MaterialCalculator()
                .calculate(bedroom(), bedroomWalls(), bedroomFixtures());

        assertEquals(100.0, materials.flooringSquareFeet(), EPS);
        assertEquals(10.0, materials.flooringWaste(), EPS);
        assertEquals(110.0, materials.flooringTotal(), EPS);
        assertEquals(299.0, materials.paintableArea(), EPS);
        assertEquals(1, materials.paintGallons());
        assertEquals(1, materials.primerGallons());
        assertEquals(40.0, materials.baseboardLinearFeet(), EPS);
        assertEquals(40.0, materials.crownMoldingLinearFeet(), EPS);
        assertEquals(17.0, materials.casingLinearFeet(), EPS);
        assertEquals(97.0, materials.trimLinearFeet(), EPS);
        assertEquals(100.0, materials.ceilingSquareFeet(), EPS);
        assertEquals(25, materials.ceilingTiles());
    }

    @Test
    void wastePercentageIsConfigurable() {
        MaterialCalculation materials = new MaterialCalculator()
                .withOptions(MaterialOptions.DEFAULT.withFlooringWastePercent(15))
                .calculate(bedroom(), bedroomWalls(), bedroomFixtures());

        assertEquals(15.0, materials.flooringWaste(), EPS);
        assertEquals(115.0, materials.flooringTotal(), EPS);
    }

    @Test
    void paintAndPrimerRoundUp() {
        SketchRoom room = SketchRoom.builder("r1")
                .areas(new AreaCalculation(0, 0, 1200, 1050, 0, 0))
                .build();

        MaterialCalculation materials = new MaterialCalculator().calculate(room, List.of(), List.of());

        assertEquals(3, materials.paintGallons());
        assertEquals(3, materials.primerGallons());

        MaterialCalculation thinner = new MaterialCalculator()
                .withOptions(MaterialOptions.DEFAULT.withPaintCoverage(250))
                .calculate(room, List.of(), List.of());
        assertEquals(5, thinner.paintGallons());
        assertEquals(4, thinner.primerGallons());
    }

    @Test
    void trimCanBeExcluded() {
        MaterialCalculation materials = new MaterialCalculator()
                .withOptions(MaterialOptions.DEFAULT.withIncludeTrim(false))
                .calculate(bedroom(), bedroomWalls(), bedroomFixtures());

        assertEquals(0.0, materials.trimLinearFeet(), EPS);
    }

    @Test
    void casingIgnoresSolidFixturesAndOtherRoomsWalls() {
        List<Wall> walls = List.of(
                Wall.builder("w1").from(0, 0).to(500, 0).fixture("cab").build(),
                Wall.builder("other").from(0, 0).to(0, -500).fixture("d1").build());
        List<WallFixture> fixtures = List.of(
                new WallFixture("cab", FixtureCategory.CABINET, 0.5, new Dimensions(24, 36), false),
                WallFixture.opening("d1", FixtureCategory.DOOR));

        MaterialCalculation materials = new MaterialCalculator().calculate(bedroom(), walls, fixtures);

        assertEquals(0.0, materials.casingLinearFeet(), EPS);
    }

    @Test
    void smallerTilesNeedMoreOfThem() {
        MaterialCalculation materials = new MaterialCalculator()
                .withOptions(MaterialOptions.DEFAULT.withCeilingTileSize(12))
                .calculate(bedroom(), bedroomWalls(), bedroomFixtures());

        assertEquals(100, materials.ceilingTiles());
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MaterialOptions.DEFAULT.withPaintCoverage(0));
        assertThrows(IllegalArgumentException.class, () -> MaterialOptions.DEFAULT.withFlooringWastePercent(-1));
        assertThrows(IllegalArgumentException.class, () -> MaterialOptions.DEFAULT.withCeilingTileSize(0));
    }
}
