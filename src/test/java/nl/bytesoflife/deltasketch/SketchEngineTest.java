package nl.bytesoflife.deltasketch;

import nl.bytesoflife.deltasketch.area.SketchAreas;
import nl.bytesoflife.deltasketch.estimate.CostEstimation;
import nl.bytesoflife.deltasketch.estimate.MaterialCalculation;
import nl.bytesoflife.deltasketch.estimate.MaterialOptions;
import nl.bytesoflife.deltasketch.estimate.UnitPrices;
import nl.bytesoflife.deltasketch.model.FixtureCategory;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.model.WallFixture;
import nl.bytesoflife.deltasketch.topology.TopologyOptions;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SketchEngineTest {

    private static final double EPS = 1e-6;

    /**
     * Two 10' x 10' rooms side by side sharing wall w2, with a door in w1. 50 px per foot.
     */
    private static SketchDocument twoRooms() {
        return SketchDocument.builder("Ground floor")
                .addWall(Wall.builder("w1").from(0, 0).to(500, 0).fixture("d1").build())
                .addWall(Wall.builder("w2").from(500, 0).to(500, 500).build())
                .addWall(Wall.builder("w3").from(500, 500).to(0, 500).build())
                .addWall(Wall.builder("w4").from(0, 500).to(0, 0).build())
                .addWall(Wall.builder("w5").from(500, 0).to(1000, 0).build())
                .addWall(Wall.builder("w6").from(1000, 0).to(1000, 500).build())
                .addWall(Wall.builder("w7").from(1000, 500).to(500, 500).build())
                .addWallFixture(WallFixture.opening("d1", FixtureCategory.DOOR))
                .addRoom(SketchRoom.builder("r1").name("Bedroom").walls("w1", "w2", "w3", "w4").build())
                .addRoom(SketchRoom.builder("r2").name("Office").walls("w5", "w6", "w7", "w2").build())
                .build();
    }

    @Test
    void traceRoomsFillsBoundariesWithoutTouchingInput() {
        SketchDocument input = twoRooms();

        SketchDocument traced = new SketchEngine().traceRooms(input);

        assertEquals(5, traced.findRoom("r1").orElseThrow().boundary().size());
        assertEquals(5, traced.findRoom("r2").orElseThrow().boundary().size());
        assertTrue(input.findRoom("r1").orElseThrow().boundary().isEmpty());
    }

    @Test
    void measureComputesEveryRoom() {
        SketchAreas areas = new SketchEngine().measure(twoRooms());

        assertEquals(200.0, areas.getTotals().floorArea(), EPS);
        assertEquals(80.0, areas.getTotals().perimeter(), EPS);
        assertEquals(299.0, areas.getRoom("r1").orElseThrow().areas().netWallArea(), EPS);
        assertEquals(320.0, areas.getRoom("r2").orElseThrow().areas().netWallArea(), EPS);
    }

    @Test
    void calculateUsesStoredBoundaries() {
        SketchAreas areas = new SketchEngine().calculate(twoRooms());

        assertEquals(0.0, areas.getTotals().floorArea(), EPS);
    }

    @Test
    void recalculateUpdatesConnectionsBoundariesAndAreas() {
        SketchDocument updated = new SketchEngine().recalculate(twoRooms());

        SketchRoom bedroom = updated.findRoom("r1").orElseThrow();
        assertEquals(100.0, bedroom.areas().floorArea(), EPS);
        assertEquals(10.0, bedroom.dimensions().width(), EPS);
        assertEquals(10.0, bedroom.dimensions().height(), EPS);
        assertEquals(List.of("w1", "w3", "w5", "w7"), updated.findWall("w2").orElseThrow().connectedWallIds());
    }

    @Test
    void parallelRoomsGiveSameResult() {
        SketchAreas sequential = new SketchEngine().measure(twoRooms());
        SketchAreas parallel = new SketchEngine().withParallelRooms(true).measure(twoRooms());

        assertEquals(sequential.getRooms(), parallel.getRooms());
    }

    @Test
    void connectionsUseConfiguredTolerance() {
        SketchDocument document = SketchDocument.builder("Gap")
                .addWall(Wall.builder("a").from(0, 0).to(100, 0).build())
                .addWall(Wall.builder("b").from(107, 0).to(200, 0).build())
                .build();

        Map<String, List<String>> loose = new SketchEngine()
                .withTopologyOptions(new TopologyOptions(10))
                .connections(document);

        assertTrue(new SketchEngine().connections(document).get("a").isEmpty());
        assertEquals(List.of("b"), loose.get("a"));
    }

    @Test
    void openRoomKeepsPartialBoundary() {
        SketchDocument document = SketchDocument.builder("Open")
                .addWall(Wall.builder("w1").from(0, 0).to(500, 0).build())
                .addWall(Wall.builder("w2").from(500, 0).to(500, 500).build())
                .addWall(Wall.builder("w3").from(500, 500).to(0, 500).build())
                .addRoom(SketchRoom.builder("r1").name("Porch").walls("w1", "w2", "w3").build())
                .build();

        SketchDocument updated = new SketchEngine().recalculate(document);
        SketchRoom porch = updated.findRoom("r1").orElseThrow();

        assertEquals(3, porch.boundary().size());
        // Three walls and three points still pass the area guard; the open U reads as a triangle
        assertEquals(50.0, porch.areas().floorArea(), EPS);
    }

    @Test
    void materialsAndCostsForRoom() {
        SketchEngine engine = new SketchEngine();
        SketchDocument updated = engine.recalculate(twoRooms());
        SketchRoom bedroom = updated.findRoom("r1").orElseThrow();

        MaterialCalculation materials = engine.materials(bedroom, updated, MaterialOptions.DEFAULT);
        CostEstimation costs = engine.costs(bedroom, updated, MaterialOptions.DEFAULT, UnitPrices.DEFAULT);

        assertEquals(110.0, materials.flooringTotal(), EPS);
        assertEquals(17.0, materials.casingLinearFeet(), EPS);
        assertEquals(2239.0, costs.grandTotal(), EPS);
    }

    @Test
    void validateRecalculatedSketch() {
        SketchEngine engine = new SketchEngine();

        ValidationResult before = engine.validate(twoRooms());
        ValidationResult after = engine.validate(engine.recalculate(twoRooms()));

        assertTrue(before.hasIssue(ValidationCode.ROOM_ZERO_AREA));
        assertTrue(before.isValid());
        assertTrue(after.getIssues().isEmpty(), after.toString());
    }
}
