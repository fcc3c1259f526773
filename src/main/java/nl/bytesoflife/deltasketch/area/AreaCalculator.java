package nl.bytesoflife.deltasketch.area;

import nl.bytesoflife.deltasketch.geometry.BoundingBox;
import nl.bytesoflife.deltasketch.geometry.GeometryUtils;
import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.geometry.Polygons;
import nl.bytesoflife.deltasketch.measurement.Measurements;
import nl.bytesoflife.deltasketch.model.AreaCalculation;
import nl.bytesoflife.deltasketch.model.Dimensions;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.model.WallFixture;
import nl.bytesoflife.deltasketch.topology.BoundaryWithHoles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Converts traced room geometry into physical quantities at a fixed drawing scale.
 */
public class AreaCalculator {

    private static final Logger log = LoggerFactory.getLogger(AreaCalculator.class);

    private final double pixelsPerFoot;

    public AreaCalculator(double pixelsPerFoot) {
        if (!(pixelsPerFoot > 0) || Double.isInfinite(pixelsPerFoot)) {
            throw new IllegalArgumentException("pixelsPerFoot must be a positive number");
        }
        this.pixelsPerFoot = pixelsPerFoot;
    }

    public double getPixelsPerFoot() {
        return pixelsPerFoot;
    }

    /**
     * Areas for one room from its stored boundary. A room needs at least three of its walls in
     * {@code walls} and three boundary points to enclose an area; otherwise floor, ceiling and
     * volume are zero while perimeter and wall areas are still reported.
     *
     * @param walls    candidate walls; only those listed in {@code room.wallIds()} are used
     * @param fixtures wall fixtures to resolve the walls' fixture ids against
     */
    public AreaCalculation calculateRoomAreas(SketchRoom room, List<Wall> walls, List<WallFixture> fixtures) {
        Set<String> ids = Set.copyOf(room.wallIds());
        List<Wall> roomWalls = walls.stream().filter(w -> ids.contains(w.id())).toList();
        List<Point> boundary = room.boundary();

        boolean hasValidArea = roomWalls.size() >= 3 && boundary.size() >= 3;

        double floorArea = hasValidArea
                ? Measurements.pixelAreaToSquareFeet(Polygons.area(boundary), pixelsPerFoot)
                : 0;
        double perimeter = Measurements.pixelsToFeet(GeometryUtils.perimeter(boundary), pixelsPerFoot);

        WallAreaSummary wallAreas = calculateWallAreas(roomWalls, fixtures);
        double volume = hasValidArea ? Measurements.cubicFeet(floorArea, room.effectiveCeilingHeight()) : 0;

        return new AreaCalculation(floorArea, floorArea, wallAreas.totalArea(), wallAreas.netArea(), volume, perimeter);
    }

    public WallAreaSummary calculateWallAreas(List<Wall> walls, List<WallFixture> fixtures) {
        Map<String, WallFixture> fixturesById = new HashMap<>();
        for (WallFixture fixture : fixtures) {
            fixturesById.putIfAbsent(fixture.id(), fixture);
        }

        double totalArea = 0;
        double netArea = 0;
        List<WallAreaDetail> details = new ArrayList<>();

        for (Wall wall : walls) {
            double length = wall.lengthInFeet(pixelsPerFoot);
            double height = wall.height().toFeet();
            double area = length * height;

            List<WallFixture> mounted = new ArrayList<>();
            for (String fixtureId : wall.fixtureIds()) {
                WallFixture fixture = fixturesById.get(fixtureId);
                if (fixture != null) {
                    mounted.add(fixture);
                }
            }
            double openingArea = calculateOpeningArea(mounted);
            double wallNetArea = Math.max(0, area - openingArea);

            totalArea += area;
            netArea += wallNetArea;
            details.add(new WallAreaDetail(wall.id(), area, wallNetArea, length, height, openingArea));
        }
        return new WallAreaSummary(totalArea, netArea, details);
    }

    /**
     * Square feet cut out by opening fixtures, using their opening dimensions when given.
     */
    public static double calculateOpeningArea(List<WallFixture> fixtures) {
        double total = 0;
        for (WallFixture fixture : fixtures) {
            if (!fixture.opening()) continue;
            Dimensions d = fixture.effectiveOpeningDimensions();
            total += (d.width() / 12) * (d.height() / 12);
        }
        return total;
    }

    /**
     * Net floor area in square feet of an outline with holes.
     */
    public double calculateFloorArea(BoundaryWithHoles boundary) {
        return Measurements.pixelAreaToSquareFeet(boundary.area(), pixelsPerFoot);
    }

    public Dimensions calculateRoomDimensions(SketchRoom room) {
        if (room.boundary().isEmpty()) {
            return room.dimensions();
        }
        BoundingBox bbox = BoundingBox.of(room.boundary());
        return new Dimensions(
                Measurements.pixelsToFeet(bbox.width(), pixelsPerFoot),
                Measurements.pixelsToFeet(bbox.height(), pixelsPerFoot),
                room.dimensions().depth());
    }

    public SketchAreas calculateSketchAreas(SketchDocument document) {
        return calculateSketchAreas(document, false);
    }

    /**
     * Areas for every room of the document plus document totals and wall bounds.
     * Rooms are independent, so they may be computed in parallel; results keep room order.
     */
    public SketchAreas calculateSketchAreas(SketchDocument document, boolean parallel) {
        Stream<SketchRoom> stream = parallel
                ? document.getRooms().parallelStream()
                : document.getRooms().stream();

        List<RoomAreas> rooms = stream
                .map(room -> new RoomAreas(
                        room.id(),
                        calculateRoomAreas(room, document.getWalls(), document.getWallFixtures()),
                        calculateRoomDimensions(room)))
                .toList();

        AreaCalculation totals = AreaCalculation.ZERO;
        for (RoomAreas room : rooms) {
            totals = totals.plus(room.areas());
        }

        BoundingBox bounds = null;
        if (!document.getWalls().isEmpty()) {
            List<Point> endpoints = new ArrayList<>();
            for (Wall wall : document.getWalls()) {
                endpoints.add(wall.start());
                endpoints.add(wall.end());
            }
            bounds = BoundingBox.of(endpoints);
        }

        log.debug("Calculated areas for {} rooms: {} sq ft floor", rooms.size(), totals.floorArea());
        return new SketchAreas(rooms, totals, bounds);
    }
}
