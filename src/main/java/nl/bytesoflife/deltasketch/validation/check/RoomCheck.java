package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.area.AreaCalculator;
import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.geometry.SketchGeometryConverter;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.validation.SketchCheck;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Names, wall references, ceiling height and enclosed area of each room.
 */
public class RoomCheck implements SketchCheck {

    static final double MAX_CEILING_FEET = 20;

    private final SketchGeometryConverter converter = new SketchGeometryConverter();

    @Override
    public List<ValidationIssue> check(SketchDocument document) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> wallIds = document.getWalls().stream().map(Wall::id).collect(Collectors.toSet());
        AreaCalculator areaCalculator = new AreaCalculator(document.getPixelsPerFoot());

        for (SketchRoom room : document.getRooms()) {
            if (room.name() == null || room.name().isBlank()) {
                issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_NO_NAME,
                        "Room must have a name", room.id()));
            }

            int wallCount = room.wallIds().size();
            if (wallCount == 0) {
                issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_NO_WALLS,
                        "Room must have at least 3 walls", room.id()));
            } else if (wallCount < 3) {
                issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_INSUFFICIENT_WALLS,
                        "Room must have at least 3 walls to form an enclosed area", room.id()));
            }

            for (String wallId : room.wallIds()) {
                if (!wallIds.contains(wallId)) {
                    issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_INVALID_WALL_REFERENCE,
                            "Room references non-existent wall: " + wallId, room.id()));
                }
            }

            if (room.ceilingHeight() != null) {
                double ceilingFeet = room.ceilingHeight().toFeet();
                if (!(ceilingFeet > 0 && ceilingFeet <= MAX_CEILING_FEET)) {
                    issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_UNUSUAL_CEILING_HEIGHT,
                            "Ceiling height " + room.ceilingHeight().getDisplay() + " is unusual (typical: 8'-10')",
                            room.id()));
                }
            }

            double floorArea = areaCalculator
                    .calculateRoomAreas(room, document.getWalls(), document.getWallFixtures())
                    .floorArea();
            if (!(floorArea > 0)) {
                issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_ZERO_AREA,
                        "Room area is zero or negative", room.id()));
            }

            if (isFinite(room.boundary()) && converter.isSelfIntersecting(room.boundary())) {
                issues.add(ValidationIssue.forRoom(ValidationCode.ROOM_SELF_INTERSECTING,
                        "Room boundary crosses itself", room.id()));
            }
        }
        return issues;
    }

    private static boolean isFinite(List<Point> points) {
        return points.stream().allMatch(Point::isFinite);
    }
}
