package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.measurement.Measurements;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.validation.ElementType;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomCheckTest {

    private static final List<Point> SQUARE = List.of(
            new Point(0, 0), new Point(500, 0), new Point(500, 500), new Point(0, 500), new Point(0, 0));

    private static final List<Wall> WALLS = List.of(
            Wall.builder("w1").from(0, 0).to(500, 0).build(),
            Wall.builder("w2").from(500, 0).to(500, 500).build(),
            Wall.builder("w3").from(500, 500).to(0, 500).build(),
            Wall.builder("w4").from(0, 500).to(0, 0).build());

    private static SketchRoom.Builder room() {
        return SketchRoom.builder("r1").name("Kitchen").walls("w1", "w2", "w3", "w4").boundary(SQUARE);
    }

    private static List<ValidationCode> check(SketchRoom room) {
        SketchDocument document = SketchDocument.builder("Plan").addWalls(WALLS).addRoom(room).build();
        return new RoomCheck().check(document).stream().map(ValidationIssue::getCode).toList();
    }

    @Test
    void enclosedRoomPasses() {
        assertTrue(check(room().build()).isEmpty());
    }

    @Test
    void blankNameIsError() {
        assertEquals(List.of(ValidationCode.ROOM_NO_NAME), check(room().name(" ").build()));
        assertEquals(List.of(ValidationCode.ROOM_NO_NAME), check(room().name(null).build()));
    }

    @Test
    void roomWithoutWalls() {
        List<ValidationCode> codes = check(SketchRoom.builder("r1").name("Empty").build());

        assertEquals(List.of(ValidationCode.ROOM_NO_WALLS, ValidationCode.ROOM_ZERO_AREA), codes);
    }

    @Test
    void roomWithTwoWallsCannotEnclose() {
        SketchRoom twoWalls = SketchRoom.builder("r1").name("Nook").walls("w1", "w2").boundary(SQUARE).build();
        assertEquals(List.of(ValidationCode.ROOM_INSUFFICIENT_WALLS, ValidationCode.ROOM_ZERO_AREA), check(twoWalls));
    }

    @Test
    void danglingWallReferenceIsReportedPerId() {
        SketchRoom room = room().walls("ghost").build();

        SketchDocument document = SketchDocument.builder("Plan").addWalls(WALLS).addRoom(room).build();
        List<ValidationIssue> issues = new RoomCheck().check(document);

        assertEquals(1, issues.size());
        ValidationIssue issue = issues.get(0);
        assertEquals(ValidationCode.ROOM_INVALID_WALL_REFERENCE, issue.getCode());
        assertEquals("Room references non-existent wall: ghost", issue.getMessage());
        assertEquals("r1", issue.getElementId());
        assertEquals(ElementType.ROOM, issue.getElementType());
    }

    @Test
    void unusualCeilingHeightIsWarning() {
        assertEquals(List.of(ValidationCode.ROOM_UNUSUAL_CEILING_HEIGHT),
                check(room().ceilingHeight(Measurements.fromFeet(25)).build()));
        assertEquals(List.of(ValidationCode.ROOM_UNUSUAL_CEILING_HEIGHT),
                check(room().ceilingHeight(Measurements.create(0)).build()));
        assertTrue(check(room().ceilingHeight(Measurements.fromFeet(12)).build()).isEmpty());
    }

    @Test
    void missingCeilingHeightUsesDefaultAndPasses() {
        assertTrue(check(room().ceilingHeight(null).build()).isEmpty());
    }

    @Test
    void untracedRoomHasZeroArea() {
        assertEquals(List.of(ValidationCode.ROOM_ZERO_AREA), check(room().boundary(List.of()).build()));
    }

    @Test
    void crossingBoundaryIsWarning() {
        List<Point> bowTie = List.of(
                new Point(0, 0), new Point(500, 500), new Point(500, 0), new Point(0, 500), new Point(0, 0));

        List<ValidationCode> codes = check(room().boundary(bowTie).build());

        assertTrue(codes.contains(ValidationCode.ROOM_SELF_INTERSECTING));
    }
}
