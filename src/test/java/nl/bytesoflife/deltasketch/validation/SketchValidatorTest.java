package nl.bytesoflife.deltasketch.validation;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SketchValidatorTest {

    static List<Wall> squareWalls() {
        return List.of(
                Wall.builder("w1").from(0, 0).to(500, 0).build(),
                Wall.builder("w2").from(500, 0).to(500, 500).build(),
                Wall.builder("w3").from(500, 500).to(0, 500).build(),
                Wall.builder("w4").from(0, 500).to(0, 0).build());
    }

    static SketchRoom.Builder squareRoom() {
        return SketchRoom.builder("r1")
                .name("Bedroom")
                .walls("w1", "w2", "w3", "w4")
                .boundary(List.of(new Point(0, 0), new Point(500, 0), new Point(500, 500),
                        new Point(0, 500), new Point(0, 0)));
    }

    static SketchDocument.Builder validDocument() {
        return SketchDocument.builder("Plan")
                .addWalls(squareWalls())
                .addRoom(squareRoom().build());
    }

    @Test
    void wellFormedSketchHasNoIssues() {
        ValidationResult result = SketchValidator.withDefaultChecks().validate(validDocument().build());

        assertTrue(result.isValid());
        assertTrue(result.getIssues().isEmpty(), result.toString());
    }

    @Test
    void missingSketchNameIsError() {
        SketchDocument document = SketchDocument.builder("  ")
                .addWalls(squareWalls())
                .addRoom(squareRoom().build())
                .build();

        ValidationResult result = SketchValidator.withDefaultChecks().validate(document);

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        ValidationIssue issue = result.getErrors().get(0);
        assertEquals(ValidationCode.SKETCH_NO_NAME, issue.getCode());
        assertNull(issue.getElementId());
    }

    @Test
    void warningsDoNotInvalidate() {
        SketchDocument document = validDocument()
                .addWall(Wall.builder("stray").from(2000, 2000).to(2500, 2000).build())
                .build();

        ValidationResult result = SketchValidator.withDefaultChecks().validate(document);

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.hasIssue(ValidationCode.WALL_DISCONNECTED));
    }

    @Test
    void issuesFollowCheckOrder() {
        SketchDocument document = SketchDocument.builder("")
                .addWalls(squareWalls())
                .addWall(Wall.builder("stray").from(2000, 2000).to(2500, 2000).thickness(40).build())
                .addRoom(squareRoom().name("").build())
                .build();

        List<ValidationCode> codes = SketchValidator.withDefaultChecks().validate(document).getIssues().stream()
                .map(ValidationIssue::getCode)
                .toList();

        assertEquals(List.of(
                ValidationCode.SKETCH_NO_NAME,
                ValidationCode.WALL_UNUSUAL_THICKNESS,
                ValidationCode.ROOM_NO_NAME,
                ValidationCode.WALL_DISCONNECTED), codes);
    }

    @Test
    void customChecksCanBeRegistered() {
        SketchCheck alwaysFlags = document -> List.of(new ValidationIssue(ValidationCode.ROOM_NO_NAME, "custom"));

        ValidationResult result = new SketchValidator()
                .registerCheck(alwaysFlags)
                .validate(validDocument().build());

        assertEquals(1, result.getIssues().size());
        assertEquals("custom", result.getIssues().get(0).getMessage());
    }

    @Test
    void issueToStringNamesElement() {
        ValidationIssue issue = ValidationIssue.forWall(ValidationCode.WALL_ZERO_LENGTH, "Too short", "w9");

        assertEquals("[ERROR] WALL_ZERO_LENGTH: Too short (wall w9)", issue.toString());
        assertEquals("WALL_ZERO_LENGTH", issue.getCode().getCode());
        assertTrue(issue.isError());
    }

    @Test
    void resultToStringSummarizesCounts() {
        ValidationResult result = new ValidationResult();
        result.addIssue(new ValidationIssue(ValidationCode.SKETCH_NO_NAME, "Sketch must have a name"));
        result.addIssue(ValidationIssue.forRoom(ValidationCode.ROOM_ZERO_AREA, "Room area is zero", "r1"));

        String text = result.toString();

        assertTrue(text.contains("Valid: false"));
        assertTrue(text.contains("(1 errors, 1 warnings)"));
    }

    @Test
    void severityIsFixedPerCode() {
        assertEquals(Severity.ERROR, ValidationCode.ROOM_INSUFFICIENT_WALLS.getSeverity());
        assertEquals(Severity.WARNING, ValidationCode.ROOM_UNUSUAL_CEILING_HEIGHT.getSeverity());
        assertEquals(Severity.WARNING, ValidationCode.WALL_DISCONNECTED.getSeverity());
        assertEquals(Severity.ERROR, ValidationCode.FIXTURE_INVALID_POSITION.getSeverity());
    }
}
