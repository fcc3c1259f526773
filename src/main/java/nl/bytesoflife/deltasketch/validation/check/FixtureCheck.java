package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.model.RoomFixture;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.WallFixture;
import nl.bytesoflife.deltasketch.validation.SketchCheck;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Position along the wall and size of wall fixtures; size of room fixtures.
 */
public class FixtureCheck implements SketchCheck {

    @Override
    public List<ValidationIssue> check(SketchDocument document) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (WallFixture fixture : document.getWallFixtures()) {
            double position = fixture.position();
            if (!(position >= 0 && position <= 1)) {
                issues.add(ValidationIssue.forFixture(ValidationCode.FIXTURE_INVALID_POSITION,
                        "Fixture position must be between 0 and 1 along the wall", fixture.id()));
            }
            if (!fixture.dimensions().isPositive()) {
                issues.add(ValidationIssue.forFixture(ValidationCode.FIXTURE_INVALID_DIMENSIONS,
                        "Fixture dimensions must be positive", fixture.id()));
            }
        }

        for (RoomFixture fixture : document.getRoomFixtures()) {
            if (!fixture.dimensions().isPositive()) {
                issues.add(ValidationIssue.forFixture(ValidationCode.FIXTURE_INVALID_DIMENSIONS,
                        "Fixture dimensions must be positive", fixture.id()));
            }
        }
        return issues;
    }
}
