package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.measurement.Measurements;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.validation.SketchCheck;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coordinates, minimum length, thickness and height of each wall.
 */
public class WallCheck implements SketchCheck {

    static final double MIN_LENGTH_INCHES = 1;
    static final double MAX_THICKNESS_INCHES = 24;
    static final double MAX_HEIGHT_FEET = 20;

    @Override
    public List<ValidationIssue> check(SketchDocument document) {
        List<ValidationIssue> issues = new ArrayList<>();
        double pixelsPerFoot = document.getPixelsPerFoot();

        for (Wall wall : document.getWalls()) {
            boolean startValid = wall.start().isFinite();
            boolean endValid = wall.end().isFinite();

            if (!startValid) {
                issues.add(ValidationIssue.forWall(ValidationCode.WALL_INVALID_START_POINT,
                        "Wall start point has invalid coordinates", wall.id()));
            }
            if (!endValid) {
                issues.add(ValidationIssue.forWall(ValidationCode.WALL_INVALID_END_POINT,
                        "Wall end point has invalid coordinates", wall.id()));
            }

            if (startValid && endValid) {
                double lengthInches = wall.lengthInFeet(pixelsPerFoot) * Measurements.INCHES_PER_FOOT;
                if (lengthInches < MIN_LENGTH_INCHES) {
                    issues.add(ValidationIssue.forWall(ValidationCode.WALL_ZERO_LENGTH,
                            "Wall length is too small (minimum 1 inch)", wall.id()));
                }
            }

            if (!(wall.thickness() > 0 && wall.thickness() <= MAX_THICKNESS_INCHES)) {
                issues.add(ValidationIssue.forWall(ValidationCode.WALL_UNUSUAL_THICKNESS,
                        String.format(Locale.US, "Wall thickness %s\" is unusual (typical: 4\"-6\")",
                                formatNumber(wall.thickness())),
                        wall.id()));
            }

            double heightFeet = wall.height().toFeet();
            if (!(heightFeet > 0 && heightFeet <= MAX_HEIGHT_FEET)) {
                issues.add(ValidationIssue.forWall(ValidationCode.WALL_UNUSUAL_HEIGHT,
                        "Wall height " + wall.height().getDisplay() + " is unusual (typical: 8'-10')",
                        wall.id()));
            }
        }
        return issues;
    }

    static String formatNumber(double value) {
        return value == Math.rint(value) && Double.isFinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
