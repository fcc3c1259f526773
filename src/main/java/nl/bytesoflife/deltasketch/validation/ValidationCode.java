package nl.bytesoflife.deltasketch.validation;

/**
 * Stable identifiers of validation findings. The enum constant name is the code reported to hosts.
 */
public enum ValidationCode {
    SKETCH_NO_NAME(Severity.ERROR),
    WALL_INVALID_START_POINT(Severity.ERROR),
    WALL_INVALID_END_POINT(Severity.ERROR),
    WALL_ZERO_LENGTH(Severity.ERROR),
    WALL_UNUSUAL_THICKNESS(Severity.WARNING),
    WALL_UNUSUAL_HEIGHT(Severity.WARNING),
    WALL_DISCONNECTED(Severity.WARNING),
    ROOM_NO_NAME(Severity.ERROR),
    ROOM_NO_WALLS(Severity.ERROR),
    ROOM_INSUFFICIENT_WALLS(Severity.ERROR),
    ROOM_INVALID_WALL_REFERENCE(Severity.ERROR),
    ROOM_UNUSUAL_CEILING_HEIGHT(Severity.WARNING),
    ROOM_ZERO_AREA(Severity.WARNING),
    ROOM_SELF_INTERSECTING(Severity.WARNING),
    FIXTURE_INVALID_POSITION(Severity.ERROR),
    FIXTURE_INVALID_DIMENSIONS(Severity.ERROR);

    private final Severity severity;

    ValidationCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCode() {
        return name();
    }
}
