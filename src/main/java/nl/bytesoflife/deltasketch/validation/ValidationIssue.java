package nl.bytesoflife.deltasketch.validation;

public class ValidationIssue {

    private final ValidationCode code;
    private final String message;
    private final String elementId;
    private final ElementType elementType;

    public ValidationIssue(ValidationCode code, String message, String elementId, ElementType elementType) {
        this.code = code;
        this.message = message;
        this.elementId = elementId;
        this.elementType = elementType;
    }

    public ValidationIssue(ValidationCode code, String message) {
        this(code, message, null, null);
    }

    public static ValidationIssue forWall(ValidationCode code, String message, String wallId) {
        return new ValidationIssue(code, message, wallId, ElementType.WALL);
    }

    public static ValidationIssue forRoom(ValidationCode code, String message, String roomId) {
        return new ValidationIssue(code, message, roomId, ElementType.ROOM);
    }

    public static ValidationIssue forFixture(ValidationCode code, String message, String fixtureId) {
        return new ValidationIssue(code, message, fixtureId, ElementType.FIXTURE);
    }

    public ValidationCode getCode() { return code; }
    public Severity getSeverity() { return code.getSeverity(); }
    public String getMessage() { return message; }
    public String getElementId() { return elementId; }
    public ElementType getElementType() { return elementType; }

    public boolean isError() {
        return getSeverity() == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(getSeverity()).append("] ");
        sb.append(code.getCode()).append(": ").append(message);
        if (elementId != null) {
            sb.append(" (").append(elementType != null ? elementType.getName() : "element")
              .append(" ").append(elementId).append(")");
        }
        return sb.toString();
    }
}
