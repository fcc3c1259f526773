package nl.bytesoflife.deltasketch.model;

public enum FixtureCategory {
    DOOR,
    WINDOW,
    CABINET,
    VANITY,
    APPLIANCE,
    ELECTRICAL,
    PLUMBING,
    OTHER;

    public static FixtureCategory fromName(String name) {
        if (name == null) return OTHER;
        return switch (name.trim().toLowerCase()) {
            case "door" -> DOOR;
            case "window" -> WINDOW;
            case "cabinet" -> CABINET;
            case "vanity" -> VANITY;
            case "appliance" -> APPLIANCE;
            case "electrical" -> ELECTRICAL;
            case "plumbing" -> PLUMBING;
            default -> OTHER;
        };
    }
}
