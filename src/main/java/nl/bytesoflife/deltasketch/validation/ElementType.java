package nl.bytesoflife.deltasketch.validation;

public enum ElementType {
    WALL,
    ROOM,
    FIXTURE;

    public String getName() {
        return name().toLowerCase();
    }
}
