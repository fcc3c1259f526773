package nl.bytesoflife.deltasketch.model;

public enum RoomType {
    LIVING_ROOM,
    BEDROOM,
    KITCHEN,
    BATHROOM,
    DINING_ROOM,
    OFFICE,
    HALLWAY,
    CLOSET,
    UTILITY,
    GARAGE,
    BASEMENT,
    ATTIC,
    OTHER
}
