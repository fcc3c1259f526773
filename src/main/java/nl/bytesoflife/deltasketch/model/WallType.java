package nl.bytesoflife.deltasketch.model;

public enum WallType {
    EXTERIOR,
    INTERIOR,
    LOAD_BEARING
}
