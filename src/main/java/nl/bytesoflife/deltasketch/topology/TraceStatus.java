package nl.bytesoflife.deltasketch.topology;

public enum TraceStatus {
    /** The walk returned to its first point. */
    CLOSED_LOOP,
    /** The walk visited at least two walls but stopped before closing. */
    OPEN_CHAIN,
    /** No wall could be chained onto the starting wall, or there were no walls at all. */
    NO_CONNECTABLE_WALLS
}
