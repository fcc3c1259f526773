package nl.bytesoflife.deltasketch.topology;

import java.util.List;
import java.util.Optional;

/**
 * Chooses which of the closed wall loops of a room is its outer boundary.
 */
public interface OuterBoundaryStrategy {

    /**
     * @param loops closed loops in discovery order, never sharing a wall
     * @return the outer loop, or empty when none qualifies
     */
    Optional<TraceResult> selectOuter(List<TraceResult> loops);
}
