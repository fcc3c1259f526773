package nl.bytesoflife.deltasketch.topology;

import java.util.List;
import java.util.Optional;

/**
 * Treats the loop enclosing the largest area as the outer boundary. This is a heuristic: two
 * loops of near-equal area may be classified the wrong way round. Ties go to the loop found first.
 */
public class LargestLoopStrategy implements OuterBoundaryStrategy {

    @Override
    public Optional<TraceResult> selectOuter(List<TraceResult> loops) {
        TraceResult best = null;
        double bestArea = -1;
        for (TraceResult loop : loops) {
            double area = loop.area();
            if (area > bestArea) {
                bestArea = area;
                best = loop;
            }
        }
        return Optional.ofNullable(best);
    }
}
