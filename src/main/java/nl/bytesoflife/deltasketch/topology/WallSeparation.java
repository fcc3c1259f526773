package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.model.Wall;

import java.util.List;

/**
 * Walls split into the outer boundary loop and everything else.
 *
 * @param outerWalls    walls of the selected outer loop, in walk order; empty when no loop closed
 * @param interiorWalls all other walls, in input order
 * @param loops         every closed loop that was discovered
 */
public record WallSeparation(List<Wall> outerWalls, List<Wall> interiorWalls, List<TraceResult> loops) {

    public WallSeparation {
        outerWalls = List.copyOf(outerWalls);
        interiorWalls = List.copyOf(interiorWalls);
        loops = List.copyOf(loops);
    }
}
