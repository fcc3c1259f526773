package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.geometry.Polygons;

import java.util.List;

/**
 * Outcome of one greedy boundary walk.
 *
 * @param status  how the walk ended
 * @param points  boundary points in walk order; a closed loop repeats its first point at the end
 * @param wallIds ids of the walls consumed by the walk, in walk order
 */
public record TraceResult(TraceStatus status, List<Point> points, List<String> wallIds) {

    public static final TraceResult EMPTY = new TraceResult(TraceStatus.NO_CONNECTABLE_WALLS, List.of(), List.of());

    public TraceResult {
        points = List.copyOf(points);
        wallIds = List.copyOf(wallIds);
    }

    public boolean isClosed() {
        return status == TraceStatus.CLOSED_LOOP;
    }

    public double area() {
        return Polygons.area(points);
    }
}
