package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.geometry.Polygons;

import java.util.List;

/**
 * A room outline together with the interior loops cut out of it.
 */
public record BoundaryWithHoles(List<Point> outer, List<List<Point>> holes) {

    public BoundaryWithHoles {
        outer = List.copyOf(outer);
        holes = holes.stream().map(List::copyOf).toList();
    }

    /**
     * Net enclosed area in drawing units squared.
     */
    public double area() {
        return Polygons.areaWithHoles(outer, holes);
    }
}
