package nl.bytesoflife.deltasketch.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts traced boundaries and wall segments into JTS geometries, the structured form handed
 * to export encoders and used for topological sanity checks.
 */
public class SketchGeometryConverter {

    private final GeometryFactory factory = new GeometryFactory();

    public LineString toLineString(Point start, Point end) {
        return factory.createLineString(new Coordinate[]{
                new Coordinate(start.x(), start.y()),
                new Coordinate(end.x(), end.y())
        });
    }

    /**
     * Closed ring through the boundary points, or null when fewer than three distinct vertices remain.
     */
    public LinearRing toRing(List<Point> boundary) {
        List<Coordinate> coords = new ArrayList<>();
        for (Point p : boundary) {
            Coordinate c = new Coordinate(p.x(), p.y());
            if (coords.isEmpty() || !coords.get(coords.size() - 1).equals2D(c)) {
                coords.add(c);
            }
        }
        if (coords.size() > 1 && coords.get(0).equals2D(coords.get(coords.size() - 1))) {
            coords.remove(coords.size() - 1);
        }
        if (coords.size() < 3) {
            return null;
        }
        coords.add(new Coordinate(coords.get(0)));
        return factory.createLinearRing(coords.toArray(new Coordinate[0]));
    }

    /**
     * Polygon with holes. Holes that do not form a ring are skipped; an outer boundary that does
     * not form a ring yields an empty polygon.
     */
    public Polygon toPolygon(List<Point> outer, List<List<Point>> holes) {
        LinearRing shell = toRing(outer);
        if (shell == null) {
            return factory.createPolygon();
        }
        List<LinearRing> rings = new ArrayList<>();
        for (List<Point> hole : holes) {
            LinearRing ring = toRing(hole);
            if (ring != null) {
                rings.add(ring);
            }
        }
        return factory.createPolygon(shell, rings.toArray(new LinearRing[0]));
    }

    /**
     * Whether the closed boundary crosses itself. Boundaries too short to form a ring count as simple.
     */
    public boolean isSelfIntersecting(List<Point> boundary) {
        LinearRing ring = toRing(boundary);
        return ring != null && !ring.isSimple();
    }
}
