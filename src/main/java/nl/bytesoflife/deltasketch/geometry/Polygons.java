package nl.bytesoflife.deltasketch.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Operations on simple polygons given as ordered vertex lists.
 * The closing edge from the last vertex back to the first is implicit. A repeated closing
 * vertex (as produced by the boundary tracer) adds a zero-length edge, which leaves area and
 * perimeter unchanged; {@link #simplify(List, double)} removes it first.
 */
public final class Polygons {

    private Polygons() {
    }

    /**
     * Unsigned area by the shoelace formula. Fewer than three points have no area.
     */
    public static double area(List<Point> points) {
        return Math.abs(signedArea(points));
    }

    /**
     * Signed shoelace area: positive for counter-clockwise rings in a y-up frame.
     */
    public static double signedArea(List<Point> points) {
        if (points.size() < 3) return 0;
        double sum = 0;
        for (int i = 0; i < points.size(); i++) {
            Point a = points.get(i);
            Point b = points.get((i + 1) % points.size());
            sum += a.x() * b.y() - b.x() * a.y();
        }
        return sum / 2;
    }

    /**
     * Outer area minus the sum of hole areas, never negative.
     */
    public static double areaWithHoles(List<Point> outer, List<List<Point>> holes) {
        double total = area(outer);
        for (List<Point> hole : holes) {
            total -= area(hole);
        }
        return Math.max(0, total);
    }

    /**
     * Area-weighted centroid. Degenerate (collinear) polygons fall back to the vertex mean.
     */
    public static Point centroid(List<Point> points) {
        if (points.isEmpty()) return Point.ORIGIN;

        double cx = 0, cy = 0, area = 0;
        for (int i = 0; i < points.size(); i++) {
            Point a = points.get(i);
            Point b = points.get((i + 1) % points.size());
            double cross = a.x() * b.y() - b.x() * a.y();
            area += cross;
            cx += (a.x() + b.x()) * cross;
            cy += (a.y() + b.y()) * cross;
        }
        area /= 2;

        if (Math.abs(area) < GeometryUtils.EPSILON) {
            double sx = 0, sy = 0;
            for (Point p : points) {
                sx += p.x();
                sy += p.y();
            }
            return new Point(sx / points.size(), sy / points.size());
        }
        return new Point(cx / (6 * area), cy / (6 * area));
    }

    /**
     * Ray-casting parity test. Self-intersecting polygons are not supported.
     */
    public static boolean containsPoint(List<Point> polygon, Point point) {
        if (polygon.size() < 3) return false;

        boolean inside = false;
        for (int i = 0, j = polygon.size() - 1; i < polygon.size(); j = i++) {
            Point pi = polygon.get(i);
            Point pj = polygon.get(j);
            if ((pi.y() > point.y()) != (pj.y() > point.y())
                    && point.x() < (pj.x() - pi.x()) * (point.y() - pi.y()) / (pj.y() - pi.y()) + pi.x()) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * True when every vertex of {@code inner} lies inside {@code outer} and no edges of the two
     * boundaries cross.
     */
    public static boolean containsPolygon(List<Point> outer, List<Point> inner) {
        if (outer.size() < 3 || inner.size() < 3) return false;

        for (Point p : inner) {
            if (!containsPoint(outer, p)) return false;
        }
        for (int i = 0; i < inner.size(); i++) {
            Point a1 = inner.get(i);
            Point a2 = inner.get((i + 1) % inner.size());
            for (int j = 0; j < outer.size(); j++) {
                Point b1 = outer.get(j);
                Point b2 = outer.get((j + 1) % outer.size());
                if (GeometryUtils.segmentsIntersect(a1, a2, b1, b2)) return false;
            }
        }
        return true;
    }

    public static boolean isClockwise(List<Point> points) {
        double sum = 0;
        for (int i = 0; i < points.size(); i++) {
            Point a = points.get(i);
            Point b = points.get((i + 1) % points.size());
            sum += (b.x() - a.x()) * (b.y() + a.y());
        }
        return sum > 0;
    }

    public static List<Point> reverse(List<Point> points) {
        List<Point> reversed = new ArrayList<>(points);
        Collections.reverse(reversed);
        return reversed;
    }

    public static List<Point> simplify(List<Point> points) {
        return simplify(points, GeometryUtils.EPSILON);
    }

    /**
     * Drop vertices whose incoming and outgoing edges are collinear within {@code tolerance}
     * (absolute cross product). Consecutive duplicates and a trailing copy of the first vertex
     * are removed beforehand, so the result is an open ring.
     */
    public static List<Point> simplify(List<Point> points, double tolerance) {
        List<Point> distinct = withoutDuplicates(points);
        if (distinct.size() < 3) return distinct;

        List<Point> simplified = new ArrayList<>();
        int n = distinct.size();
        for (int i = 0; i < n; i++) {
            Point prev = distinct.get((i - 1 + n) % n);
            Point current = distinct.get(i);
            Point next = distinct.get((i + 1) % n);

            double cross = GeometryUtils.crossProduct(
                    GeometryUtils.subtract(current, prev),
                    GeometryUtils.subtract(next, current));
            if (Math.abs(cross) > tolerance) {
                simplified.add(current);
            }
        }
        return simplified;
    }

    private static List<Point> withoutDuplicates(List<Point> points) {
        List<Point> distinct = new ArrayList<>(points.size());
        for (Point p : points) {
            if (distinct.isEmpty() || !samePoint(distinct.get(distinct.size() - 1), p)) {
                distinct.add(p);
            }
        }
        while (distinct.size() > 1 && samePoint(distinct.get(0), distinct.get(distinct.size() - 1))) {
            distinct.remove(distinct.size() - 1);
        }
        return distinct;
    }

    private static boolean samePoint(Point a, Point b) {
        return GeometryUtils.distance(a, b) < GeometryUtils.EPSILON;
    }

    public static double perimeter(List<Point> points) {
        return GeometryUtils.perimeter(points);
    }
}
