package nl.bytesoflife.deltasketch.geometry;

import java.util.List;
import java.util.Optional;

/**
 * Point, vector and line operations in drawing space.
 * Every operation is total: degenerate input yields a documented default instead of an exception.
 */
public final class GeometryUtils {

    /** Cross products and determinants below this magnitude are treated as zero. */
    public static final double EPSILON = 1e-10;

    private GeometryUtils() {
    }

    public static double distance(Point p1, Point p2) {
        return Math.sqrt(distanceSquared(p1, p2));
    }

    public static double distanceSquared(Point p1, Point p2) {
        double dx = p2.x() - p1.x();
        double dy = p2.y() - p1.y();
        return dx * dx + dy * dy;
    }

    public static Point midpoint(Point p1, Point p2) {
        return new Point((p1.x() + p2.x()) / 2, (p1.y() + p2.y()) / 2);
    }

    public static Point add(Point p1, Point p2) {
        return new Point(p1.x() + p2.x(), p1.y() + p2.y());
    }

    public static Point subtract(Point p1, Point p2) {
        return new Point(p1.x() - p2.x(), p1.y() - p2.y());
    }

    public static Point scale(Point p, double factor) {
        return new Point(p.x() * factor, p.y() * factor);
    }

    /**
     * Rotate {@code p} about {@code center} by {@code angle} radians.
     * Positive angles turn counter-clockwise when the y axis points up.
     */
    public static Point rotate(Point p, Point center, double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double dx = p.x() - center.x();
        double dy = p.y() - center.y();
        return new Point(
                center.x() + dx * cos - dy * sin,
                center.y() + dx * sin + dy * cos);
    }

    /**
     * Unit vector in the direction of {@code p}, or the zero vector when {@code p} has no length.
     */
    public static Point normalize(Point p) {
        double len = Math.sqrt(p.x() * p.x() + p.y() * p.y());
        if (len == 0) return Point.ORIGIN;
        return new Point(p.x() / len, p.y() / len);
    }

    public static double dotProduct(Point p1, Point p2) {
        return p1.x() * p2.x() + p1.y() * p2.y();
    }

    public static double crossProduct(Point p1, Point p2) {
        return p1.x() * p2.y() - p1.y() * p2.x();
    }

    public static double lineAngle(Point from, Point to) {
        return Math.atan2(to.y() - from.y(), to.x() - from.x());
    }

    public static Point perpendicular(Point from, Point to) {
        Point direction = normalize(subtract(to, from));
        return new Point(-direction.y(), direction.x());
    }

    public static Point pointOnLine(Point from, Point to, double distance) {
        Point direction = normalize(subtract(to, from));
        return add(from, scale(direction, distance));
    }

    /**
     * Projection of {@code point} onto the segment, clamped to its endpoints.
     * A zero-length segment projects everything onto its start.
     */
    public static Point closestPointOnSegment(Point point, Point segmentStart, Point segmentEnd) {
        Point segment = subtract(segmentEnd, segmentStart);
        Point toPoint = subtract(point, segmentStart);

        double lengthSquared = dotProduct(segment, segment);
        if (lengthSquared == 0) return segmentStart;

        double t = Math.max(0, Math.min(1, dotProduct(toPoint, segment) / lengthSquared));
        return add(segmentStart, scale(segment, t));
    }

    public static double distanceToSegment(Point point, Point segmentStart, Point segmentEnd) {
        return distance(point, closestPointOnSegment(point, segmentStart, segmentEnd));
    }

    public static boolean segmentsIntersect(Point p1, Point q1, Point p2, Point q2) {
        int o1 = orientation(p1, q1, p2);
        int o2 = orientation(p1, q1, q2);
        int o3 = orientation(p2, q2, p1);
        int o4 = orientation(p2, q2, q1);

        if (o1 != o2 && o3 != o4) return true;

        // Collinear cases
        if (o1 == 0 && onSegment(p1, p2, q1)) return true;
        if (o2 == 0 && onSegment(p1, q2, q1)) return true;
        if (o3 == 0 && onSegment(p2, p1, q2)) return true;
        return o4 == 0 && onSegment(p2, q1, q2);
    }

    /**
     * Intersection of the infinite lines through (p1, p2) and (p3, p4).
     * Empty when the lines are parallel or coincident.
     */
    public static Optional<Point> lineIntersection(Point p1, Point p2, Point p3, Point p4) {
        double denom = (p1.x() - p2.x()) * (p3.y() - p4.y()) - (p1.y() - p2.y()) * (p3.x() - p4.x());
        if (Math.abs(denom) < EPSILON) return Optional.empty();

        double t = ((p1.x() - p3.x()) * (p3.y() - p4.y()) - (p1.y() - p3.y()) * (p3.x() - p4.x())) / denom;
        return Optional.of(new Point(
                p1.x() + t * (p2.x() - p1.x()),
                p1.y() + t * (p2.y() - p1.y())));
    }

    /**
     * Length of the closed ring through {@code points}, including the edge back to the first point.
     */
    public static double perimeter(List<Point> points) {
        if (points.size() < 2) return 0;
        double perimeter = 0;
        for (int i = 0; i < points.size(); i++) {
            perimeter += distance(points.get(i), points.get((i + 1) % points.size()));
        }
        return perimeter;
    }

    public static Point snapToGrid(Point point, double gridSize) {
        if (gridSize <= 0) return point;
        return new Point(
                Math.round(point.x() / gridSize) * gridSize,
                Math.round(point.y() / gridSize) * gridSize);
    }

    /**
     * The nearest candidate strictly closer than {@code tolerance}, or {@code point} itself.
     */
    public static Point snapToPoints(Point point, List<Point> candidates, double tolerance) {
        Point closest = point;
        double best = tolerance;
        for (Point candidate : candidates) {
            double d = distance(point, candidate);
            if (d < best) {
                best = d;
                closest = candidate;
            }
        }
        return closest;
    }

    /**
     * Snap onto the nearest segment, given as consecutive (start, end) pairs.
     */
    public static Point snapToSegments(Point point, List<Point[]> segments, double tolerance) {
        Point closest = point;
        double best = tolerance;
        for (Point[] segment : segments) {
            Point candidate = closestPointOnSegment(point, segment[0], segment[1]);
            double d = distance(point, candidate);
            if (d < best) {
                best = d;
                closest = candidate;
            }
        }
        return closest;
    }

    // 0 = collinear, 1 = clockwise, 2 = counter-clockwise
    static int orientation(Point p, Point q, Point r) {
        double val = (q.y() - p.y()) * (r.x() - q.x()) - (q.x() - p.x()) * (r.y() - q.y());
        if (Math.abs(val) < EPSILON) return 0;
        return val > 0 ? 1 : 2;
    }

    private static boolean onSegment(Point p, Point q, Point r) {
        return q.x() <= Math.max(p.x(), r.x()) && q.x() >= Math.min(p.x(), r.x())
                && q.y() <= Math.max(p.y(), r.y()) && q.y() >= Math.min(p.y(), r.y());
    }
}
