package nl.bytesoflife.deltasketch.geometry;

import java.util.List;

public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

    public static BoundingBox of(List<Point> points) {
        if (points == null || points.isEmpty()) {
            return EMPTY;
        }
        double minX = points.get(0).x(), maxX = minX;
        double minY = points.get(0).y(), maxY = minY;
        for (int i = 1; i < points.size(); i++) {
            Point p = points.get(i);
            if (p.x() < minX) minX = p.x();
            if (p.x() > maxX) maxX = p.x();
            if (p.y() < minY) minY = p.y();
            if (p.y() > maxY) maxY = p.y();
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public boolean contains(Point p) {
        return p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY;
    }
}
