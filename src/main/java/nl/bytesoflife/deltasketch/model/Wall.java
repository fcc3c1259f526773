package nl.bytesoflife.deltasketch.model;

import nl.bytesoflife.deltasketch.geometry.GeometryUtils;
import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.measurement.Measurement;
import nl.bytesoflife.deltasketch.measurement.Measurements;

import java.util.ArrayList;
import java.util.List;

/**
 * A wall segment as drawn by the user.
 *
 * @param id               wall identity
 * @param start            start point in drawing space
 * @param end              end point in drawing space
 * @param thickness        thickness in inches
 * @param height           wall height
 * @param type             structural role
 * @param fixtureIds       ids of the fixtures mounted on this wall; may reference deleted fixtures
 * @param roomId           owning room, or null
 * @param connectedWallIds ids of walls sharing an endpoint, as last recorded by the host
 */
public record Wall(
        String id,
        Point start,
        Point end,
        double thickness,
        Measurement height,
        WallType type,
        List<String> fixtureIds,
        String roomId,
        List<String> connectedWallIds
) {
    public Wall {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Wall id must not be blank");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("Wall endpoints must not be null");
        }
        if (height == null) {
            height = SketchDefaults.DEFAULT_WALL_HEIGHT;
        }
        if (type == null) {
            type = WallType.INTERIOR;
        }
        fixtureIds = fixtureIds == null ? List.of() : List.copyOf(fixtureIds);
        connectedWallIds = connectedWallIds == null ? List.of() : List.copyOf(connectedWallIds);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public double pixelLength() {
        return GeometryUtils.distance(start, end);
    }

    public double lengthInFeet(double pixelsPerFoot) {
        return Measurements.pixelsToFeet(pixelLength(), pixelsPerFoot);
    }

    public Measurement length(double pixelsPerFoot) {
        return Measurements.measureDistance(start, end, pixelsPerFoot);
    }

    public Wall withConnectedWallIds(List<String> ids) {
        return new Wall(id, start, end, thickness, height, type, fixtureIds, roomId, ids);
    }

    public static class Builder {
        private final String id;
        private Point start = Point.ORIGIN;
        private Point end = Point.ORIGIN;
        private double thickness = SketchDefaults.DEFAULT_WALL_THICKNESS_INCHES;
        private Measurement height = SketchDefaults.DEFAULT_WALL_HEIGHT;
        private WallType type = WallType.INTERIOR;
        private final List<String> fixtureIds = new ArrayList<>();
        private String roomId;
        private final List<String> connectedWallIds = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder from(double x, double y) {
            this.start = new Point(x, y);
            return this;
        }

        public Builder to(double x, double y) {
            this.end = new Point(x, y);
            return this;
        }

        public Builder start(Point start) {
            this.start = start;
            return this;
        }

        public Builder end(Point end) {
            this.end = end;
            return this;
        }

        public Builder thickness(double inches) {
            this.thickness = inches;
            return this;
        }

        public Builder height(Measurement height) {
            this.height = height;
            return this;
        }

        public Builder type(WallType type) {
            this.type = type;
            return this;
        }

        public Builder fixture(String fixtureId) {
            this.fixtureIds.add(fixtureId);
            return this;
        }

        public Builder roomId(String roomId) {
            this.roomId = roomId;
            return this;
        }

        public Builder connectedTo(String... wallIds) {
            this.connectedWallIds.addAll(List.of(wallIds));
            return this;
        }

        public Wall build() {
            return new Wall(id, start, end, thickness, height, type, fixtureIds, roomId, connectedWallIds);
        }
    }
}
