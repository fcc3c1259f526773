package nl.bytesoflife.deltasketch.model;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.measurement.Measurement;

import java.util.ArrayList;
import java.util.List;

/**
 * A room bounded by walls. {@code boundary}, {@code dimensions} and {@code areas} are derived by
 * the engine and returned as updated copies; they are never authored directly.
 *
 * @param wallIds       ids of the bounding walls; may reference deleted walls
 * @param boundary      ordered closed polygon traced from the walls
 * @param dimensions    bounding-box width and height of the boundary, in feet
 * @param ceilingHeight ceiling height, or null for the 8' default
 */
public record SketchRoom(
        String id,
        String name,
        RoomType type,
        List<String> wallIds,
        List<Point> boundary,
        Dimensions dimensions,
        AreaCalculation areas,
        Measurement ceilingHeight,
        String floorMaterial,
        String notes
) {
    public SketchRoom {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Room id must not be blank");
        }
        if (type == null) {
            type = RoomType.OTHER;
        }
        wallIds = wallIds == null ? List.of() : List.copyOf(wallIds);
        boundary = boundary == null ? List.of() : List.copyOf(boundary);
        if (dimensions == null) {
            dimensions = Dimensions.ZERO;
        }
        if (areas == null) {
            areas = AreaCalculation.ZERO;
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Measurement effectiveCeilingHeight() {
        return ceilingHeight != null ? ceilingHeight : SketchDefaults.DEFAULT_CEILING_HEIGHT;
    }

    public SketchRoom withBoundary(List<Point> newBoundary) {
        return new SketchRoom(id, name, type, wallIds, newBoundary, dimensions, areas, ceilingHeight, floorMaterial, notes);
    }

    public SketchRoom withDimensions(Dimensions newDimensions) {
        return new SketchRoom(id, name, type, wallIds, boundary, newDimensions, areas, ceilingHeight, floorMaterial, notes);
    }

    public SketchRoom withAreas(AreaCalculation newAreas) {
        return new SketchRoom(id, name, type, wallIds, boundary, dimensions, newAreas, ceilingHeight, floorMaterial, notes);
    }

    public static class Builder {
        private final String id;
        private String name = SketchDefaults.DEFAULT_ROOM_NAME;
        private RoomType type = RoomType.OTHER;
        private final List<String> wallIds = new ArrayList<>();
        private List<Point> boundary = List.of();
        private Dimensions dimensions = Dimensions.ZERO;
        private AreaCalculation areas = AreaCalculation.ZERO;
        private Measurement ceilingHeight = SketchDefaults.DEFAULT_CEILING_HEIGHT;
        private String floorMaterial = "";
        private String notes = "";

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(RoomType type) {
            this.type = type;
            return this;
        }

        public Builder walls(String... ids) {
            this.wallIds.addAll(List.of(ids));
            return this;
        }

        public Builder walls(List<String> ids) {
            this.wallIds.addAll(ids);
            return this;
        }

        public Builder boundary(List<Point> boundary) {
            this.boundary = boundary;
            return this;
        }

        public Builder dimensions(Dimensions dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder areas(AreaCalculation areas) {
            this.areas = areas;
            return this;
        }

        public Builder ceilingHeight(Measurement ceilingHeight) {
            this.ceilingHeight = ceilingHeight;
            return this;
        }

        public Builder floorMaterial(String floorMaterial) {
            this.floorMaterial = floorMaterial;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public SketchRoom build() {
            return new SketchRoom(id, name, type, wallIds, boundary, dimensions, areas, ceilingHeight, floorMaterial, notes);
        }
    }
}
