package nl.bytesoflife.deltasketch.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a sketch as handed over by the host.
 */
public class SketchDocument {

    private final String id;
    private final String name;
    private final List<SketchRoom> rooms;
    private final List<Wall> walls;
    private final List<WallFixture> wallFixtures;
    private final List<RoomFixture> roomFixtures;
    private final Scale scale;

    public SketchDocument(String id, String name, List<SketchRoom> rooms, List<Wall> walls,
                          List<WallFixture> wallFixtures, List<RoomFixture> roomFixtures, Scale scale) {
        this.id = id;
        this.name = name;
        this.rooms = rooms == null ? List.of() : List.copyOf(rooms);
        this.walls = walls == null ? List.of() : List.copyOf(walls);
        this.wallFixtures = wallFixtures == null ? List.of() : List.copyOf(wallFixtures);
        this.roomFixtures = roomFixtures == null ? List.of() : List.copyOf(roomFixtures);
        this.scale = scale == null ? Scale.DEFAULT : scale;
    }

    public static Builder builder() {
        return builder(SketchDefaults.DEFAULT_DOCUMENT_NAME);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<SketchRoom> getRooms() { return rooms; }
    public List<Wall> getWalls() { return walls; }
    public List<WallFixture> getWallFixtures() { return wallFixtures; }
    public List<RoomFixture> getRoomFixtures() { return roomFixtures; }
    public Scale getScale() { return scale; }

    public double getPixelsPerFoot() {
        return scale.pixelsPerFoot();
    }

    public Optional<Wall> findWall(String wallId) {
        return walls.stream().filter(w -> w.id().equals(wallId)).findFirst();
    }

    public Optional<SketchRoom> findRoom(String roomId) {
        return rooms.stream().filter(r -> r.id().equals(roomId)).findFirst();
    }

    /**
     * Walls of this document referenced by the room, in document order. Dangling ids are skipped.
     */
    public List<Wall> wallsOf(SketchRoom room) {
        Set<String> ids = new LinkedHashSet<>(room.wallIds());
        return walls.stream().filter(w -> ids.contains(w.id())).toList();
    }

    public SketchDocument withRooms(List<SketchRoom> newRooms) {
        return new SketchDocument(id, name, newRooms, walls, wallFixtures, roomFixtures, scale);
    }

    public SketchDocument withWalls(List<Wall> newWalls) {
        return new SketchDocument(id, name, rooms, newWalls, wallFixtures, roomFixtures, scale);
    }

    public static class Builder {
        private String id;
        private final String name;
        private final List<SketchRoom> rooms = new ArrayList<>();
        private final List<Wall> walls = new ArrayList<>();
        private final List<WallFixture> wallFixtures = new ArrayList<>();
        private final List<RoomFixture> roomFixtures = new ArrayList<>();
        private Scale scale = Scale.DEFAULT;

        private Builder(String name) {
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder addRoom(SketchRoom room) {
            rooms.add(room);
            return this;
        }

        public Builder addWall(Wall wall) {
            walls.add(wall);
            return this;
        }

        public Builder addWalls(List<Wall> newWalls) {
            walls.addAll(newWalls);
            return this;
        }

        public Builder addWallFixture(WallFixture fixture) {
            wallFixtures.add(fixture);
            return this;
        }

        public Builder addRoomFixture(RoomFixture fixture) {
            roomFixtures.add(fixture);
            return this;
        }

        public Builder scale(Scale scale) {
            this.scale = scale;
            return this;
        }

        public Builder pixelsPerFoot(double pixelsPerFoot) {
            this.scale = new Scale(pixelsPerFoot);
            return this;
        }

        public SketchDocument build() {
            return new SketchDocument(id, name, rooms, walls, wallFixtures, roomFixtures, scale);
        }
    }
}
