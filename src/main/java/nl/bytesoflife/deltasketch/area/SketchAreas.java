package nl.bytesoflife.deltasketch.area;

import nl.bytesoflife.deltasketch.geometry.BoundingBox;
import nl.bytesoflife.deltasketch.model.AreaCalculation;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-room and document-wide measurements for a sketch.
 */
public class SketchAreas {

    private final List<RoomAreas> rooms;
    private final AreaCalculation totals;
    private final BoundingBox bounds;

    public SketchAreas(List<RoomAreas> rooms, AreaCalculation totals, BoundingBox bounds) {
        this.rooms = List.copyOf(rooms);
        this.totals = totals;
        this.bounds = bounds;
    }

    public List<RoomAreas> getRooms() {
        return rooms;
    }

    public Optional<RoomAreas> getRoom(String roomId) {
        return rooms.stream().filter(r -> r.roomId().equals(roomId)).findFirst();
    }

    public AreaCalculation getTotals() {
        return totals;
    }

    /**
     * Bounding box of every wall endpoint in drawing units; empty for a document without walls.
     */
    public Optional<BoundingBox> getBounds() {
        return Optional.ofNullable(bounds);
    }

    /**
     * Copy of {@code document} with each room's areas and dimensions replaced by these values.
     */
    public SketchDocument applyTo(SketchDocument document) {
        Map<String, RoomAreas> byId = rooms.stream()
                .collect(Collectors.toMap(RoomAreas::roomId, Function.identity(), (a, b) -> a));
        List<SketchRoom> updated = new ArrayList<>();
        for (SketchRoom room : document.getRooms()) {
            RoomAreas values = byId.get(room.id());
            updated.add(values == null ? room : room.withAreas(values.areas()).withDimensions(values.dimensions()));
        }
        return document.withRooms(updated);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sketch Areas:\n");
        sb.append(String.format(Locale.US, "  Floor: %.2f sq ft, walls: %.2f sq ft (net %.2f), volume: %.2f cu ft, perimeter: %.2f ft%n",
                totals.floorArea(), totals.wallArea(), totals.netWallArea(), totals.volume(), totals.perimeter()));
        for (RoomAreas room : rooms) {
            sb.append(String.format(Locale.US, "  - %s: %.2f sq ft%n", room.roomId(), room.areas().floorArea()));
        }
        return sb.toString();
    }
}
