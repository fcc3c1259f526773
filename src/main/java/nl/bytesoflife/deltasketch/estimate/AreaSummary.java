package nl.bytesoflife.deltasketch.estimate;

import nl.bytesoflife.deltasketch.model.RoomType;

import java.util.List;
import java.util.Locale;

/**
 * Report of a sketch's measured areas, optionally with material and cost estimates per room.
 */
public class AreaSummary {

    /**
     * @param materials null unless estimates were requested
     * @param costs     null unless estimates and unit prices were given
     */
    public record RoomLine(
            String name,
            RoomType type,
            double floorArea,
            double wallArea,
            double volume,
            double perimeter,
            MaterialCalculation materials,
            CostEstimation costs
    ) {}

    /**
     * @param estimatedCost null unless estimates and unit prices were given
     */
    public record Totals(double floorArea, double wallArea, double volume, double perimeter, Double estimatedCost) {}

    private final String sketchName;
    private final int totalRooms;
    private final int totalWalls;
    private final List<RoomLine> rooms;
    private final Totals totals;

    public AreaSummary(String sketchName, int totalRooms, int totalWalls, List<RoomLine> rooms, Totals totals) {
        this.sketchName = sketchName;
        this.totalRooms = totalRooms;
        this.totalWalls = totalWalls;
        this.rooms = List.copyOf(rooms);
        this.totals = totals;
    }

    public String getSketchName() { return sketchName; }
    public int getTotalRooms() { return totalRooms; }
    public int getTotalWalls() { return totalWalls; }
    public List<RoomLine> getRooms() { return rooms; }
    public Totals getTotals() { return totals; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Area Summary:\n");
        sb.append("  Sketch: ").append(sketchName).append("\n");
        sb.append("  Rooms: ").append(totalRooms).append(", walls: ").append(totalWalls).append("\n");
        for (RoomLine room : rooms) {
            sb.append(String.format(Locale.US, "  - %s (%s): %.2f sq ft floor, %.2f sq ft wall",
                    room.name(), room.type().name().toLowerCase(), room.floorArea(), room.wallArea()));
            if (room.costs() != null) {
                sb.append(String.format(Locale.US, ", est. %.2f", room.costs().grandTotal()));
            }
            sb.append("\n");
        }
        sb.append(String.format(Locale.US, "  Total floor area: %.2f sq ft%n", totals.floorArea()));
        if (totals.estimatedCost() != null) {
            sb.append(String.format(Locale.US, "  Estimated cost: %.2f%n", totals.estimatedCost()));
        }
        return sb.toString();
    }
}
