package nl.bytesoflife.deltasketch.estimate;

import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds an {@link AreaSummary} from a document whose room areas are already calculated.
 */
public class AreaSummaryGenerator {

    private MaterialOptions materialOptions = MaterialOptions.DEFAULT;

    public AreaSummaryGenerator withMaterialOptions(MaterialOptions options) {
        this.materialOptions = options;
        return this;
    }

    public AreaSummary generate(SketchDocument document) {
        return generate(document, false, null);
    }

    /**
     * @param includeEstimates whether to compute materials per room
     * @param unitPrices       prices for cost estimates, or null to skip costs
     */
    public AreaSummary generate(SketchDocument document, boolean includeEstimates, UnitPrices unitPrices) {
        MaterialCalculator materialCalculator = new MaterialCalculator().withOptions(materialOptions);
        CostEstimator costEstimator = unitPrices != null ? new CostEstimator().withPrices(unitPrices) : null;

        List<AreaSummary.RoomLine> lines = new ArrayList<>();
        double floor = 0, wall = 0, volume = 0, perimeter = 0, cost = 0;

        for (SketchRoom room : document.getRooms()) {
            MaterialCalculation materials = null;
            CostEstimation costs = null;
            if (includeEstimates) {
                materials = materialCalculator.calculate(room, document.getWalls(), document.getWallFixtures());
                if (costEstimator != null) {
                    costs = costEstimator.estimate(materials);
                    cost += costs.grandTotal();
                }
            }
            lines.add(new AreaSummary.RoomLine(
                    room.name(), room.type(),
                    room.areas().floorArea(), room.areas().wallArea(),
                    room.areas().volume(), room.areas().perimeter(),
                    materials, costs));

            floor += room.areas().floorArea();
            wall += room.areas().wallArea();
            volume += room.areas().volume();
            perimeter += room.areas().perimeter();
        }

        Double estimatedCost = includeEstimates && costEstimator != null ? cost : null;
        return new AreaSummary(
                document.getName(),
                document.getRooms().size(),
                document.getWalls().size(),
                lines,
                new AreaSummary.Totals(floor, wall, volume, perimeter, estimatedCost));
    }
}
