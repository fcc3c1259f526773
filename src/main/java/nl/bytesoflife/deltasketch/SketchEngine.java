package nl.bytesoflife.deltasketch;

import nl.bytesoflife.deltasketch.area.AreaCalculator;
import nl.bytesoflife.deltasketch.area.SketchAreas;
import nl.bytesoflife.deltasketch.estimate.CostEstimation;
import nl.bytesoflife.deltasketch.estimate.CostEstimator;
import nl.bytesoflife.deltasketch.estimate.MaterialCalculation;
import nl.bytesoflife.deltasketch.estimate.MaterialCalculator;
import nl.bytesoflife.deltasketch.estimate.MaterialOptions;
import nl.bytesoflife.deltasketch.estimate.UnitPrices;
import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.model.SketchRoom;
import nl.bytesoflife.deltasketch.model.Wall;
import nl.bytesoflife.deltasketch.topology.BoundaryTracer;
import nl.bytesoflife.deltasketch.topology.OuterBoundaryStrategy;
import nl.bytesoflife.deltasketch.topology.TopologyOptions;
import nl.bytesoflife.deltasketch.topology.TraceResult;
import nl.bytesoflife.deltasketch.validation.SketchValidator;
import nl.bytesoflife.deltasketch.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for recomputing a sketch: traces room boundaries from their walls, measures the
 * rooms, and on request derives materials and costs. The input document is never modified;
 * every method returns new values for the host to merge back.
 *
 * <pre>
 * SketchEngine engine = new SketchEngine()
 *     .withTopologyOptions(new TopologyOptions(5))
 *     .withParallelRooms(true);
 * SketchDocument updated = engine.recalculate(document);
 * ValidationResult validation = engine.validate(updated);
 * </pre>
 */
public class SketchEngine {

    private static final Logger log = LoggerFactory.getLogger(SketchEngine.class);

    private TopologyOptions topologyOptions = TopologyOptions.DEFAULT;
    private OuterBoundaryStrategy outerBoundaryStrategy;
    private boolean parallelRooms;

    public SketchEngine withTopologyOptions(TopologyOptions options) {
        this.topologyOptions = options;
        return this;
    }

    public SketchEngine withOuterBoundaryStrategy(OuterBoundaryStrategy strategy) {
        this.outerBoundaryStrategy = strategy;
        return this;
    }

    /**
     * Compute rooms concurrently. Rooms share no state, so results are identical either way.
     */
    public SketchEngine withParallelRooms(boolean enabled) {
        this.parallelRooms = enabled;
        return this;
    }

    public BoundaryTracer boundaryTracer() {
        BoundaryTracer tracer = new BoundaryTracer().withOptions(topologyOptions);
        if (outerBoundaryStrategy != null) {
            tracer.withOuterBoundaryStrategy(outerBoundaryStrategy);
        }
        return tracer;
    }

    /**
     * Wall adjacency for the whole document, keyed by wall id.
     */
    public Map<String, List<String>> connections(SketchDocument document) {
        return boundaryTracer().buildGraph(document.getWalls()).adjacency();
    }

    /**
     * Copy of the document in which every wall's connected wall ids reflect the current geometry.
     */
    public SketchDocument connectWalls(SketchDocument document) {
        Map<String, List<String>> adjacency = connections(document);
        List<Wall> walls = new ArrayList<>();
        for (Wall wall : document.getWalls()) {
            walls.add(wall.withConnectedWallIds(adjacency.getOrDefault(wall.id(), List.of())));
        }
        return document.withWalls(walls);
    }

    /**
     * Copy of the document with each room's boundary retraced from its walls.
     */
    public SketchDocument traceRooms(SketchDocument document) {
        BoundaryTracer tracer = boundaryTracer();
        List<SketchRoom> rooms = new ArrayList<>();
        for (SketchRoom room : document.getRooms()) {
            TraceResult trace = tracer.trace(document.wallsOf(room));
            if (!trace.isClosed() && !room.wallIds().isEmpty()) {
                log.warn("Room {} ({}) does not close: {} over {} of {} walls",
                        room.id(), room.name(), trace.status(), trace.wallIds().size(), room.wallIds().size());
            }
            rooms.add(room.withBoundary(trace.points()));
        }
        return document.withRooms(rooms);
    }

    /**
     * Measurements for the document as given, using the rooms' stored boundaries.
     */
    public SketchAreas calculate(SketchDocument document) {
        return new AreaCalculator(document.getPixelsPerFoot()).calculateSketchAreas(document, parallelRooms);
    }

    /**
     * Full pipeline: retrace boundaries, then measure every room.
     */
    public SketchAreas measure(SketchDocument document) {
        return calculate(traceRooms(document));
    }

    /**
     * Copy of the document with connections, boundaries, areas and dimensions all recomputed.
     */
    public SketchDocument recalculate(SketchDocument document) {
        SketchDocument traced = traceRooms(connectWalls(document));
        SketchAreas areas = calculate(traced);
        log.debug("Recalculated sketch {}: {}", document.getName(), areas.getTotals());
        return areas.applyTo(traced);
    }

    public MaterialCalculation materials(SketchRoom room, SketchDocument document, MaterialOptions options) {
        return new MaterialCalculator()
                .withOptions(options)
                .calculate(room, document.getWalls(), document.getWallFixtures());
    }

    public CostEstimation costs(SketchRoom room, SketchDocument document, MaterialOptions options, UnitPrices prices) {
        return new CostEstimator().withPrices(prices).estimate(materials(room, document, options));
    }

    public ValidationResult validate(SketchDocument document) {
        ValidationResult result = SketchValidator.withDefaultChecks(topologyOptions).validate(document);
        if (!result.isValid()) {
            log.debug("Sketch {} failed validation with {} errors", document.getName(), result.getErrors().size());
        }
        return result;
    }
}
