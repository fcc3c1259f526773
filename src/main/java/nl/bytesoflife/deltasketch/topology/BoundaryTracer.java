package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.model.Wall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Traces room boundaries by walking from wall to wall through shared endpoints.
 *
 * <p>The walk is greedy: from the current point it takes the first unused wall (in input order)
 * with an endpoint within tolerance, appends that endpoint and continues from the wall's other
 * end. It stops when no wall matches or when it returns within tolerance of the first point.
 * Walls the walk never reaches are left out of the result.
 *
 * <pre>
 * BoundaryWithHoles boundary = new BoundaryTracer()
 *     .withOptions(new TopologyOptions(5))
 *     .calculateRoomBoundaryWithHoles(walls);
 * </pre>
 */
public class BoundaryTracer {

    private static final Logger log = LoggerFactory.getLogger(BoundaryTracer.class);

    private TopologyOptions options = TopologyOptions.DEFAULT;
    private OuterBoundaryStrategy outerStrategy = new LargestLoopStrategy();

    public BoundaryTracer withOptions(TopologyOptions options) {
        this.options = options;
        return this;
    }

    public BoundaryTracer withOuterBoundaryStrategy(OuterBoundaryStrategy strategy) {
        this.outerStrategy = strategy;
        return this;
    }

    public TopologyOptions getOptions() {
        return options;
    }

    public WallGraph buildGraph(List<Wall> walls) {
        return WallGraph.build(walls, options);
    }

    /**
     * Boundary points of the walk starting at the first wall. Open chains are returned as far as
     * they got; use {@link #trace(List)} to tell the outcomes apart.
     */
    public List<Point> calculateRoomBoundary(List<Wall> walls) {
        return trace(walls).points();
    }

    public TraceResult trace(List<Wall> walls) {
        if (walls.isEmpty()) {
            return TraceResult.EMPTY;
        }
        WallGraph graph = buildGraph(walls);
        TraceResult result = walk(graph, 0, new boolean[graph.size()]);
        if (!result.isClosed()) {
            log.debug("Boundary trace over {} walls ended as {} after {} walls",
                    walls.size(), result.status(), result.wallIds().size());
        }
        return result;
    }

    /**
     * Split walls into the outer loop and interior walls. Every wall not yet part of a closed loop
     * is tried as a starting point; a loop that closes claims its walls so no wall is shared
     * between loops. The outer loop is picked by the configured {@link OuterBoundaryStrategy}.
     */
    public WallSeparation separateOuterAndInteriorWalls(List<Wall> walls) {
        WallGraph graph = buildGraph(walls);
        List<TraceResult> loops = findClosedLoops(graph, allIndices(graph));

        Optional<TraceResult> outer = outerStrategy.selectOuter(loops);
        Set<String> outerIds = outer.map(o -> Set.copyOf(o.wallIds())).orElse(Set.of());

        List<Wall> outerWalls = new ArrayList<>();
        if (outer.isPresent()) {
            for (String id : outer.get().wallIds()) {
                walls.stream().filter(w -> w.id().equals(id)).findFirst().ifPresent(outerWalls::add);
            }
        }
        List<Wall> interiorWalls = walls.stream().filter(w -> !outerIds.contains(w.id())).toList();

        log.debug("Found {} closed loops among {} walls: {} outer, {} interior",
                loops.size(), walls.size(), outerWalls.size(), interiorWalls.size());
        return new WallSeparation(outerWalls, interiorWalls, loops);
    }

    /**
     * Outer boundary plus one hole per closed loop formed by the interior walls. When no outer loop
     * can be found the whole wall set is traced as the outer boundary. Interior walls that do not
     * close into a loop are dropped.
     */
    public BoundaryWithHoles calculateRoomBoundaryWithHoles(List<Wall> walls) {
        WallSeparation separation = separateOuterAndInteriorWalls(walls);

        List<Point> outer = separation.outerWalls().isEmpty()
                ? calculateRoomBoundary(walls)
                : trace(separation.outerWalls()).points();

        List<List<Point>> holes = new ArrayList<>();
        if (!separation.outerWalls().isEmpty() && !separation.interiorWalls().isEmpty()) {
            WallGraph interior = buildGraph(separation.interiorWalls());
            for (TraceResult loop : findClosedLoops(interior, allIndices(interior))) {
                holes.add(loop.points());
            }
        }
        return new BoundaryWithHoles(outer, holes);
    }

    List<TraceResult> findClosedLoops(WallGraph graph, List<Integer> candidates) {
        boolean[] consumed = new boolean[graph.size()];
        List<TraceResult> loops = new ArrayList<>();

        for (int start : candidates) {
            if (consumed[start]) continue;

            boolean[] used = consumed.clone();
            TraceResult result = walk(graph, start, used);
            if (result.isClosed()) {
                loops.add(result);
                Set<String> ids = new HashSet<>(result.wallIds());
                for (int i = 0; i < graph.size(); i++) {
                    if (ids.contains(graph.wall(i).id()) && used[i]) {
                        consumed[i] = true;
                    }
                }
            }
        }
        return loops;
    }

    /**
     * Greedy walk from {@code startIndex}. Marks every wall it takes in {@code used}.
     */
    TraceResult walk(WallGraph graph, int startIndex, boolean[] used) {
        Wall first = graph.wall(startIndex);
        List<Point> boundary = new ArrayList<>();
        List<String> wallIds = new ArrayList<>();

        boundary.add(first.start());
        wallIds.add(first.id());
        used[startIndex] = true;

        if (graph.size() == 1) {
            boundary.add(first.end());
            return new TraceResult(TraceStatus.OPEN_CHAIN, boundary, wallIds);
        }

        Point current = first.end();
        int currentWall = startIndex;

        while (true) {
            int next = -1;
            for (int candidate : graph.neighbors(currentWall)) {
                if (used[candidate]) continue;
                Wall wall = graph.wall(candidate);
                if (graph.matches(current, wall.start())) {
                    boundary.add(wall.start());
                    current = wall.end();
                    next = candidate;
                    break;
                } else if (graph.matches(current, wall.end())) {
                    boundary.add(wall.end());
                    current = wall.start();
                    next = candidate;
                    break;
                }
            }
            if (next < 0) break;
            used[next] = true;
            wallIds.add(graph.wall(next).id());
            currentWall = next;

            // back at the start: stop before other walls at the first corner are taken
            if (isClosing(graph, boundary, current)) {
                boundary.add(boundary.get(0));
                return new TraceResult(TraceStatus.CLOSED_LOOP, boundary, wallIds);
            }
        }

        TraceStatus status = wallIds.size() == 1 ? TraceStatus.NO_CONNECTABLE_WALLS : TraceStatus.OPEN_CHAIN;
        return new TraceResult(status, boundary, wallIds);
    }

    private static boolean isClosing(WallGraph graph, List<Point> boundary, Point current) {
        return boundary.size() > 2 && graph.matches(current, boundary.get(0));
    }

    private static List<Integer> allIndices(WallGraph graph) {
        List<Integer> indices = new ArrayList<>(graph.size());
        for (int i = 0; i < graph.size(); i++) {
            indices.add(i);
        }
        return indices;
    }
}
