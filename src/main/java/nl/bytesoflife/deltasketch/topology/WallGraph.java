package nl.bytesoflife.deltasketch.topology;

import nl.bytesoflife.deltasketch.geometry.GeometryUtils;
import nl.bytesoflife.deltasketch.geometry.Point;
import nl.bytesoflife.deltasketch.geometry.SpatialIndex;
import nl.bytesoflife.deltasketch.model.Wall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Connectivity of a flat wall list. Walls are stored by index; two walls are neighbors when any
 * endpoint of one lies strictly within the tolerance of any endpoint of the other. The relation
 * is symmetric and neighbor lists are in ascending wall order.
 */
public class WallGraph {

    private final List<Wall> walls;
    private final double tolerance;
    private final List<List<Integer>> neighbors;

    private WallGraph(List<Wall> walls, double tolerance, List<List<Integer>> neighbors) {
        this.walls = walls;
        this.tolerance = tolerance;
        this.neighbors = neighbors;
    }

    public static WallGraph build(List<Wall> walls, TopologyOptions options) {
        List<Wall> arena = List.copyOf(walls);
        double tolerance = options.tolerance();

        SpatialIndex<Integer> index = new SpatialIndex<>();
        for (int i = 0; i < arena.size(); i++) {
            index.insert(arena.get(i).start(), i);
            index.insert(arena.get(i).end(), i);
        }

        List<List<Integer>> neighbors = new ArrayList<>(arena.size());
        for (int i = 0; i < arena.size(); i++) {
            Wall wall = arena.get(i);
            TreeSet<Integer> found = new TreeSet<>();
            for (Point endpoint : List.of(wall.start(), wall.end())) {
                for (SpatialIndex.Entry<Integer> entry : index.queryWithin(endpoint, tolerance)) {
                    if (entry.item() != i) {
                        found.add(entry.item());
                    }
                }
            }
            neighbors.add(List.copyOf(found));
        }
        return new WallGraph(arena, tolerance, neighbors);
    }

    public int size() {
        return walls.size();
    }

    public Wall wall(int index) {
        return walls.get(index);
    }

    public List<Wall> walls() {
        return walls;
    }

    public double tolerance() {
        return tolerance;
    }

    public List<Integer> neighbors(int index) {
        return neighbors.get(index);
    }

    public boolean matches(Point a, Point b) {
        return GeometryUtils.distance(a, b) < tolerance;
    }

    /**
     * Adjacency keyed by wall id, in wall order.
     */
    public Map<String, List<String>> adjacency() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (int i = 0; i < walls.size(); i++) {
            List<String> ids = new ArrayList<>();
            for (int n : neighbors.get(i)) {
                ids.add(walls.get(n).id());
            }
            adjacency.put(walls.get(i).id(), Collections.unmodifiableList(ids));
        }
        return Collections.unmodifiableMap(adjacency);
    }

    /**
     * Ids of walls with no neighbor at all.
     */
    public List<String> isolatedWallIds() {
        List<String> isolated = new ArrayList<>();
        for (int i = 0; i < walls.size(); i++) {
            if (neighbors.get(i).isEmpty()) {
                isolated.add(walls.get(i).id());
            }
        }
        return isolated;
    }
}
