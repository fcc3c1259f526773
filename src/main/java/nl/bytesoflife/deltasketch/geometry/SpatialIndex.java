package nl.bytesoflife.deltasketch.geometry;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * STR-tree over tagged points, used to find nearby wall endpoints without an all-pairs scan.
 *
 * @param <T> the payload stored with each point
 */
public class SpatialIndex<T> {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    public void insert(Point point, T item) {
        if (built) {
            throw new IllegalStateException("Index is already built");
        }
        if (!point.isFinite()) {
            return;
        }
        tree.insert(new Envelope(point.x(), point.x(), point.y(), point.y()), new Entry<>(point, item));
    }

    /**
     * Items whose point lies strictly closer than {@code maxDistance} to {@code point}.
     */
    @SuppressWarnings("unchecked")
    public List<Entry<T>> queryWithin(Point point, double maxDistance) {
        ensureBuilt();
        if (!point.isFinite()) {
            return List.of();
        }
        Envelope searchEnvelope = new Envelope(point.x(), point.x(), point.y(), point.y());
        searchEnvelope.expandBy(maxDistance);

        List<Entry<T>> result = new ArrayList<>();
        for (Object candidate : tree.query(searchEnvelope)) {
            Entry<T> entry = (Entry<T>) candidate;
            if (GeometryUtils.distance(point, entry.point()) < maxDistance) {
                result.add(entry);
            }
        }
        return result;
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    public record Entry<T>(Point point, T item) {}
}
