package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.topology.TopologyOptions;
import nl.bytesoflife.deltasketch.topology.WallGraph;
import nl.bytesoflife.deltasketch.validation.SketchCheck;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags walls that share no endpoint with any other wall.
 */
public class ConnectivityCheck implements SketchCheck {

    private final TopologyOptions options;

    public ConnectivityCheck() {
        this(TopologyOptions.DEFAULT);
    }

    public ConnectivityCheck(TopologyOptions options) {
        this.options = options;
    }

    @Override
    public List<ValidationIssue> check(SketchDocument document) {
        List<ValidationIssue> issues = new ArrayList<>();
        WallGraph graph = WallGraph.build(document.getWalls(), options);
        for (String wallId : graph.isolatedWallIds()) {
            issues.add(ValidationIssue.forWall(ValidationCode.WALL_DISCONNECTED,
                    "Wall is not connected to other walls", wallId));
        }
        return issues;
    }
}
