package nl.bytesoflife.deltasketch.validation;

import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.topology.TopologyOptions;
import nl.bytesoflife.deltasketch.validation.check.ConnectivityCheck;
import nl.bytesoflife.deltasketch.validation.check.DocumentNameCheck;
import nl.bytesoflife.deltasketch.validation.check.FixtureCheck;
import nl.bytesoflife.deltasketch.validation.check.RoomCheck;
import nl.bytesoflife.deltasketch.validation.check.WallCheck;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the registered checks in registration order and collects their findings.
 * {@link #withDefaultChecks()} registers document, wall, room, fixture and connectivity checks.
 */
public class SketchValidator {

    private final List<SketchCheck> checks = new ArrayList<>();

    public static SketchValidator withDefaultChecks() {
        return withDefaultChecks(TopologyOptions.DEFAULT);
    }

    public static SketchValidator withDefaultChecks(TopologyOptions topologyOptions) {
        return new SketchValidator()
                .registerCheck(new DocumentNameCheck())
                .registerCheck(new WallCheck())
                .registerCheck(new RoomCheck())
                .registerCheck(new FixtureCheck())
                .registerCheck(new ConnectivityCheck(topologyOptions));
    }

    public SketchValidator registerCheck(SketchCheck check) {
        checks.add(check);
        return this;
    }

    public ValidationResult validate(SketchDocument document) {
        ValidationResult result = new ValidationResult();
        for (SketchCheck check : checks) {
            result.addIssues(check.check(document));
        }
        return result;
    }
}
