package nl.bytesoflife.deltasketch.area;

import java.util.List;

public record WallAreaSummary(double totalArea, double netArea, List<WallAreaDetail> details) {

    public WallAreaSummary {
        details = List.copyOf(details);
    }
}
