package nl.bytesoflife.deltasketch.estimate;

import java.util.Locale;

/**
 * Cost breakdown for one room.
 */
public record CostEstimation(
        CostLine flooring,
        CostLine paint,
        CostLine trim,
        LaborLine labor,
        double grandTotal
) {
    /**
     * @param quantity  square feet or linear feet, depending on the line
     */
    public record CostLine(double quantity, double unitPrice, double total) {}

    public record LaborLine(int hours, double hourlyRate, double total) {}

    @Override
    public String toString() {
        return String.format(Locale.US,
                "Cost Estimation: flooring=%.2f, paint=%.2f, trim=%.2f, labor=%.2f (%d h), total=%.2f",
                flooring.total(), paint.total(), trim.total(), labor.total(), labor.hours(), grandTotal);
    }
}
