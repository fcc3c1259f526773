package nl.bytesoflife.deltasketch.estimate;

/**
 * Prices a {@link MaterialCalculation}. Labor is estimated at one hour per ten square feet of
 * floor, rounded up.
 */
public class CostEstimator {

    private static final double SQUARE_FEET_PER_LABOR_HOUR = 10;

    private UnitPrices prices = UnitPrices.DEFAULT;

    public CostEstimator withPrices(UnitPrices prices) {
        this.prices = prices;
        return this;
    }

    public UnitPrices getPrices() {
        return prices;
    }

    public CostEstimation estimate(MaterialCalculation materials) {
        CostEstimation.CostLine flooring = new CostEstimation.CostLine(
                materials.flooringTotal(), prices.flooringPerSqFt(),
                materials.flooringTotal() * prices.flooringPerSqFt());

        CostEstimation.CostLine paint = new CostEstimation.CostLine(
                materials.paintableArea(), prices.paintPerSqFt(),
                materials.paintableArea() * prices.paintPerSqFt());

        double trimFeet = materials.trimLinearFeet();
        CostEstimation.CostLine trim = new CostEstimation.CostLine(
                trimFeet, prices.trimPerLinearFt(), trimFeet * prices.trimPerLinearFt());

        int hours = (int) Math.ceil(materials.flooringSquareFeet() / SQUARE_FEET_PER_LABOR_HOUR);
        double hourlyRate = prices.laborPerSqFt() * SQUARE_FEET_PER_LABOR_HOUR;
        CostEstimation.LaborLine labor = new CostEstimation.LaborLine(hours, hourlyRate, hours * hourlyRate);

        double grandTotal = flooring.total() + paint.total() + trim.total() + labor.total();
        return new CostEstimation(flooring, paint, trim, labor, grandTotal);
    }
}
