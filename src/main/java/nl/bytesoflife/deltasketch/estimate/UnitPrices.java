package nl.bytesoflife.deltasketch.estimate;

/**
 * Prices used for cost estimation.
 *
 * @param flooringPerSqFt price per square foot of flooring, waste included
 * @param paintPerSqFt    price per square foot of paintable wall
 * @param trimPerLinearFt price per linear foot of trim
 * @param laborPerSqFt    labor price per square foot; the hourly rate is ten times this
 */
public record UnitPrices(
        double flooringPerSqFt,
        double paintPerSqFt,
        double trimPerLinearFt,
        double laborPerSqFt
) {
    public static final UnitPrices DEFAULT = new UnitPrices(5.0, 2.0, 3.0, 8.0);

    public UnitPrices {
        if (flooringPerSqFt < 0 || paintPerSqFt < 0 || trimPerLinearFt < 0 || laborPerSqFt < 0) {
            throw new IllegalArgumentException("Unit prices must be >= 0");
        }
    }

    public UnitPrices withFlooringPerSqFt(double price) {
        return new UnitPrices(price, paintPerSqFt, trimPerLinearFt, laborPerSqFt);
    }

    public UnitPrices withPaintPerSqFt(double price) {
        return new UnitPrices(flooringPerSqFt, price, trimPerLinearFt, laborPerSqFt);
    }

    public UnitPrices withTrimPerLinearFt(double price) {
        return new UnitPrices(flooringPerSqFt, paintPerSqFt, price, laborPerSqFt);
    }

    public UnitPrices withLaborPerSqFt(double price) {
        return new UnitPrices(flooringPerSqFt, paintPerSqFt, trimPerLinearFt, price);
    }
}
