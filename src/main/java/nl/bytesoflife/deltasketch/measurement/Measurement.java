package nl.bytesoflife.deltasketch.measurement;

import java.util.Objects;

/**
 * An imperial length: whole feet plus fractional inches, backed by a canonical inch value.
 * Instances are created through {@link Measurements#create(double, int)} so that {@code feet},
 * {@code inches} and {@code display} always agree with {@code totalInches}.
 */
public final class Measurement implements Comparable<Measurement> {

    private final int feet;
    private final double inches;
    private final double totalInches;
    private final int precision;
    private final String display;

    Measurement(int feet, double inches, double totalInches, int precision) {
        this.feet = feet;
        this.inches = inches;
        this.totalInches = totalInches;
        this.precision = precision;
        this.display = MeasurementFormatter.format(feet, inches, false, precision);
    }

    public int getFeet() { return feet; }
    public double getInches() { return inches; }
    public double getTotalInches() { return totalInches; }
    public int getPrecision() { return precision; }
    public String getDisplay() { return display; }

    public double toFeet() {
        return totalInches / Measurements.INCHES_PER_FOOT;
    }

    @Override
    public int compareTo(Measurement other) {
        return Double.compare(totalInches, other.totalInches);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Measurement other)) return false;
        return Double.compare(totalInches, other.totalInches) == 0 && precision == other.precision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalInches, precision);
    }

    @Override
    public String toString() {
        return display;
    }
}
