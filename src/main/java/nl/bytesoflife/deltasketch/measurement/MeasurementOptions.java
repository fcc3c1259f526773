package nl.bytesoflife.deltasketch.measurement;

/**
 * Measurement system settings.
 *
 * @param precision denominator used when rounding inches (16 = nearest sixteenth)
 * @param tolerance maximum difference in inches for two measurements to compare equal
 */
public record MeasurementOptions(int precision, double tolerance) {

    public static final MeasurementOptions DEFAULT =
            new MeasurementOptions(Measurements.DEFAULT_PRECISION, Measurements.DEFAULT_TOLERANCE);

    public MeasurementOptions {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision denominator must be >= 1");
        }
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be >= 0");
        }
    }
}
