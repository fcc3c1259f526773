package nl.bytesoflife.deltasketch.measurement;

import nl.bytesoflife.deltasketch.geometry.GeometryUtils;
import nl.bytesoflife.deltasketch.geometry.Point;

import java.util.List;
import java.util.Optional;

/**
 * Creation, comparison and conversion of {@link Measurement}s, plus the drawing-scale
 * conversions between pixels and feet.
 */
public final class Measurements {

    public static final int INCHES_PER_FOOT = 12;
    public static final int INCHES_PER_YARD = 36;
    public static final int DEFAULT_PRECISION = 16;
    public static final double DEFAULT_TOLERANCE = 1.0 / 16;

    private Measurements() {
    }

    public static Measurement create(double totalInches) {
        return create(totalInches, DEFAULT_PRECISION);
    }

    /**
     * Split {@code totalInches} into whole feet and inches rounded to the nearest
     * {@code 1/precision}. A remainder that rounds up to a full foot carries into {@code feet}.
     */
    public static Measurement create(double totalInches, int precision) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision denominator must be >= 1");
        }
        if (!Double.isFinite(totalInches)) {
            return new Measurement(0, 0, totalInches, precision);
        }
        int feet = (int) Math.floor(totalInches / INCHES_PER_FOOT);
        double remaining = totalInches - feet * (double) INCHES_PER_FOOT;
        double inches = Math.round(remaining * precision) / (double) precision;
        if (inches >= INCHES_PER_FOOT) {
            feet++;
            inches -= INCHES_PER_FOOT;
        }
        return new Measurement(feet, inches, totalInches, precision);
    }

    public static Measurement create(double totalInches, MeasurementOptions options) {
        return create(totalInches, options.precision());
    }

    public static Measurement fromFeetAndInches(double feet, double inches) {
        return create(feet * INCHES_PER_FOOT + inches);
    }

    public static Measurement fromFeet(double feet) {
        return create(feet * INCHES_PER_FOOT);
    }

    public static Measurement round(Measurement measurement, int precision) {
        double rounded = Math.round(measurement.getTotalInches() * precision) / (double) precision;
        return create(rounded, precision);
    }

    public static int compare(Measurement a, Measurement b) {
        return a.compareTo(b);
    }

    public static boolean equalsWithin(Measurement a, Measurement b) {
        return equalsWithin(a, b, DEFAULT_TOLERANCE);
    }

    public static boolean equalsWithin(Measurement a, Measurement b, MeasurementOptions options) {
        return equalsWithin(a, b, options.tolerance());
    }

    public static boolean equalsWithin(Measurement a, Measurement b, double tolerance) {
        return Math.abs(a.getTotalInches() - b.getTotalInches()) <= tolerance;
    }

    public static Optional<Measurement> min(List<Measurement> measurements) {
        Measurement min = null;
        for (Measurement m : measurements) {
            if (min == null || m.compareTo(min) < 0) min = m;
        }
        return Optional.ofNullable(min);
    }

    public static Optional<Measurement> max(List<Measurement> measurements) {
        Measurement max = null;
        for (Measurement m : measurements) {
            if (max == null || m.compareTo(max) > 0) max = m;
        }
        return Optional.ofNullable(max);
    }

    public static boolean isValid(Measurement m) {
        return m.getTotalInches() >= 0
                && m.getFeet() >= 0
                && m.getInches() >= 0
                && m.getInches() < INCHES_PER_FOOT
                && m.getDisplay() != null;
    }

    public static double convert(Measurement measurement, MeasurementUnit unit) {
        return unit.fromInches(measurement.getTotalInches());
    }

    /**
     * Convert to a unit given by name; unrecognized names convert to inches.
     */
    public static double convert(Measurement measurement, String unitName) {
        return convert(measurement, MeasurementUnit.fromName(unitName));
    }

    // Drawing scale

    public static double pixelsToFeet(double pixels, double pixelsPerFoot) {
        return pixels / pixelsPerFoot;
    }

    public static double feetToPixels(double feet, double pixelsPerFoot) {
        return feet * pixelsPerFoot;
    }

    public static double pixelAreaToSquareFeet(double pixelArea, double pixelsPerFoot) {
        return pixelArea / (pixelsPerFoot * pixelsPerFoot);
    }

    public static double cubicFeet(double squareFeet, Measurement height) {
        return squareFeet * height.toFeet();
    }

    public static Measurement measureDistance(Point p1, Point p2, double pixelsPerFoot) {
        return measureDistance(p1, p2, pixelsPerFoot, DEFAULT_PRECISION);
    }

    public static Measurement measureDistance(Point p1, Point p2, double pixelsPerFoot, int precision) {
        double feet = pixelsToFeet(GeometryUtils.distance(p1, p2), pixelsPerFoot);
        return create(feet * INCHES_PER_FOOT, precision);
    }
}
