package nl.bytesoflife.deltasketch.measurement;

import java.util.Locale;

/**
 * Renders measurements the way a tape measure reads: {@code 12' 6-1/2"}.
 */
public final class MeasurementFormatter {

    private MeasurementFormatter() {
    }

    public static String format(Measurement measurement) {
        return format(measurement, false);
    }

    public static String format(Measurement measurement, boolean showZeroInches) {
        return format(measurement.getFeet(), measurement.getInches(), showZeroInches, measurement.getPrecision());
    }

    static String format(int feet, double inches, boolean showZeroInches, int precision) {
        if (feet == 0 && inches == 0) {
            return "0\"";
        }
        if (feet == 0) {
            return formatInches(inches, precision);
        }
        if (inches == 0) {
            return showZeroInches ? feet + "' 0\"" : feet + "'";
        }
        return feet + "' " + formatInches(inches, precision);
    }

    public static String formatInches(double inches) {
        return formatInches(inches, Measurements.DEFAULT_PRECISION);
    }

    public static String formatInches(double inches, int precision) {
        long whole = (long) Math.floor(inches);
        double fraction = inches - whole;

        if (fraction == 0) {
            return whole + "\"";
        }
        String fractionString = decimalToFraction(fraction, precision);
        if ("1/1".equals(fractionString)) {
            return (whole + 1) + "\"";
        }
        if (whole == 0) {
            return fractionString + "\"";
        }
        return whole + "-" + fractionString + "\"";
    }

    public static String decimalToFraction(double decimal) {
        return decimalToFraction(decimal, Measurements.DEFAULT_PRECISION);
    }

    /**
     * Closest fraction to {@code decimal} among the denominators 2..precision that divide
     * {@code precision} (halves, quarters, eighths and sixteenths for the default), reduced by GCD.
     * Zero renders as {@code "0"}; a precision of 1 can only express {@code "1/1"}.
     */
    public static String decimalToFraction(double decimal, int precision) {
        if (decimal == 0) return "0";

        int closestNumerator = 1;
        int closestDenominator = precision;
        double minDiff = Math.abs(decimal - 1.0 / precision);

        for (int denominator = 2; denominator <= precision; denominator++) {
            if (precision % denominator != 0) continue;
            for (int numerator = 1; numerator < denominator; numerator++) {
                double diff = Math.abs(decimal - (double) numerator / denominator);
                if (diff < minDiff) {
                    minDiff = diff;
                    closestNumerator = numerator;
                    closestDenominator = denominator;
                }
            }
        }

        int gcd = gcd(closestNumerator, closestDenominator);
        return (closestNumerator / gcd) + "/" + (closestDenominator / gcd);
    }

    public static String formatArea(double squareFeet) {
        return formatArea(squareFeet, AreaUnit.SQUARE_FEET);
    }

    public static String formatArea(double squareFeet, AreaUnit unit) {
        return String.format(Locale.US, "%.2f %s", unit.fromSquareFeet(squareFeet), unit.getLabel());
    }

    public static String formatVolume(double cubicFeet) {
        return formatVolume(cubicFeet, VolumeUnit.CUBIC_FEET);
    }

    public static String formatVolume(double cubicFeet, VolumeUnit unit) {
        return String.format(Locale.US, "%.2f %s", unit.fromCubicFeet(cubicFeet), unit.getLabel());
    }

    private static int gcd(int a, int b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
