package nl.bytesoflife.deltasketch.measurement;

public enum MeasurementUnit {
    INCHES(1.0),
    FEET(1.0 / Measurements.INCHES_PER_FOOT),
    YARDS(1.0 / Measurements.INCHES_PER_YARD),
    CENTIMETERS(2.54),
    MILLIMETERS(25.4);

    private final double perInch;

    MeasurementUnit(double perInch) {
        this.perInch = perInch;
    }

    public double fromInches(double inches) {
        return inches * perInch;
    }

    /**
     * Unknown or missing names resolve to {@link #INCHES}.
     */
    public static MeasurementUnit fromName(String name) {
        if (name == null) return INCHES;
        return switch (name.trim().toLowerCase()) {
            case "in", "inch", "inches" -> INCHES;
            case "ft", "foot", "feet" -> FEET;
            case "yd", "yard", "yards" -> YARDS;
            case "cm", "centimeter", "centimeters" -> CENTIMETERS;
            case "mm", "millimeter", "millimeters" -> MILLIMETERS;
            default -> INCHES;
        };
    }
}
