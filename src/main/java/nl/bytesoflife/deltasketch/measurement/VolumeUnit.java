package nl.bytesoflife.deltasketch.measurement;

public enum VolumeUnit {
    CUBIC_FEET("cu ft", 1.0),
    CUBIC_INCHES("cu in", 1728.0),
    CUBIC_YARDS("cu yd", 1.0 / 27);

    private final String label;
    private final double perCubicFoot;

    VolumeUnit(String label, double perCubicFoot) {
        this.label = label;
        this.perCubicFoot = perCubicFoot;
    }

    public String getLabel() { return label; }

    public double fromCubicFeet(double cubicFeet) {
        return cubicFeet * perCubicFoot;
    }
}
