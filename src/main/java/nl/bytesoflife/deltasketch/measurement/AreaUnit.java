package nl.bytesoflife.deltasketch.measurement;

public enum AreaUnit {
    SQUARE_FEET("sq ft", 1.0),
    SQUARE_INCHES("sq in", 144.0),
    SQUARE_YARDS("sq yd", 1.0 / 9);

    private final String label;
    private final double perSquareFoot;

    AreaUnit(String label, double perSquareFoot) {
        this.label = label;
        this.perSquareFoot = perSquareFoot;
    }

    public String getLabel() { return label; }

    public double fromSquareFeet(double squareFeet) {
        return squareFeet * perSquareFoot;
    }
}
