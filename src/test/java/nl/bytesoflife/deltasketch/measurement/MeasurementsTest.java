package nl.bytesoflife.deltasketch.measurement;

import nl.bytesoflife.deltasketch.geometry.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeasurementsTest {

    private static final double EPS = 1e-9;

    @Test
    void createSplitsFeetAndInches() {
        Measurement m = Measurements.create(150);

        assertEquals(12, m.getFeet());
        assertEquals(6.0, m.getInches(), EPS);
        assertEquals(150.0, m.getTotalInches(), EPS);
        assertEquals(16, m.getPrecision());
        assertEquals("12' 6\"", m.getDisplay());
        assertEquals(12.5, m.toFeet(), EPS);
    }

    @Test
    void displayForms() {
        assertEquals("0\"", Measurements.create(0).getDisplay());
        assertEquals("6-1/2\"", Measurements.create(6.5).getDisplay());
        assertEquals("12'", Measurements.create(144).getDisplay());
        assertEquals("12' 6-1/2\"", Measurements.create(150.5).getDisplay());
    }

    @Test
    void remainderRoundingToFullFootCarries() {
        Measurement m = Measurements.create(143.99);

        assertEquals(12, m.getFeet());
        assertEquals(0.0, m.getInches(), EPS);
        assertEquals(143.99, m.getTotalInches(), EPS);
        assertEquals("12'", m.getDisplay());
    }

    @Test
    void inchesRoundToPrecision() {
        Measurement m = Measurements.create(6.3, 4);
        assertEquals(6.25, m.getInches(), EPS);
        assertEquals("6-1/4\"", m.getDisplay());

        Measurement rounded = Measurements.round(Measurements.create(6.3), 4);
        assertEquals(6.25, rounded.getTotalInches(), EPS);
        assertEquals(4, rounded.getPrecision());
    }

    @Test
    void precisionBelowOneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Measurements.create(12, 0));
        assertThrows(IllegalArgumentException.class, () -> new MeasurementOptions(0, 0.1));
    }

    @Test
    void factoryShortcuts() {
        assertEquals(63.0, Measurements.fromFeetAndInches(5, 3).getTotalInches(), EPS);
        assertEquals(96.0, Measurements.fromFeet(8).getTotalInches(), EPS);
        assertEquals(Measurements.create(12), Measurements.create(12, MeasurementOptions.DEFAULT));
    }

    @Test
    void comparisonUsesTotalInches() {
        Measurement small = Measurements.create(10);
        Measurement large = Measurements.create(20);

        assertTrue(Measurements.compare(small, large) < 0);
        assertTrue(Measurements.compare(large, small) > 0);
        assertEquals(0, Measurements.compare(small, Measurements.create(10)));
    }

    @Test
    void equalsWithinDefaultSixteenthTolerance() {
        assertTrue(Measurements.equalsWithin(Measurements.create(12), Measurements.create(12.05)));
        assertFalse(Measurements.equalsWithin(Measurements.create(12), Measurements.create(12.1)));
        assertTrue(Measurements.equalsWithin(Measurements.create(12), Measurements.create(12.4), 0.5));
    }

    @Test
    void equalsWithinConfiguredTolerance() {
        Measurement a = Measurements.create(12);
        Measurement b = Measurements.create(12.2);

        assertFalse(Measurements.equalsWithin(a, b, MeasurementOptions.DEFAULT));
        assertTrue(Measurements.equalsWithin(a, b, new MeasurementOptions(16, 0.25)));
    }

    @Test
    void yardsAndFeetConversions() {
        Measurement threeYards = Measurements.create(108);

        assertEquals(3.0, Measurements.convert(threeYards, MeasurementUnit.YARDS), EPS);
        assertEquals(9.0, Measurements.convert(threeYards, "ft"), EPS);
    }

    @Test
    void minAndMaxOfList() {
        List<Measurement> list = List.of(
                Measurements.create(30), Measurements.create(5), Measurements.create(100));

        assertEquals(5.0, Measurements.min(list).orElseThrow().getTotalInches(), EPS);
        assertEquals(100.0, Measurements.max(list).orElseThrow().getTotalInches(), EPS);
        assertTrue(Measurements.min(List.of()).isEmpty());
        assertTrue(Measurements.max(List.of()).isEmpty());
    }

    @Test
    void negativeLengthIsNotValid() {
        assertTrue(Measurements.isValid(Measurements.create(150)));
        assertFalse(Measurements.isValid(Measurements.create(-6)));
    }

    @Test
    void convertToUnits() {
        Measurement foot = Measurements.create(12);

        assertEquals(1.0, Measurements.convert(foot, MeasurementUnit.FEET), EPS);
        assertEquals(30.48, Measurements.convert(foot, MeasurementUnit.CENTIMETERS), EPS);
        assertEquals(304.8, Measurements.convert(foot, "mm"), EPS);
        assertEquals(1.0 / 3, Measurements.convert(foot, "yards"), EPS);
    }

    @Test
    void unknownUnitNameConvertsToInches() {
        assertEquals(12.0, Measurements.convert(Measurements.create(12), "furlongs"), EPS);
        assertEquals(MeasurementUnit.INCHES, MeasurementUnit.fromName(null));
    }

    @Test
    void drawingScaleConversions() {
        assertEquals(10.0, Measurements.pixelsToFeet(500, 50), EPS);
        assertEquals(500.0, Measurements.feetToPixels(10, 50), EPS);
        assertEquals(100.0, Measurements.pixelAreaToSquareFeet(250_000, 50), EPS);
        assertEquals(800.0, Measurements.cubicFeet(100, Measurements.fromFeet(8)), EPS);
    }

    @Test
    void measureDistanceBetweenPoints() {
        Measurement m = Measurements.measureDistance(new Point(0, 0), new Point(300, 400), 50);

        assertEquals(120.0, m.getTotalInches(), EPS);
        assertEquals("10'", m.getDisplay());
    }
}
