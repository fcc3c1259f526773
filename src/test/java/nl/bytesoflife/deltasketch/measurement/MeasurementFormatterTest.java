package nl.bytesoflife.deltasketch.measurement;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeasurementFormatterTest {

    @ParameterizedTest
    @CsvSource({
            "0.5, 16, 1/2",
            "0.25, 16, 1/4",
            "0.75, 4, 3/4",
            "0.333, 16, 5/16",
            "0.0625, 16, 1/16",
            "0.9, 8, 7/8",
            "0.1, 2, 1/2"
    })
    void decimalToFractionPicksClosestReducedFraction(double decimal, int precision, String expected) {
        assertEquals(expected, MeasurementFormatter.decimalToFraction(decimal, precision));
    }

    @Test
    void zeroRendersAsZero() {
        assertEquals("0", MeasurementFormatter.decimalToFraction(0));
    }

    @Test
    void precisionOfOneCanOnlyExpressWhole() {
        assertEquals("1/1", MeasurementFormatter.decimalToFraction(0.4, 1));
    }

    @Test
    void formatInches() {
        assertEquals("3\"", MeasurementFormatter.formatInches(3));
        assertEquals("6-1/2\"", MeasurementFormatter.formatInches(6.5));
        assertEquals("3/4\"", MeasurementFormatter.formatInches(0.75));
    }

    @Test
    void formatWithZeroInchesShown() {
        Measurement twelveFeet = Measurements.create(144);

        assertEquals("12'", MeasurementFormatter.format(twelveFeet));
        assertEquals("12' 0\"", MeasurementFormatter.format(twelveFeet, true));
        assertEquals("0\"", MeasurementFormatter.format(Measurements.create(0), true));
    }

    @Test
    void formatAreaAndVolume() {
        assertEquals("123.46 sq ft", MeasurementFormatter.formatArea(123.456));
        assertEquals("144.00 sq in", MeasurementFormatter.formatArea(1, AreaUnit.SQUARE_INCHES));
        assertEquals("800.00 cu ft", MeasurementFormatter.formatVolume(800));
        assertEquals("1.00 cu yd", MeasurementFormatter.formatVolume(27, VolumeUnit.CUBIC_YARDS));
    }
}
