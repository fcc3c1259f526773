package nl.bytesoflife.deltasketch.measurement;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses user-entered lengths. Whitespace is ignored, and the formats are tried in order:
 * <ol>
 *   <li>feet and inches: {@code 12'6"}, {@code 12' 6.5"}</li>
 *   <li>decimal feet: {@code 12.5'}, {@code 12.5 ft}, {@code 12 feet}, or a bare number</li>
 *   <li>inches: {@code 150"}, {@code 150 in}</li>
 *   <li>feet with fractional inches: {@code 12'6-1/2"}, {@code 12' 1/2"}</li>
 *   <li>fractional inches: {@code 6-1/2"}, {@code 3/4"}</li>
 * </ol>
 * Both ASCII and typographic foot/inch marks are accepted.
 */
public class MeasurementParser {

    private static final String FOOT = "['′’]";
    private static final String INCH = "(?:\"|″|”|'')";
    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    private static final Pattern FEET_INCHES =
            Pattern.compile("^(\\d+)" + FOOT + NUMBER + INCH + "?$");
    private static final Pattern DECIMAL_FEET =
            Pattern.compile("^" + NUMBER + FOOT + "?(?:ft|feet|foot)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INCHES =
            Pattern.compile("^" + NUMBER + INCH + "?(?:in|inch|inches)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEET_FRACTION =
            Pattern.compile("^(\\d+)" + FOOT + "(?:(\\d+)-)?(\\d+)/(\\d+)" + INCH + "?$");
    private static final Pattern FRACTION =
            Pattern.compile("^(?:(\\d+)-)?(\\d+)/(\\d+)" + INCH + "?$");

    private final int precision;

    public MeasurementParser() {
        this(MeasurementOptions.DEFAULT);
    }

    public MeasurementParser(MeasurementOptions options) {
        this.precision = options.precision();
    }

    /**
     * @return the parsed measurement, or empty when the input matches none of the formats
     */
    public Optional<Measurement> parse(String input) {
        if (input == null) return Optional.empty();
        String cleaned = input.trim().replaceAll("\\s+", "");
        if (cleaned.isEmpty()) return Optional.empty();

        Matcher m = FEET_INCHES.matcher(cleaned);
        if (m.matches()) {
            return Optional.of(of(Double.parseDouble(m.group(1)) * 12.0 + Double.parseDouble(m.group(2))));
        }

        m = DECIMAL_FEET.matcher(cleaned);
        if (m.matches()) {
            return Optional.of(of(Double.parseDouble(m.group(1)) * 12.0));
        }

        m = INCHES.matcher(cleaned);
        if (m.matches()) {
            return Optional.of(of(Double.parseDouble(m.group(1))));
        }

        m = FEET_FRACTION.matcher(cleaned);
        if (m.matches()) {
            double denominator = Double.parseDouble(m.group(4));
            if (denominator == 0) return Optional.empty();
            double inches = wholeInches(m.group(2)) + Double.parseDouble(m.group(3)) / denominator;
            return Optional.of(of(Double.parseDouble(m.group(1)) * 12.0 + inches));
        }

        m = FRACTION.matcher(cleaned);
        if (m.matches()) {
            double denominator = Double.parseDouble(m.group(3));
            if (denominator == 0) return Optional.empty();
            return Optional.of(of(wholeInches(m.group(1)) + Double.parseDouble(m.group(2)) / denominator));
        }

        return Optional.empty();
    }

    public boolean isValid(String input) {
        return parse(input).isPresent();
    }

    private Measurement of(double totalInches) {
        return Measurements.create(totalInches, precision);
    }

    private static double wholeInches(String group) {
        return group == null ? 0 : Double.parseDouble(group);
    }
}
