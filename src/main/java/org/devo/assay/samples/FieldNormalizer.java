/**
 *
 */
package org.devo.assay.samples;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * This is a static class that converts the raw text fields of an instrument export into typed values.
 *
 */
public class FieldNormalizer {

    /** pattern for a location string */
    private static final Pattern LOCATION_PATTERN = Pattern.compile("Plate (\\d+) - Well ([A-Za-z])(\\d{1,2})");
    /** pattern for a numeric barcode */
    private static final Pattern NUMERIC_BARCODE = Pattern.compile("\\d+");
    /** pattern for a decimal number */
    private static final Pattern DECIMAL_NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    /** conversion factor from pg/ml to fg/ml */
    public static final double PG_TO_FG = 1000.0;

    /**
     * Parse a location string into a well location.  The string must match "Plate N - Well XNN" exactly,
     * with single spaces between the tokens.
     *
     * @param raw	location string from the instrument
     *
     * @return the plate number, row letter and column number encoded in the string
     *
     * @throws MalformedLocationException if the string is not a valid location
     */
    public static WellLocation parseLocation(String raw) throws MalformedLocationException {
        if (raw == null)
            throw new MalformedLocationException("", "location is missing");
        Matcher m = LOCATION_PATTERN.matcher(raw);
        if (! m.matches())
            throw new MalformedLocationException(raw, "expected \"Plate N - Well XNN\"");
        int plate;
        try {
            plate = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new MalformedLocationException(raw, "plate number is too large");
        }
        if (plate < 1)
            throw new MalformedLocationException(raw, "plate number must be positive");
        char row = m.group(2).charAt(0);
        if (! WellLocation.isValidRow(row))
            throw new MalformedLocationException(raw, "row letter must be A through H");
        int column = Integer.parseInt(m.group(3));
        if (! WellLocation.isValidColumn(column))
            throw new MalformedLocationException(raw, "column number must be 1 through " + WellLocation.COLUMNS);
        return new WellLocation(plate, row, column);
    }

    /**
     * Normalize a sample barcode.  A barcode consisting entirely of digits is numeric.  Anything else,
     * including a digit string with trailing letters, is text and is converted to upper case.
     *
     * @param raw	barcode string from the instrument
     *
     * @return the normalized barcode
     */
    public static SampleBarcode normalizeBarcode(String raw) {
        String barcode = StringUtils.trimToEmpty(raw);
        SampleBarcode retVal;
        if (NUMERIC_BARCODE.matcher(barcode).matches()) {
            try {
                retVal = SampleBarcode.numeric(Long.parseLong(barcode));
            } catch (NumberFormatException e) {
                // Too many digits for a number.
                retVal = SampleBarcode.text(barcode);
            }
        } else
            retVal = SampleBarcode.text(barcode);
        return retVal;
    }

    /**
     * Convert a measurement string to a number.
     *
     * @param raw	measurement string from the instrument
     *
     * @return the numeric value, or NaN if the string is empty or not a number
     */
    public static double coerceNumeric(String raw) {
        double retVal = Double.NaN;
        String value = StringUtils.trimToEmpty(raw);
        if (DECIMAL_NUMBER.matcher(value).matches())
            retVal = Double.parseDouble(value);
        return retVal;
    }

    /**
     * @return a concentration in fg/ml
     *
     * @param value		concentration in pg/ml (NaN if absent)
     */
    public static double pgToFg(double value) {
        return value * PG_TO_FG;
    }

}
