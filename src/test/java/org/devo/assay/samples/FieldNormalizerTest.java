/**
 *
 */
package org.devo.assay.samples;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for the raw field conversions.
 *
 */
public class FieldNormalizerTest {

    @Test
    public void testLocations() throws MalformedLocationException {
        WellLocation loc = FieldNormalizer.parseLocation("Plate 1 - Well A1");
        assertThat(loc.getPlate(), equalTo(1));
        assertThat(loc.getRow(), equalTo('A'));
        assertThat(loc.getColumn(), equalTo(1));
        loc = FieldNormalizer.parseLocation("Plate 1 - Well A12");
        assertThat(loc.getPlate(), equalTo(1));
        assertThat(loc.getRow(), equalTo('A'));
        assertThat(loc.getColumn(), equalTo(12));
        loc = FieldNormalizer.parseLocation("Plate 2 - Well C10");
        assertThat(loc, equalTo(new WellLocation(2, 'C', 10)));
        assertThat(loc.getWell(), equalTo("C10"));
        assertThat(loc.toString(), equalTo("Plate 2 - Well C10"));
        loc = FieldNormalizer.parseLocation("Plate 3 - Well H7");
        assertThat(loc, equalTo(new WellLocation(3, 'H', 7)));
        loc = FieldNormalizer.parseLocation("Plate 14 - Well F04");
        assertThat(loc, equalTo(new WellLocation(14, 'F', 4)));
    }

    @Test
    public void testAllWells() throws MalformedLocationException {
        for (int p = 1; p <= 3; p++) {
            for (char r : WellLocation.ROW_LETTERS.toCharArray()) {
                for (int c = 1; c <= WellLocation.COLUMNS; c++) {
                    String raw = "Plate " + p + " - Well " + r + c;
                    assertThat(raw, FieldNormalizer.parseLocation(raw), equalTo(new WellLocation(p, r, c)));
                }
            }
        }
    }

    @Test
    public void testBadLocations() {
        String[] bads = new String[] { "", "Plate 1 - Well", "Plate 1 -  Well A1", "Plate  1 - Well A1", " Plate 1 - Well A1",
                "Plate 1 - Well A1 ", "Plate X - Well A1", "Plate 1 - Well 11", "Plate 1 - Well AB", "Plate 1 - Well A",
                "Plate 1 - Well A123", "Plate 1 - Well I1", "Plate 1 - Well a1", "Plate 1 - Well A0", "Plate 1 - Well A13",
                "Plate 0 - Well A1", "Plate 99999999999 - Well A1", "Plate 1 – Well A1", "Plate\t1 - Well A1",
                "Plate 1 - WellD7" };
        for (String bad : bads) {
            MalformedLocationException e = assertThrows(MalformedLocationException.class,
                    () -> FieldNormalizer.parseLocation(bad), bad);
            assertThat(e.getLocation(), equalTo(bad));
        }
        assertThrows(MalformedLocationException.class, () -> FieldNormalizer.parseLocation(null));
    }

    @Test
    public void testBarcodes() {
        SampleBarcode code = FieldNormalizer.normalizeBarcode("1");
        assertThat(code.isNumeric(), equalTo(true));
        assertThat(code.getNumber(), equalTo(1L));
        code = FieldNormalizer.normalizeBarcode("100");
        assertThat(code.isNumeric(), equalTo(true));
        assertThat(code.getNumber(), equalTo(100L));
        assertThat(code.toString(), equalTo("100"));
        code = FieldNormalizer.normalizeBarcode("qc1");
        assertThat(code.isNumeric(), equalTo(false));
        assertThat(code.toString(), equalTo("QC1"));
        assertThrows(IllegalStateException.class, () -> FieldNormalizer.normalizeBarcode("qc1").getNumber());
        assertThat(FieldNormalizer.normalizeBarcode(" 42 "), equalTo(SampleBarcode.numeric(42)));
        assertThat(FieldNormalizer.normalizeBarcode("Cal-A"), equalTo(SampleBarcode.text("CAL-A")));
        assertThat(FieldNormalizer.normalizeBarcode(""), equalTo(SampleBarcode.text("")));
        assertThat(FieldNormalizer.normalizeBarcode(null), equalTo(SampleBarcode.text("")));
    }

    @Test
    public void testDigitPrefixBarcodes() {
        // A leading digit run is not enough to make a barcode numeric.
        SampleBarcode code = FieldNormalizer.normalizeBarcode("123abc");
        assertThat(code.isNumeric(), equalTo(false));
        assertThat(code.toString(), equalTo("123ABC"));
        code = FieldNormalizer.normalizeBarcode("12a");
        assertThat(code, equalTo(SampleBarcode.text("12A")));
        assertThat(code, not(equalTo(SampleBarcode.numeric(12))));
        // Too many digits to be a number.
        code = FieldNormalizer.normalizeBarcode("123456789012345678901234567890");
        assertThat(code.isNumeric(), equalTo(false));
        assertThat(code.toString(), equalTo("123456789012345678901234567890"));
    }

    @Test
    public void testNumbers() {
        assertThat(FieldNormalizer.coerceNumeric("0.007"), closeTo(0.007, 1e-12));
        assertThat(FieldNormalizer.coerceNumeric("NaN"), notANumber());
        assertThat(FieldNormalizer.coerceNumeric(""), notANumber());
        assertThat(FieldNormalizer.coerceNumeric(null), notANumber());
        assertThat(FieldNormalizer.coerceNumeric("12.3"), closeTo(12.3, 1e-12));
        assertThat(FieldNormalizer.coerceNumeric(" 4 "), closeTo(4.0, 1e-12));
        assertThat(FieldNormalizer.coerceNumeric("-1.5e2"), closeTo(-150.0, 1e-12));
        assertThat(FieldNormalizer.coerceNumeric(".5"), closeTo(0.5, 1e-12));
        assertThat(FieldNormalizer.coerceNumeric("< LLOQ"), notANumber());
        assertThat(FieldNormalizer.coerceNumeric("1.5d"), notANumber());
        assertThat(FieldNormalizer.coerceNumeric("0x10"), notANumber());
    }

    @Test
    public void testUnitConversion() {
        double[] pg = new double[] { 0.001, 0.02, 0.3, 4, 50, 500, Double.NaN };
        double[] fg = new double[] { 1.0, 20.0, 300.0, 4000.0, 50000.0, 500000.0, Double.NaN };
        for (int i = 0; i < pg.length; i++) {
            if (Double.isNaN(fg[i]))
                assertThat(FieldNormalizer.pgToFg(pg[i]), notANumber());
            else
                assertThat(FieldNormalizer.pgToFg(pg[i]), closeTo(fg[i], 1e-9));
        }
    }

    @Test
    public void testSampleRow() throws MalformedLocationException {
        Map<String, String> record = new HashMap<String, String>();
        record.put(SampleRow.BARCODE_COL, "qc2");
        record.put(SampleRow.LOCATION_COL, "Plate 2 - Well G11");
        record.put(SampleRow.SAMPLE_TYPE_COL, "Quality Control");
        record.put(SampleRow.BATCH_NAME_COL, "Run-7");
        record.put(SampleRow.AEB_COL, "0.25");
        record.put(SampleRow.CONCENTRATION_COL, "3.5");
        record.put(SampleRow.FLAGS_COL, "High CV");
        SampleRow row = SampleRow.create(record);
        assertThat(row.getBarcode().toString(), equalTo("QC2"));
        assertThat(row.getLocation(), equalTo("Plate 2 - Well G11"));
        assertThat(row.getPlate(), equalTo(2));
        assertThat(row.getRow(), equalTo('G'));
        assertThat(row.getColumn(), equalTo(11));
        assertThat(row.getSampleType(), equalTo("Quality Control"));
        assertThat(row.getBatchName(), equalTo("Run-7"));
        assertThat(row.getAeb(), closeTo(0.25, 1e-12));
        assertThat(row.getConcentration(), closeTo(3.5, 1e-12));
        assertThat(row.getConcentrationFg(), closeTo(3500.0, 1e-9));
        assertThat(row.hasConcentration(), equalTo(true));
        assertThat(row.getFlags(), equalTo("High CV"));
        record.put(SampleRow.CONCENTRATION_COL, "");
        record.remove(SampleRow.FLAGS_COL);
        row = SampleRow.create(record);
        assertThat(row.hasConcentration(), equalTo(false));
        assertThat(row.getConcentration(), notANumber());
        assertThat(row.getConcentrationFg(), notANumber());
        assertThat(row.getFlags(), equalTo(""));
        record.put(SampleRow.LOCATION_COL, "Plate 2 Well G11");
        assertThrows(MalformedLocationException.class, () -> SampleRow.create(record));
    }

}
