/**
 *
 */
package org.devo.assay.samples;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents one sample measurement from a Simoa export, after normalization.  The raw location
 * has been split into plate, row and column, the barcode has been normalized, and the measurements are
 * numbers.  A missing measurement is stored as NaN.  The fg/ml concentration is always 1000 times the pg/ml
 * concentration.
 *
 * Sample rows are immutable.
 *
 */
public class SampleRow {

    // FIELDS
    /** sample barcode */
    private final SampleBarcode barcode;
    /** raw location string */
    private final String location;
    /** parsed well location */
    private final WellLocation well;
    /** sample type */
    private final String sampleType;
    /** batch name */
    private final String batchName;
    /** raw instrument signal (average enzymes per bead) */
    private final double aeb;
    /** concentration in pg/ml */
    private final double concentration;
    /** concentration in fg/ml */
    private final double concentrationFg;
    /** instrument flags */
    private final String flags;

    /** barcode column name */
    public static final String BARCODE_COL = "Sample Barcode";
    /** location column name */
    public static final String LOCATION_COL = "Location";
    /** sample type column name */
    public static final String SAMPLE_TYPE_COL = "Sample Type";
    /** batch name column name */
    public static final String BATCH_NAME_COL = "Batch Name";
    /** AEB column name */
    public static final String AEB_COL = "AEB";
    /** concentration column name */
    public static final String CONCENTRATION_COL = "Concentration";
    /** flags column name */
    public static final String FLAGS_COL = "Flags";
    /** list of columns required from the export */
    public static final List<String> REQUIRED_COLUMNS = Arrays.asList(BARCODE_COL, LOCATION_COL, SAMPLE_TYPE_COL,
            BATCH_NAME_COL, AEB_COL, CONCENTRATION_COL, FLAGS_COL);

    /**
     * Construct a sample row from normalized values.
     *
     * @param barcode			sample barcode
     * @param location			raw location string
     * @param well				parsed well location
     * @param sampleType		sample type
     * @param batchName			batch name
     * @param aeb				AEB value, or NaN
     * @param concentration		concentration in pg/ml, or NaN
     * @param flags				instrument flags
     */
    public SampleRow(SampleBarcode barcode, String location, WellLocation well, String sampleType, String batchName,
            double aeb, double concentration, String flags) {
        this.barcode = barcode;
        this.location = location;
        this.well = well;
        this.sampleType = sampleType;
        this.batchName = batchName;
        this.aeb = aeb;
        this.concentration = concentration;
        this.concentrationFg = FieldNormalizer.pgToFg(concentration);
        this.flags = flags;
    }

    /**
     * Create a sample row from a raw export record.
     *
     * @param record	map of column names to raw field values
     *
     * @return the normalized sample row
     *
     * @throws MalformedLocationException if the location field is invalid
     */
    public static SampleRow create(Map<String, String> record) throws MalformedLocationException {
        String location = record.get(LOCATION_COL);
        WellLocation well = FieldNormalizer.parseLocation(location);
        SampleBarcode barcode = FieldNormalizer.normalizeBarcode(record.get(BARCODE_COL));
        double aeb = FieldNormalizer.coerceNumeric(record.get(AEB_COL));
        double conc = FieldNormalizer.coerceNumeric(record.get(CONCENTRATION_COL));
        return new SampleRow(barcode, location, well, StringUtils.defaultString(record.get(SAMPLE_TYPE_COL)),
                StringUtils.defaultString(record.get(BATCH_NAME_COL)), aeb, conc,
                StringUtils.defaultString(record.get(FLAGS_COL)));
    }

    /**
     * @return the sample barcode
     */
    public SampleBarcode getBarcode() {
        return this.barcode;
    }

    /**
     * @return the raw location string
     */
    public String getLocation() {
        return this.location;
    }

    /**
     * @return the well location
     */
    public WellLocation getWell() {
        return this.well;
    }

    /**
     * @return the plate number
     */
    public int getPlate() {
        return this.well.getPlate();
    }

    /**
     * @return the row letter
     */
    public char getRow() {
        return this.well.getRow();
    }

    /**
     * @return the column number
     */
    public int getColumn() {
        return this.well.getColumn();
    }

    /**
     * @return the sample type
     */
    public String getSampleType() {
        return this.sampleType;
    }

    /**
     * @return the batch name
     */
    public String getBatchName() {
        return this.batchName;
    }

    /**
     * @return the AEB value, or NaN if there is none
     */
    public double getAeb() {
        return this.aeb;
    }

    /**
     * @return the concentration in pg/ml, or NaN if there is none
     */
    public double getConcentration() {
        return this.concentration;
    }

    /**
     * @return the concentration in fg/ml, or NaN if there is none
     */
    public double getConcentrationFg() {
        return this.concentrationFg;
    }

    /**
     * @return TRUE if this row has a concentration value
     */
    public boolean hasConcentration() {
        return ! Double.isNaN(this.concentration);
    }

    /**
     * @return the instrument flags
     */
    public String getFlags() {
        return this.flags;
    }

    @Override
    public String toString() {
        return this.batchName + " " + this.well + " (" + this.barcode + ")";
    }

}
