/**
 *
 */
package org.devo.assay.reports;

import java.io.IOException;
import java.io.OutputStream;

import org.devo.assay.experiments.Batch;
import org.devo.assay.experiments.Plate;
import org.devo.assay.experiments.PlateWell;
import org.devo.assay.samples.SampleRow;

/**
 * This is the base class for well reports.  A well report has one line per well of every plate in every
 * batch.  Each line starts with the descriptive labels for the well (batch, plate, well address, barcode,
 * sample type, flags, and the design labels) and ends with the measurements (AEB, pg/ml and fg/ml).
 *
 */
public abstract class WellReporter implements AutoCloseable {

    // FIELDS
    /** output stream */
    private final OutputStream outStream;
    /** number of wells written */
    private int wellCount;

    /** headers for the label columns */
    protected static final String[] LABEL_HEADERS = new String[] { "batch", "plate", "well", "barcode", "sample_type",
            "flags", "dilution", "feeders", "replicate" };
    /** headers for the value columns */
    protected static final String[] VALUE_HEADERS = new String[] { "AEB", "pg/ml", "fg/ml" };

    /**
     * This enum represents the different report types.
     */
    public static enum Type {
        TEXT {
            @Override
            public WellReporter create(OutputStream outStream) {
                return new TextWellReporter(outStream);
            }
        }, EXCEL {
            @Override
            public WellReporter create(OutputStream outStream) {
                return new ExcelWellReporter(outStream);
            }
        };

        /**
         * @return a reporting object of this type
         *
         * @param outStream		output stream for the report
         */
        public abstract WellReporter create(OutputStream outStream);
    }

    /**
     * Construct a well report writer.
     *
     * @param outStream		output stream for the report
     */
    public WellReporter(OutputStream outStream) {
        this.outStream = outStream;
        this.wellCount = 0;
    }

    /**
     * Initialize the report and write the headers.
     */
    public void openReport() {
        this.initReport(this.outStream);
        this.writeHeaders(LABEL_HEADERS, VALUE_HEADERS);
    }

    /**
     * Write all the wells of a batch.
     *
     * @param batch		batch to write
     */
    public void writeBatch(Batch batch) {
        for (Plate plate : batch) {
            for (PlateWell well : plate)
                this.writeWell(plate, well);
        }
    }

    /**
     * Write a single well.
     *
     * @param plate		plate containing the well
     * @param well		well to write
     */
    public void writeWell(Plate plate, PlateWell well) {
        SampleRow sample = well.getSample();
        String[] labels = new String[] { plate.getBatchName(), Integer.toString(plate.getPlateNumber()),
                sample.getWell().getWell(), sample.getBarcode().toString(), sample.getSampleType(), sample.getFlags(),
                blankIfNull(well.getDilution()), blankIfNull(well.getFeeders()), blankIfNull(well.getReplicate()) };
        double[] values = new double[] { sample.getAeb(), sample.getConcentration(), sample.getConcentrationFg() };
        this.writeRow(labels, values);
        this.wellCount++;
    }

    /**
     * @return the string, or an empty string if it is NULL
     *
     * @param label		label to check
     */
    private static String blankIfNull(String label) {
        return (label == null ? "" : label);
    }

    /**
     * @return the number of wells written
     */
    public int getWellCount() {
        return this.wellCount;
    }

    /**
     * @return the output stream
     */
    protected OutputStream getOutStream() {
        return this.outStream;
    }

    /**
     * Initialize the report.
     *
     * @param oStream		output stream for the report
     */
    protected abstract void initReport(OutputStream oStream);

    /**
     * Write the column headers.
     *
     * @param labels	headers for the label columns
     * @param values	headers for the value columns
     */
    protected abstract void writeHeaders(String[] labels, String[] values);

    /**
     * Write a data row.  Missing measurements are NaN.
     *
     * @param labels	label column values
     * @param values	value column values
     */
    protected abstract void writeRow(String[] labels, double[] values);

    /**
     * Finish the report and release any resources used by this reporter.
     */
    protected abstract void cleanup() throws IOException;

    @Override
    public void close() throws IOException {
        this.cleanup();
        this.outStream.close();
    }

}
