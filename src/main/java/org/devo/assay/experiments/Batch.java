/**
 *
 */
package org.devo.assay.experiments;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.devo.assay.samples.SampleRow;

/**
 * A batch is one run of the Simoa instrument.  It has a name, the sample rows for the run, and one plate
 * object for each physical plate used in the run.  The batch also tracks the distribution of the fg/ml
 * concentrations, of which the highest value is the most interesting.
 *
 * The run date, the QC samples, the calibration standards and the QC lot are not computed from the export.
 * They are empty until something supplies them.
 *
 */
public class Batch implements Iterable<Plate> {

    // FIELDS
    /** batch name */
    private final String name;
    /** sample rows for this batch */
    private final List<SampleRow> rows;
    /** plates in this batch */
    private final List<Plate> plates;
    /** statistics on the fg/ml concentrations */
    private final SummaryStatistics concStats;
    /** QC lot number */
    private String lot;

    /**
     * Construct a batch from its sample rows.
     *
     * @param name		batch name
     * @param rows		sample rows belonging to the batch (will be copied)
     */
    public Batch(String name, Collection<SampleRow> rows) {
        this.name = name;
        this.rows = Collections.unmodifiableList(new ArrayList<SampleRow>(rows));
        this.lot = null;
        this.concStats = new SummaryStatistics();
        for (SampleRow row : this.rows) {
            if (row.hasConcentration())
                this.concStats.addValue(row.getConcentrationFg());
        }
        this.plates = Collections.unmodifiableList(BatchPartitioner.partitionPlates(name, this.rows));
    }

    /**
     * @return the batch name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the sample rows in this batch
     */
    public List<SampleRow> getRows() {
        return this.rows;
    }

    /**
     * @return the plates in this batch, in order of first appearance
     */
    public List<Plate> getPlates() {
        return this.plates;
    }

    /**
     * @return the plate with the specified number, or NULL if there is none
     *
     * @param plateNum	number of the desired plate
     */
    public Plate getPlate(int plateNum) {
        Plate retVal = null;
        for (Plate plate : this.plates) {
            if (plate.getPlateNumber() == plateNum)
                retVal = plate;
        }
        return retVal;
    }

    /**
     * @return the highest fg/ml concentration in this batch, or NaN if no row has a concentration
     */
    public double getHighestValue() {
        double retVal = Double.NaN;
        if (this.concStats.getN() > 0)
            retVal = this.concStats.getMax();
        return retVal;
    }

    /**
     * @return a summary of the fg/ml concentrations in this batch
     */
    public StatisticalSummary getConcentrationStats() {
        return this.concStats.getSummary();
    }

    /**
     * @return the run date (not yet computed)
     */
    public Optional<LocalDate> getDate() {
        return Optional.empty();
    }

    /**
     * @return the QC samples for this batch (not yet computed)
     */
    public Optional<List<SampleRow>> getQcs() {
        return Optional.empty();
    }

    /**
     * @return the calibration standards for this batch (not yet computed)
     */
    public Optional<List<SampleRow>> getStandards() {
        return Optional.empty();
    }

    /**
     * @return the QC lot number, if one has been specified
     */
    public Optional<String> getLot() {
        return Optional.ofNullable(this.lot);
    }

    /**
     * Specify the QC lot number.
     *
     * @param lot 	the lot number to set
     */
    public void setLot(String lot) {
        this.lot = lot;
    }

    /**
     * @return the number of sample rows in this batch
     */
    public int size() {
        return this.rows.size();
    }

    @Override
    public Iterator<Plate> iterator() {
        return this.plates.iterator();
    }

    @Override
    public String toString() {
        return "Batch " + this.name + " (" + this.plates.size() + " plates, " + this.rows.size() + " rows)";
    }

}
