/**
 *
 */
package org.devo.assay.experiments;

import org.devo.assay.samples.SampleRow;

/**
 * A plate well is a sample row as seen from its plate.  In addition to the immutable measurement, it
 * carries the experiment-design labels (dilution, feeders, replicate) that come from plate templates.
 * The labels are NULL until a template has been applied.
 *
 */
public class PlateWell {

    // FIELDS
    /** sample measurement in this well */
    private final SampleRow sample;
    /** dilution label */
    private String dilution;
    /** feeder label */
    private String feeders;
    /** replicate label */
    private String replicate;

    /**
     * Create an undesigned well for a sample row.
     *
     * @param sample	sample row for the well
     */
    public PlateWell(SampleRow sample) {
        this.sample = sample;
        this.dilution = null;
        this.feeders = null;
        this.replicate = null;
    }

    /**
     * @return the sample measurement
     */
    public SampleRow getSample() {
        return this.sample;
    }

    /**
     * @return the row letter
     */
    public char getRow() {
        return this.sample.getRow();
    }

    /**
     * @return the column number
     */
    public int getColumn() {
        return this.sample.getColumn();
    }

    /**
     * @return the dilution label, or NULL if no template has been applied
     */
    public String getDilution() {
        return this.dilution;
    }

    /**
     * @param dilution 	the dilution label to set
     */
    public void setDilution(String dilution) {
        this.dilution = dilution;
    }

    /**
     * @return the feeder label, or NULL if no template has been applied
     */
    public String getFeeders() {
        return this.feeders;
    }

    /**
     * @param feeders 	the feeder label to set
     */
    public void setFeeders(String feeders) {
        this.feeders = feeders;
    }

    /**
     * @return the replicate label, or NULL if no template has been applied
     */
    public String getReplicate() {
        return this.replicate;
    }

    /**
     * @param replicate 	the replicate label to set
     */
    public void setReplicate(String replicate) {
        this.replicate = replicate;
    }

    /**
     * @return TRUE if all three design labels have been set
     */
    public boolean isDesigned() {
        return this.dilution != null && this.feeders != null && this.replicate != null;
    }

}
