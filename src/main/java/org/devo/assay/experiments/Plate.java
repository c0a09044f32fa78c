/**
 *
 */
package org.devo.assay.experiments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.devo.assay.samples.SampleRow;

/**
 * A plate is one physical 96-well plate within a batch.  It is identified by the batch name and the plate
 * number, and owns a well object for each of its sample rows.  The wells belong to this plate alone, so
 * applying a design template to it cannot affect any other plate or the batch's rows.
 *
 */
public class Plate implements Iterable<PlateWell> {

    // FIELDS
    /** name of the owning batch */
    private final String batchName;
    /** plate number */
    private final int plateNumber;
    /** wells on this plate */
    private final List<PlateWell> wells;

    /**
     * Construct a plate from its sample rows.
     *
     * @param batchName		name of the owning batch
     * @param plateNumber	plate number
     * @param rows			sample rows on this plate
     */
    public Plate(String batchName, int plateNumber, Collection<SampleRow> rows) {
        this.batchName = batchName;
        this.plateNumber = plateNumber;
        List<PlateWell> wellList = new ArrayList<PlateWell>(rows.size());
        for (SampleRow row : rows)
            wellList.add(new PlateWell(row));
        this.wells = Collections.unmodifiableList(wellList);
    }

    /**
     * @return the name of the owning batch
     */
    public String getBatchName() {
        return this.batchName;
    }

    /**
     * @return the plate number
     */
    public int getPlateNumber() {
        return this.plateNumber;
    }

    /**
     * @return the wells on this plate
     */
    public List<PlateWell> getWells() {
        return this.wells;
    }

    /**
     * @return the wells at the specified address (there can be more than one if a well was re-read)
     *
     * @param row		row letter
     * @param column	column number
     */
    public List<PlateWell> getWells(char row, int column) {
        List<PlateWell> retVal = new ArrayList<PlateWell>(1);
        for (PlateWell well : this.wells) {
            if (well.getRow() == row && well.getColumn() == column)
                retVal.add(well);
        }
        return retVal;
    }

    /**
     * @return the number of wells on this plate
     */
    public int size() {
        return this.wells.size();
    }

    @Override
    public Iterator<PlateWell> iterator() {
        return this.wells.iterator();
    }

    @Override
    public String toString() {
        return "Name: " + this.batchName + ", Plate Number: " + this.plateNumber;
    }

}
