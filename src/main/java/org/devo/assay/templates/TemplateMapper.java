/**
 *
 */
package org.devo.assay.templates;

import java.util.Collection;

import org.devo.assay.experiments.Batch;
import org.devo.assay.experiments.Plate;
import org.devo.assay.experiments.PlateWell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a static class that applies experiment-design templates to plates.  Each of the three templates
 * (dilution, feeders, replicate) is resolved independently against its own axis, so dilutions can run
 * down the rows while feeders run across the columns.  Only the plate's own wells are updated.
 *
 */
public class TemplateMapper {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TemplateMapper.class);

    /**
     * Apply design templates to a plate.  A NULL template leaves the corresponding label unchanged.
     *
     * @param plate			plate to annotate
     * @param dilutions		dilution template
     * @param feeders		feeder template
     * @param replicates	replicate template
     *
     * @return the number of wells on the plate left with at least one unassigned label
     */
    public static int applyTemplate(Plate plate, PlateTemplate dilutions, PlateTemplate feeders,
            PlateTemplate replicates) {
        int unassigned = 0;
        for (PlateWell well : plate) {
            char row = well.getRow();
            int column = well.getColumn();
            if (dilutions != null)
                well.setDilution(dilutions.resolve(row, column));
            if (feeders != null)
                well.setFeeders(feeders.resolve(row, column));
            if (replicates != null)
                well.setReplicate(replicates.resolve(row, column));
            if (PlateTemplate.UNASSIGNED.equals(well.getDilution()) || PlateTemplate.UNASSIGNED.equals(well.getFeeders())
                    || PlateTemplate.UNASSIGNED.equals(well.getReplicate()))
                unassigned++;
        }
        if (unassigned > 0)
            log.debug("{} wells on plate {} of batch {} have unassigned design labels.", unassigned,
                    plate.getPlateNumber(), plate.getBatchName());
        return unassigned;
    }

    /**
     * Apply the same design templates to every plate of every batch.
     *
     * @param batches		batches to annotate
     * @param dilutions		dilution template
     * @param feeders		feeder template
     * @param replicates	replicate template
     *
     * @return the number of plates annotated
     */
    public static int applyTemplates(Collection<Batch> batches, PlateTemplate dilutions, PlateTemplate feeders,
            PlateTemplate replicates) {
        int retVal = 0;
        for (Batch batch : batches) {
            for (Plate plate : batch) {
                applyTemplate(plate, dilutions, feeders, replicates);
                retVal++;
            }
        }
        log.info("Design templates applied to {} plates.", retVal);
        return retVal;
    }

}
