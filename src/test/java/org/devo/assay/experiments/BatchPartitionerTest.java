/**
 *
 */
package org.devo.assay.experiments;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.devo.assay.samples.SampleBarcode;
import org.devo.assay.samples.SampleRow;
import org.devo.assay.samples.WellLocation;
import org.junit.jupiter.api.Test;

/**
 * Tests for splitting sample rows into batches and plates.
 *
 */
public class BatchPartitionerTest {

    /**
     * @return a test sample row
     *
     * @param barcode	barcode number
     * @param batch		batch name
     * @param plate		plate number
     * @param row		row letter
     * @param col		column number
     * @param conc		concentration in pg/ml
     */
    protected static SampleRow sample(int barcode, String batch, int plate, char row, int col, double conc) {
        WellLocation loc = new WellLocation(plate, row, col);
        return new SampleRow(SampleBarcode.numeric(barcode), loc.toString(), loc, "Specimen", batch, 0.01 * barcode,
                conc, "");
    }

    /**
     * @return a list of rows spanning two batches, the second of which has two plates
     */
    private static List<SampleRow> testRows() {
        List<SampleRow> retVal = new ArrayList<SampleRow>();
        retVal.add(sample(1, "B2", 2, 'A', 1, 0.5));
        retVal.add(sample(2, "B1", 1, 'A', 1, 1.5));
        retVal.add(sample(3, "B2", 1, 'A', 2, 0.25));
        retVal.add(sample(4, "B2", 2, 'B', 1, Double.NaN));
        retVal.add(sample(5, "B1", 1, 'A', 2, 2.0));
        retVal.add(sample(6, "B2", 1, 'H', 12, 4.0));
        retVal.add(sample(7, "B2", 2, 'C', 5, 0.125));
        return retVal;
    }

    @Test
    public void testPartitions() {
        List<SampleRow> rows = testRows();
        List<Batch> batches = BatchPartitioner.partitionBatches(rows);
        assertThat(batches.size(), equalTo(2));
        // Batches and plates come out in the order they are first seen.
        Batch batch = batches.get(0);
        assertThat(batch.getName(), equalTo("B2"));
        assertThat(batch.size(), equalTo(5));
        assertThat(batch.getPlates().size(), equalTo(2));
        Plate plate = batch.getPlates().get(0);
        assertThat(plate.getBatchName(), equalTo("B2"));
        assertThat(plate.getPlateNumber(), equalTo(2));
        assertThat(plate.size(), equalTo(3));
        plate = batch.getPlates().get(1);
        assertThat(plate.getPlateNumber(), equalTo(1));
        assertThat(plate.size(), equalTo(2));
        assertThat(batch.getPlate(1), sameInstance(plate));
        assertThat(batch.getPlate(3), nullValue());
        batch = batches.get(1);
        assertThat(batch.getName(), equalTo("B1"));
        assertThat(batch.size(), equalTo(2));
        assertThat(batch.getPlates().size(), equalTo(1));
        assertThat(batch.getPlates().get(0).size(), equalTo(2));
        // Every row is in exactly one batch and one plate.
        Set<SampleRow> seen = new HashSet<SampleRow>();
        int total = 0;
        for (Batch b : batches) {
            int batchTotal = 0;
            for (Plate p : b) {
                for (PlateWell well : p) {
                    assertThat(well.getSample().getBatchName(), equalTo(b.getName()));
                    assertThat(well.getSample().getPlate(), equalTo(p.getPlateNumber()));
                    assertThat(seen.add(well.getSample()), equalTo(true));
                    batchTotal++;
                }
            }
            assertThat(batchTotal, equalTo(b.size()));
            total += batchTotal;
        }
        assertThat(total, equalTo(rows.size()));
        assertThat(seen, containsInAnyOrder(rows.toArray()));
    }

    @Test
    public void testPlateOrder() {
        List<SampleRow> rows = testRows();
        List<Plate> plates = BatchPartitioner.partitionPlates("B2", rows.subList(2, rows.size()));
        assertThat(plates.size(), equalTo(2));
        assertThat(plates.get(0).getPlateNumber(), equalTo(1));
        assertThat(plates.get(1).getPlateNumber(), equalTo(2));
        List<PlateWell> wells = plates.get(0).getWells();
        assertThat(wells.get(0).getSample().getBarcode().getNumber(), equalTo(3L));
        assertThat(wells.get(1).getSample().getBarcode().getNumber(), equalTo(6L));
        assertThat(plates.get(0).getWells('H', 12).size(), equalTo(1));
        assertThat(plates.get(0).getWells('H', 11).size(), equalTo(0));
        // The result is the same each time.
        List<Plate> again = BatchPartitioner.partitionPlates("B2", rows.subList(2, rows.size()));
        assertThat(again.get(0).getPlateNumber(), equalTo(1));
        assertThat(again.get(1).getPlateNumber(), equalTo(2));
    }

    @Test
    public void testHighestValue() {
        List<Batch> batches = BatchPartitioner.partitionBatches(testRows());
        assertThat(batches.get(0).getHighestValue(), closeTo(4000.0, 1e-9));
        assertThat(batches.get(0).getConcentrationStats().getN(), equalTo(4L));
        assertThat(batches.get(1).getHighestValue(), closeTo(2000.0, 1e-9));
        assertThat(batches.get(1).getConcentrationStats().getMean(), closeTo(1750.0, 1e-9));
        Batch empty = new Batch("none", Collections.emptyList());
        assertThat(empty.getHighestValue(), notANumber());
        assertThat(empty.getPlates(), empty());
        List<SampleRow> missing = new ArrayList<SampleRow>();
        missing.add(sample(8, "B3", 1, 'A', 1, Double.NaN));
        missing.add(sample(9, "B3", 1, 'A', 2, Double.NaN));
        Batch noValues = new Batch("B3", missing);
        assertThat(noValues.getHighestValue(), notANumber());
        assertThat(noValues.getPlates().size(), equalTo(1));
    }

    @Test
    public void testPlaceholders() {
        Batch batch = BatchPartitioner.partitionBatches(testRows()).get(0);
        assertThat(batch.getDate().isPresent(), equalTo(false));
        assertThat(batch.getQcs().isPresent(), equalTo(false));
        assertThat(batch.getStandards().isPresent(), equalTo(false));
        assertThat(batch.getLot().isPresent(), equalTo(false));
        batch.setLot("LOT-502");
        assertThat(batch.getLot().get(), equalTo("LOT-502"));
    }

    @Test
    public void testOwnership() {
        List<SampleRow> rows = testRows();
        List<Batch> batches = BatchPartitioner.partitionBatches(rows);
        // Changing the source list does not change the batches.
        rows.clear();
        assertThat(batches.get(0).size(), equalTo(5));
        assertThat(batches.get(1).size(), equalTo(2));
        // Each plate has its own wells.
        Plate plate = batches.get(0).getPlate(2);
        assertThat(plate.getWells().get(0).isDesigned(), equalTo(false));
        plate.getWells().get(0).setFeeders("FeederOne");
        Batch rebuilt = new Batch("B2", batches.get(0).getRows());
        assertThat(rebuilt.getPlate(2).getWells().get(0).getFeeders(), nullValue());
        assertThat(rebuilt.getPlate(2).getWells().get(0).getSample(),
                sameInstance(plate.getWells().get(0).getSample()));
    }

}
