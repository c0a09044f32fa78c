/**
 *
 */
package org.devo.assay.experiments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.devo.assay.samples.SampleRow;

/**
 * This is a static class that splits sample rows into batches and plates.  Each split is a single pass over
 * the rows.  Groups come out in the order their keys first appear, and each group gets its own row list.
 *
 */
public class BatchPartitioner {

    /**
     * Split sample rows into batches by batch name.
     *
     * @param rows	sample rows to split
     *
     * @return one batch per distinct batch name, in order of first appearance
     */
    public static List<Batch> partitionBatches(Collection<SampleRow> rows) {
        Map<String, List<SampleRow>> groups = group(rows, SampleRow::getBatchName);
        List<Batch> retVal = new ArrayList<Batch>(groups.size());
        for (Map.Entry<String, List<SampleRow>> groupEntry : groups.entrySet())
            retVal.add(new Batch(groupEntry.getKey(), groupEntry.getValue()));
        return retVal;
    }

    /**
     * Split the rows of a batch into plates by plate number.
     *
     * @param batchName		name of the owning batch
     * @param batchRows		sample rows belonging to the batch
     *
     * @return one plate per distinct plate number, in order of first appearance
     */
    public static List<Plate> partitionPlates(String batchName, Collection<SampleRow> batchRows) {
        Map<Integer, List<SampleRow>> groups = group(batchRows, SampleRow::getPlate);
        List<Plate> retVal = new ArrayList<Plate>(groups.size());
        for (Map.Entry<Integer, List<SampleRow>> groupEntry : groups.entrySet())
            retVal.add(new Plate(batchName, groupEntry.getKey(), groupEntry.getValue()));
        return retVal;
    }

    /**
     * @return a map from each key to the rows having that key, in order of first appearance
     *
     * @param rows		sample rows to group
     * @param keyFun	function that computes the key for a row
     */
    private static <K> Map<K, List<SampleRow>> group(Collection<SampleRow> rows, Function<SampleRow, K> keyFun) {
        Map<K, List<SampleRow>> retVal = new LinkedHashMap<K, List<SampleRow>>();
        for (SampleRow row : rows)
            retVal.computeIfAbsent(keyFun.apply(row), k -> new ArrayList<SampleRow>()).add(row);
        return retVal;
    }

}
