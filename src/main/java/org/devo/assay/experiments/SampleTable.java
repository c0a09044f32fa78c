/**
 *
 */
package org.devo.assay.experiments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.devo.assay.samples.MalformedLocationException;
import org.devo.assay.samples.SampleRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sample table is the normalized form of an export:  one immutable sample row per well, in export order.
 * This is the working data model that gets partitioned into batches and plates.
 *
 */
public class SampleTable implements Iterable<SampleRow> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SampleTable.class);
    /** normalized rows */
    private final List<SampleRow> rows;
    /** number of raw records skipped because of bad locations */
    private final int skipped;

    /**
     * Create a sample table from normalized rows.
     *
     * @param rows		list of sample rows
     */
    public SampleTable(List<SampleRow> rows) {
        this(rows, 0);
    }

    private SampleTable(List<SampleRow> rows, int skipped) {
        this.rows = Collections.unmodifiableList(new ArrayList<SampleRow>(rows));
        this.skipped = skipped;
    }

    /**
     * Normalize the records of a raw table.  In strict mode a malformed location stops processing.
     * Otherwise the bad record is logged and skipped.
     *
     * @param raw		raw export table
     * @param strict	TRUE to fail on the first malformed location
     *
     * @return the normalized table
     *
     * @throws MalformedLocationException if a location is malformed in strict mode
     */
    public static SampleTable normalize(RawTable raw, boolean strict) throws MalformedLocationException {
        List<SampleRow> rows = new ArrayList<SampleRow>(raw.size());
        int skipped = 0;
        int recordNum = 0;
        for (Map<String, String> record : raw) {
            recordNum++;
            try {
                rows.add(SampleRow.create(record));
            } catch (MalformedLocationException e) {
                if (strict)
                    throw e;
                log.warn("Skipping data row {}: {}", recordNum, e.getMessage());
                skipped++;
            }
        }
        log.info("{} sample rows normalized, {} skipped.", rows.size(), skipped);
        return new SampleTable(rows, skipped);
    }

    /**
     * @return the batches in this table, in the order their names first appear
     */
    public List<Batch> partition() {
        return BatchPartitioner.partitionBatches(this.rows);
    }

    /**
     * @return the normalized rows
     */
    public List<SampleRow> getRows() {
        return this.rows;
    }

    /**
     * @return the number of normalized rows
     */
    public int size() {
        return this.rows.size();
    }

    /**
     * @return the number of records skipped during normalization
     */
    public int getSkipped() {
        return this.skipped;
    }

    @Override
    public Iterator<SampleRow> iterator() {
        return this.rows.iterator();
    }

}
