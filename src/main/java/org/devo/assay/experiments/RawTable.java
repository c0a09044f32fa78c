/**
 *
 */
package org.devo.assay.experiments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * A raw table is the row-oriented content of an instrument export before normalization.  Each record maps
 * column names to the text in that column.  Column order is the order of the export's header row.
 *
 */
public class RawTable implements Iterable<Map<String, String>> {

    // FIELDS
    /** column names, in order */
    private final List<String> columns;
    /** data records */
    private final List<Map<String, String>> records;

    /**
     * Create an empty raw table.
     *
     * @param headers	array of column names
     */
    public RawTable(String... headers) {
        this.columns = new ArrayList<String>(headers.length);
        for (String header : headers)
            this.columns.add(StringUtils.trimToEmpty(header));
        this.records = new ArrayList<Map<String, String>>();
    }

    /**
     * Add a data record.  Missing trailing fields are stored as empty strings, and extra fields are ignored.
     *
     * @param fields	array of field values, in column order
     */
    public void add(String... fields) {
        Map<String, String> record = new LinkedHashMap<String, String>(this.columns.size() * 4 / 3 + 1);
        for (int i = 0; i < this.columns.size(); i++) {
            String value = (i < fields.length ? StringUtils.defaultString(fields[i]) : "");
            record.put(this.columns.get(i), value);
        }
        this.records.add(record);
    }

    /**
     * @return a copy of this table containing only the specified columns.  Requested columns not in this
     * 		   table are omitted.
     *
     * @param keep	list of column names to keep
     */
    public RawTable project(List<String> keep) {
        List<String> kept = this.columns.stream().filter(x -> keep.contains(x)).collect(Collectors.toList());
        RawTable retVal = new RawTable(kept.toArray(new String[kept.size()]));
        for (Map<String, String> record : this.records) {
            String[] fields = kept.stream().map(x -> record.get(x)).toArray(String[]::new);
            retVal.add(fields);
        }
        return retVal;
    }

    /**
     * @return the column names, in order
     */
    public List<String> getColumns() {
        return Collections.unmodifiableList(this.columns);
    }

    /**
     * @return the number of data records
     */
    public int size() {
        return this.records.size();
    }

    /**
     * @return the specified data record
     *
     * @param idx	index (0-based) of the desired record
     */
    public Map<String, String> get(int idx) {
        return Collections.unmodifiableMap(this.records.get(idx));
    }

    @Override
    public Iterator<Map<String, String>> iterator() {
        return this.records.stream().map(x -> Collections.unmodifiableMap(x)).iterator();
    }

}
