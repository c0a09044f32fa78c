/**
 *
 */
package org.devo.assay.templates;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.devo.assay.samples.SampleRow;
import org.devo.assay.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A plate template describes one aspect of an experiment's design (the dilutions, the feeders, or the
 * replicates) as laid out on a plate.  The template has an axis (row or column) and a map from row letters
 * or column numbers to labels.  A well whose row or column is not in the map is unassigned.
 *
 * In a template file, the first line is "Axis", a tab, and "Row" or "Column".  Each remaining line contains
 * a row letter or column number, a tab, and the label.  Blank lines and lines beginning with "#" are ignored.
 *
 */
public class PlateTemplate {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PlateTemplate.class);
    /** axis of the template */
    private final TemplateAxis axis;
    /** map of normalized keys to labels */
    private final Map<String, String> assignments;

    /** label for a well not covered by the template */
    public static final String UNASSIGNED = "unassigned";
    /** name of the axis entry in a template mapping */
    public static final String AXIS_KEY = "Axis";
    /** format of a template file */
    private static final CSVFormat TEMPLATE_FORMAT = CSVFormat.TDF.builder().setCommentMarker('#').build();

    /**
     * Construct a plate template.
     *
     * @param axis			axis of the template
     * @param assignments	map of row letters or column numbers to labels
     *
     * @throws ParseFailureException if a key is invalid for the axis or a key or label is missing
     */
    public PlateTemplate(TemplateAxis axis, Map<?, ?> assignments) throws ParseFailureException {
        this.axis = axis;
        this.assignments = new LinkedHashMap<String, String>(assignments.size() * 4 / 3 + 1);
        for (Map.Entry<?, ?> entry : assignments.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null)
                throw new ParseFailureException("Template entry \"" + entry.getKey() + "\" has no label.");
            this.assign(entry.getKey().toString(), entry.getValue().toString());
        }
    }

    /**
     * Store a label for a key.
     *
     * @param key		row letter or column number
     * @param label		label to assign
     *
     * @throws ParseFailureException if the key is invalid for this template's axis
     */
    private void assign(String key, String label) throws ParseFailureException {
        String normalized = this.axis.normalizeKey(key);
        if (this.assignments.containsKey(normalized))
            throw new ParseFailureException("Duplicate key \"" + key + "\" in template.");
        this.assignments.put(normalized, label);
    }

    /**
     * Create a template from an untyped mapping.  The mapping must contain an "Axis" entry naming the axis.
     * All the other entries are assignments.
     *
     * @param mapping	template mapping
     *
     * @return the template described by the mapping
     *
     * @throws ParseFailureException if the axis is missing or invalid, or a key does not fit the axis
     */
    public static PlateTemplate fromMap(Map<?, ?> mapping) throws ParseFailureException {
        Object axisName = mapping.get(AXIS_KEY);
        if (axisName == null)
            throw new ParseFailureException("Template has no " + AXIS_KEY + " entry.");
        TemplateAxis axis = TemplateAxis.parse(axisName.toString());
        Map<Object, Object> assignments = new LinkedHashMap<Object, Object>(mapping);
        assignments.remove(AXIS_KEY);
        return new PlateTemplate(axis, assignments);
    }

    /**
     * Load a template from a tab-delimited file.
     *
     * @param inFile	template file to read
     *
     * @return the template in the file
     *
     * @throws IOException
     * @throws ParseFailureException if the file is not a valid template
     */
    public static PlateTemplate load(File inFile) throws IOException, ParseFailureException {
        PlateTemplate retVal;
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            Iterator<CSVRecord> records = TEMPLATE_FORMAT.parse(reader).iterator();
            if (! records.hasNext())
                throw new ParseFailureException("Template file " + inFile + " is empty.");
            CSVRecord axisRecord = records.next();
            if (axisRecord.size() < 2 || ! axisRecord.get(0).equals(AXIS_KEY))
                throw new ParseFailureException("Template file " + inFile + " does not begin with an "
                        + AXIS_KEY + " line.");
            retVal = new PlateTemplate(TemplateAxis.parse(axisRecord.get(1)), Collections.emptyMap());
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() < 2)
                    throw new ParseFailureException("Line " + record.getRecordNumber() + " of template file "
                            + inFile + " has no label.");
                retVal.assign(record.get(0), record.get(1));
            }
        }
        log.info("{}-axis template with {} assignments loaded from {}.", retVal.axis.getLabel(),
                retVal.assignments.size(), inFile);
        return retVal;
    }

    /**
     * @return the label for a well, or UNASSIGNED if the template does not cover it
     *
     * @param row		row letter of the well
     * @param column	column number of the well
     */
    public String resolve(char row, int column) {
        return this.assignments.getOrDefault(this.axis.key(row, column), UNASSIGNED);
    }

    /**
     * @return the label for a sample's well, or UNASSIGNED if the template does not cover it
     *
     * @param sample	sample row whose well is to be resolved
     */
    public String resolve(SampleRow sample) {
        return this.resolve(sample.getRow(), sample.getColumn());
    }

    /**
     * @return the axis of this template
     */
    public TemplateAxis getAxis() {
        return this.axis;
    }

    /**
     * @return the map of normalized keys to labels
     */
    public Map<String, String> getAssignments() {
        return Collections.unmodifiableMap(this.assignments);
    }

}
