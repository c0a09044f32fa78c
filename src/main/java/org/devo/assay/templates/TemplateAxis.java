/**
 *
 */
package org.devo.assay.templates;

import org.apache.commons.lang3.StringUtils;
import org.devo.assay.samples.WellLocation;
import org.devo.assay.utils.ParseFailureException;

/**
 * This enum describes the plate axis along which a design template assigns its labels.  A row template
 * is keyed by row letter and a column template by column number.
 *
 */
public enum TemplateAxis {
    ROW("Row") {
        @Override
        public String key(char row, int column) {
            return Character.toString(row);
        }

        @Override
        public String normalizeKey(String key) throws ParseFailureException {
            String retVal = StringUtils.trimToEmpty(key).toUpperCase();
            if (retVal.length() != 1 || ! WellLocation.isValidRow(retVal.charAt(0)))
                throw new ParseFailureException("Invalid row key \"" + key + "\" in template.");
            return retVal;
        }
    }, COLUMN("Column") {
        @Override
        public String key(char row, int column) {
            return Integer.toString(column);
        }

        @Override
        public String normalizeKey(String key) throws ParseFailureException {
            String trimmed = StringUtils.trimToEmpty(key);
            if (! StringUtils.isNumeric(trimmed) || trimmed.length() > 2
                    || ! WellLocation.isValidColumn(Integer.parseInt(trimmed)))
                throw new ParseFailureException("Invalid column key \"" + key + "\" in template.");
            return Integer.toString(Integer.parseInt(trimmed));
        }
    };

    /** name of the axis in template files */
    private final String label;

    private TemplateAxis(String label) {
        this.label = label;
    }

    /**
     * @return the template key for a well on this axis
     *
     * @param row		row letter of the well
     * @param column	column number of the well
     */
    public abstract String key(char row, int column);

    /**
     * @return the normalized form of a template key for this axis
     *
     * @param key	key string to normalize
     *
     * @throws ParseFailureException if the key is not valid for this axis
     */
    public abstract String normalizeKey(String key) throws ParseFailureException;

    /**
     * @return the name of this axis in template files
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the axis with the specified name
     *
     * @param label		axis name ("Row" or "Column", case-insensitive)
     *
     * @throws ParseFailureException if the name is not a valid axis
     */
    public static TemplateAxis parse(String label) throws ParseFailureException {
        String value = StringUtils.trimToEmpty(label);
        for (TemplateAxis axis : TemplateAxis.values()) {
            if (axis.label.equalsIgnoreCase(value))
                return axis;
        }
        throw new ParseFailureException("Invalid template axis \"" + label + "\".");
    }

}
