/**
 *
 */
package org.devo.assay.samples;

/**
 * A well location identifies a single well on a numbered 96-well plate.  The well address consists of a
 * row letter (A through H) and a column number (1 through 12).  The instrument reports locations in the
 * form "Plate 1 - Well A12".
 *
 */
public class WellLocation implements Comparable<WellLocation> {

    // FIELDS
    /** plate number */
    private final int plate;
    /** row letter */
    private final char row;
    /** column number */
    private final int column;

    /** row letters on a plate, in order */
    public static final String ROW_LETTERS = "ABCDEFGH";
    /** number of columns on a plate */
    public static final int COLUMNS = 12;

    /**
     * Construct a well location.
     *
     * @param plate		plate number
     * @param row		row letter (A-H)
     * @param column	column number (1-12)
     */
    public WellLocation(int plate, char row, int column) {
        this.plate = plate;
        this.row = row;
        this.column = column;
    }

    /**
     * @return the plate number
     */
    public int getPlate() {
        return this.plate;
    }

    /**
     * @return the row letter
     */
    public char getRow() {
        return this.row;
    }

    /**
     * @return the column number
     */
    public int getColumn() {
        return this.column;
    }

    /**
     * @return the well label (row letter followed by column number)
     */
    public String getWell() {
        return this.row + Integer.toString(this.column);
    }

    /**
     * @return TRUE if the specified row letter is valid on a plate
     *
     * @param row	row letter to check
     */
    public static boolean isValidRow(char row) {
        return ROW_LETTERS.indexOf(row) >= 0;
    }

    /**
     * @return TRUE if the specified column number is valid on a plate
     *
     * @param column	column number to check
     */
    public static boolean isValidColumn(int column) {
        return column >= 1 && column <= COLUMNS;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.column;
        result = prime * result + this.plate;
        result = prime * result + this.row;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof WellLocation))
            return false;
        WellLocation other = (WellLocation) obj;
        return this.plate == other.plate && this.row == other.row && this.column == other.column;
    }

    /**
     * Locations sort by plate, then row, then column.
     */
    @Override
    public int compareTo(WellLocation o) {
        int retVal = Integer.compare(this.plate, o.plate);
        if (retVal == 0) {
            retVal = Character.compare(this.row, o.row);
            if (retVal == 0)
                retVal = Integer.compare(this.column, o.column);
        }
        return retVal;
    }

    /**
     * @return the location in the instrument's format
     */
    @Override
    public String toString() {
        return "Plate " + this.plate + " - Well " + this.getWell();
    }

}
