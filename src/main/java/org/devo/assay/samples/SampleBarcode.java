/**
 *
 */
package org.devo.assay.samples;

/**
 * A sample barcode is either numeric (ordinary samples) or text (calibrators and QC samples).  Text
 * barcodes are always stored in upper case.
 *
 */
public class SampleBarcode {

    // FIELDS
    /** numeric value, or NULL for a text barcode */
    private final Long number;
    /** text value, in upper case */
    private final String text;

    private SampleBarcode(Long number, String text) {
        this.number = number;
        this.text = text;
    }

    /**
     * @return a numeric barcode
     *
     * @param number	barcode number
     */
    public static SampleBarcode numeric(long number) {
        return new SampleBarcode(number, Long.toString(number));
    }

    /**
     * @return a text barcode
     *
     * @param text	barcode text (will be converted to upper case)
     */
    public static SampleBarcode text(String text) {
        return new SampleBarcode(null, text.toUpperCase());
    }

    /**
     * @return TRUE if this is a numeric barcode
     */
    public boolean isNumeric() {
        return this.number != null;
    }

    /**
     * @return the barcode number
     *
     * @throws IllegalStateException if this is a text barcode
     */
    public long getNumber() {
        if (this.number == null)
            throw new IllegalStateException("Barcode \"" + this.text + "\" is not numeric.");
        return this.number;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((this.number == null) ? 0 : this.number.hashCode());
        result = prime * result + this.text.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof SampleBarcode))
            return false;
        SampleBarcode other = (SampleBarcode) obj;
        if (this.number == null) {
            if (other.number != null)
                return false;
        } else if (! this.number.equals(other.number))
            return false;
        return this.text.equals(other.text);
    }

    @Override
    public String toString() {
        return this.text;
    }

}
