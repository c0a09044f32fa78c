/**
 *
 */
package org.devo.assay.samples;

import org.devo.assay.utils.ParseFailureException;

/**
 * This exception is thrown when a location string is not in the form "Plate N - Well XNN".  It generally
 * indicates a corrupt instrument export.
 *
 */
public class MalformedLocationException extends ParseFailureException {

    /** serialization version ID */
    private static final long serialVersionUID = -6410473359712983372L;
    /** location string that failed */
    private final String location;

    public MalformedLocationException(String location, String reason) {
        super("Malformed location \"" + location + "\": " + reason);
        this.location = location;
    }

    /**
     * @return the location string that could not be parsed
     */
    public String getLocation() {
        return this.location;
    }

}
