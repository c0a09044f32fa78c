/**
 *
 */
package org.devo.assay.utils;

/**
 * This exception is thrown when input text (a command-line value, a template line, or an instrument
 * field) does not have the form required for it.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 3904862381517649013L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
