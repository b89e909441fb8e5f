/**
 *
 */
package org.theseed.curation.meta;

/**
 * This exception is thrown when the command-line parameters are invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -1956389142011576924L;

    public ParseFailureException(String message) {
        super(message);
    }

}
