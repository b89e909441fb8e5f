/**
 *
 */
package org.theseed.curation.refine;

import org.theseed.curation.CurationException;

/**
 * This exception is thrown when a curator edit table is missing a column, names an unknown field,
 * or contains a value that cannot be applied.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedEditTableException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = -5590213408818162790L;

    /**
     * Construct a malformed-edit-table exception.
     *
     * @param message	description of the problem
     */
    public MalformedEditTableException(String message) {
        super(message);
    }

}
