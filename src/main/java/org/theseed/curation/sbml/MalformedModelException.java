/**
 *
 */
package org.theseed.curation.sbml;

import org.theseed.curation.CurationException;

/**
 * This exception is thrown when an SBML file cannot be parsed or lacks one of the sections a
 * metabolic model needs (compartments, species, reactions).  It aborts the run.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedModelException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = 6101744851263325440L;

    public MalformedModelException(String message) {
        super(message);
    }

    public MalformedModelException(String message, Throwable cause) {
        super(message, cause);
    }

}
