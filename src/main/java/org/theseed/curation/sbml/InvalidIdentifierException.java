/**
 *
 */
package org.theseed.curation.sbml;

import org.theseed.curation.CurationException;

/**
 * This exception describes an SBML rename that was skipped because the new ID would not be a legal
 * SBML identifier.  The species keeps its old ID.
 *
 * @author Bruce Parrello
 *
 */
public class InvalidIdentifierException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = -3121804561727015127L;

    /**
     * Construct an invalid-identifier exception.
     *
     * @param oldId		current species ID
     * @param newId		rejected new ID
     */
    public InvalidIdentifierException(String oldId, String newId) {
        super("Species " + oldId + " cannot be renamed to \"" + newId + "\", which is not a valid SBML identifier.");
    }

}
