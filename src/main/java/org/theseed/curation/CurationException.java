/**
 *
 */
package org.theseed.curation;

/**
 * This is the base class for all the errors detected while curating a metabolic model.  Each
 * subclass identifies a particular kind of defect in the model or in the curator's tables.
 *
 * @author Bruce Parrello
 *
 */
public class CurationException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -2637094186702133575L;

    /**
     * Construct a curation exception with a message.
     *
     * @param message	explanation of the problem
     */
    public CurationException(String message) {
        super(message);
    }

    /**
     * Construct a curation exception with a message and a cause.
     *
     * @param message	explanation of the problem
     * @param cause		underlying exception
     */
    public CurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
