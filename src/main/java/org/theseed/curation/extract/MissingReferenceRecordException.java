/**
 *
 */
package org.theseed.curation.extract;

import org.theseed.curation.CurationException;

/**
 * This exception describes an entity whose linked record (such as the gene record of a reaction)
 * was not found.  It is reported for the entity and does not stop extraction.
 *
 * @author Bruce Parrello
 *
 */
public class MissingReferenceRecordException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = 4404961542083360311L;
    /** ID of the entity lacking the record */
    private final String entityId;

    /**
     * Construct a missing-record exception.
     *
     * @param entityId		ID of the entity lacking the record
     * @param recordType	type of record missing
     */
    public MissingReferenceRecordException(String entityId, String recordType) {
        super("No " + recordType + " record found for " + entityId + ".");
        this.entityId = entityId;
    }

    /**
     * @return the ID of the entity lacking the record
     */
    public String getEntityId() {
        return this.entityId;
    }

}
