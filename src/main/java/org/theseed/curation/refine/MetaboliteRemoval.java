/**
 *
 */
package org.theseed.curation.refine;

/**
 * This object is a row of a metabolite removal table.  The metabolite with the removal ID is deleted,
 * and reaction participants that referred to it are pointed at the replacement.
 *
 * @author Bruce Parrello
 *
 */
public class MetaboliteRemoval {

    // FIELDS
    /** ID of the metabolite to remove */
    private final String removalId;
    /** ID of the metabolite that replaces it in reactions */
    private final String replacementId;

    /**
     * Construct a metabolite removal.
     *
     * @param removalId			ID of the metabolite to remove
     * @param replacementId		ID of the replacement metabolite
     */
    public MetaboliteRemoval(String removalId, String replacementId) {
        this.removalId = removalId;
        this.replacementId = replacementId;
    }

    /**
     * @return the ID of the metabolite to remove
     */
    public String getRemovalId() {
        return this.removalId;
    }

    /**
     * @return the ID of the replacement metabolite
     */
    public String getReplacementId() {
        return this.replacementId;
    }

    @Override
    public String toString() {
        return "remove " + this.removalId + " (replacement " + this.replacementId + ")";
    }

}
