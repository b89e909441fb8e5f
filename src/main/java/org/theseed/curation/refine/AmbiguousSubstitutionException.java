/**
 *
 */
package org.theseed.curation.refine;

import org.theseed.curation.CurationException;

/**
 * This exception describes an identifier that contains a translation target somewhere other than
 * at its start, so that applying the translation would rewrite the middle of an unrelated ID.  Such
 * IDs are reported and left unchanged.
 *
 * @author Bruce Parrello
 *
 */
public class AmbiguousSubstitutionException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = 2984720317163390517L;
    /** original identifier in the translation table */
    private final String original;
    /** ID that matched ambiguously */
    private final String matchedId;

    /**
     * Construct an ambiguous-substitution exception.
     *
     * @param original		original identifier from the translation table
     * @param novel			novel identifier from the translation table
     * @param matchedId		ID that contained the target
     */
    public AmbiguousSubstitutionException(String original, String novel, String matchedId) {
        super("Translation of " + original + " to " + novel + " matches inside unrelated ID " + matchedId + ".");
        this.original = original;
        this.matchedId = matchedId;
    }

    /**
     * @return the original identifier from the translation table
     */
    public String getOriginal() {
        return this.original;
    }

    /**
     * @return the ID that matched ambiguously
     */
    public String getMatchedId() {
        return this.matchedId;
    }

}
