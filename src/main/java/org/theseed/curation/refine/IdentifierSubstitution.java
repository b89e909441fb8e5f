/**
 *
 */
package org.theseed.curation.refine;

/**
 * This object represents a single identifier translation.  The original and novel identifiers are
 * wrapped in a pair of delimiters to form match targets, and each candidate ID is wrapped in the same
 * delimiters before it is searched.  A candidate whose wrapped form begins with the wrapped original
 * is rewritten.  A candidate that contains the wrapped original somewhere else is ambiguous and is
 * left alone.
 *
 * In the SBML model, species IDs have the compartment appended after an underscore, so the tree
 * form uses no prefix and an underscore suffix.  In the structured model the IDs stand alone, so the
 * structured form uses vertical bars on both sides, which makes it an exact match.
 *
 * @author Bruce Parrello
 *
 */
public class IdentifierSubstitution {

    /**
     * This enumeration describes the result of matching a candidate ID.
     */
    public static enum Match {
        /** candidate does not contain the original target */
        NONE,
        /** candidate begins with the original target and should be rewritten */
        REWRITE,
        /** candidate contains the original target somewhere other than the start */
        AMBIGUOUS;
    }

    // FIELDS
    /** original identifier */
    private final String original;
    /** novel identifier */
    private final String novel;
    /** delimiter placed before an ID */
    private final String prefix;
    /** delimiter placed after an ID */
    private final String suffix;
    /** wrapped original identifier */
    private final String originalTarget;
    /** wrapped novel identifier */
    private final String novelTarget;

    /**
     * Construct an identifier substitution.
     *
     * @param original	original identifier
     * @param novel		novel identifier
     * @param prefix	delimiter to place before IDs
     * @param suffix	delimiter to place after IDs
     */
    public IdentifierSubstitution(String original, String novel, String prefix, String suffix) {
        this.original = original;
        this.novel = novel;
        this.prefix = prefix;
        this.suffix = suffix;
        this.originalTarget = prefix + original + suffix;
        this.novelTarget = prefix + novel + suffix;
    }

    /**
     * @return a substitution for species IDs in an SBML model, which end in a compartment suffix
     *
     * @param original	original identifier
     * @param novel		novel identifier
     */
    public static IdentifierSubstitution forTree(String original, String novel) {
        return new IdentifierSubstitution(original, novel, "", "_");
    }

    /**
     * @return a substitution for metabolite IDs in a structured model
     *
     * @param original	original identifier
     * @param novel		novel identifier
     */
    public static IdentifierSubstitution forStructured(String original, String novel) {
        return new IdentifierSubstitution(original, novel, "|", "|");
    }

    /**
     * @return the wrapped form of an ID
     *
     * @param id	ID to wrap
     */
    private String wrap(String id) {
        return this.prefix + id + this.suffix;
    }

    /**
     * Determine how a candidate ID relates to this substitution.
     *
     * @param id	candidate ID
     *
     * @return the match type
     */
    public Match match(String id) {
        int pos = this.wrap(id).indexOf(this.originalTarget);
        Match retVal;
        if (pos < 0)
            retVal = Match.NONE;
        else if (pos == 0)
            retVal = Match.REWRITE;
        else
            retVal = Match.AMBIGUOUS;
        return retVal;
    }

    /**
     * Compute the rewritten form of an ID.  If the ID does not match at its start, it is returned
     * unchanged.
     *
     * @param id	ID to rewrite
     *
     * @return the new ID
     */
    public String apply(String id) {
        String retVal = id;
        if (this.match(id) == Match.REWRITE) {
            String wrapped = this.novelTarget + this.wrap(id).substring(this.originalTarget.length());
            retVal = wrapped.substring(this.prefix.length(), wrapped.length() - this.suffix.length());
        }
        return retVal;
    }

    /**
     * @return an exception describing an ambiguous match against the specified ID
     *
     * @param id	ID that matched ambiguously
     */
    public AmbiguousSubstitutionException ambiguity(String id) {
        return new AmbiguousSubstitutionException(this.original, this.novel, id);
    }

    /**
     * @return the original identifier
     */
    public String getOriginal() {
        return this.original;
    }

    /**
     * @return the novel identifier
     */
    public String getNovel() {
        return this.novel;
    }

    @Override
    public String toString() {
        return this.original + " => " + this.novel;
    }

}
