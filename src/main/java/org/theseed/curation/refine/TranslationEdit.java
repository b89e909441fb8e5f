/**
 *
 */
package org.theseed.curation.refine;

/**
 * This object is a row of an identifier translation table.
 *
 * @author Bruce Parrello
 *
 */
public class TranslationEdit {

    // FIELDS
    /** identifier to replace */
    private final String original;
    /** replacement identifier */
    private final String novel;

    /**
     * Construct a translation edit.
     *
     * @param original	identifier to replace
     * @param novel		replacement identifier
     */
    public TranslationEdit(String original, String novel) {
        this.original = original;
        this.novel = novel;
    }

    /**
     * @return the identifier to replace
     */
    public String getOriginal() {
        return this.original;
    }

    /**
     * @return the replacement identifier
     */
    public String getNovel() {
        return this.novel;
    }

    @Override
    public String toString() {
        return this.original + " => " + this.novel;
    }

}
