/**
 *
 */
package org.theseed.curation.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * This class extracts categorized external identifiers from annotation strings.  An annotation
 * string is a list of database-prefixed identifiers separated by semicolons, such as
 *
 * 		chebi:15377;kegg:C00001;hmdb:HMDB02111
 *
 * The category is selected by a key token ("chebi:").  Any item that contains the key is kept,
 * and the key is removed from it.  Note this is a contains-match, not a prefix match, so a key
 * that appears inside another database's identifiers will pick those up as well.
 *
 * @author Bruce Parrello
 *
 */
public class ReferenceParser {

    /** separator between annotation items */
    public static final String SEPARATOR = ";";

    /**
     * Extract the identifiers for a category from an annotation string.
     *
     * @param source	annotation string (may be NULL)
     * @param key		key token for the category
     *
     * @return the list of identifiers with the key removed, in their original order
     */
    public static List<String> extract(String source, String key) {
        List<String> retVal;
        if (StringUtils.isEmpty(source) || StringUtils.isEmpty(key))
            retVal = Collections.emptyList();
        else {
            retVal = new ArrayList<String>();
            for (String item : StringUtils.splitPreserveAllTokens(source, SEPARATOR)) {
                if (item.contains(key))
                    retVal.add(StringUtils.remove(item, key));
            }
        }
        return retVal;
    }

    /**
     * Extract the identifiers for a category from several annotation strings.  The result is the
     * union of the matches in each string, in order of first appearance.
     *
     * @param key		key token for the category
     * @param sources	annotation strings to search (NULLs are skipped)
     *
     * @return the list of distinct identifiers with the key removed
     */
    public static List<String> extractAll(String key, String... sources) {
        Set<String> found = new LinkedHashSet<String>();
        for (String source : sources)
            found.addAll(extract(source, key));
        return new ArrayList<String>(found);
    }

    /**
     * Split an annotation string into its items, dropping empty ones.
     *
     * @param source	annotation string (may be NULL)
     *
     * @return the list of non-empty items, in order
     */
    public static List<String> split(String source) {
        List<String> retVal = new ArrayList<String>();
        if (source != null) {
            for (String item : StringUtils.split(source, SEPARATOR)) {
                String trimmed = item.trim();
                if (! trimmed.isEmpty())
                    retVal.add(trimmed);
            }
        }
        return retVal;
    }

}
