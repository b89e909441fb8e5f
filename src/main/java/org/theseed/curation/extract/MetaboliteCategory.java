/**
 *
 */
package org.theseed.curation.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.theseed.curation.parse.ReferenceParser;

/**
 * This enumeration lists the external-database categories extracted for a metabolite.  Most
 * categories are found by their key in the reference and source fields of the metabolite record.
 * The MetaNetX category always begins with the metabolite's own ID, followed by its deprecated IDs.
 *
 * @author Bruce Parrello
 *
 */
public enum MetaboliteCategory {
    CHEBI("chebi:"),
    BIGG("bigg:"),
    METANETX("deprecated:") {
        @Override
        public List<String> extract(Map<String, String> record) {
            List<String> retVal = new ArrayList<String>();
            retVal.add(record.get(FlatExportExtractor.METABOLITE_ID));
            for (String id : super.extract(record)) {
                if (! retVal.contains(id))
                    retVal.add(id);
            }
            return retVal;
        }
    },
    ENVIPATH("envipath:"),
    HMDB("hmdb:"),
    KEGG("kegg:"),
    LIPIDMAPS("lipidmaps:"),
    METACYC("metacyc:"),
    REACTOME("reactome:"),
    SABIORK("sabiork:"),
    SEED("seed:"),
    SLM("slm:");

    /** key marking this category in an annotation string */
    private final String key;

    private MetaboliteCategory(String key) {
        this.key = key;
    }

    /**
     * @return the identifiers for this category in a metabolite record
     *
     * @param record	metabolite record from the flat export
     */
    public List<String> extract(Map<String, String> record) {
        return ReferenceParser.extractAll(this.key, record.get(FlatExportExtractor.METABOLITE_REFERENCE),
                record.get(FlatExportExtractor.METABOLITE_SOURCE));
    }

    /**
     * @return the annotation key for this category
     */
    public String getKey() {
        return this.key;
    }

    @Override
    public String toString() {
        return this.name().toLowerCase();
    }

}
