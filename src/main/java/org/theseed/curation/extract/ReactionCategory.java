/**
 *
 */
package org.theseed.curation.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theseed.curation.parse.ReferenceParser;

/**
 * This enumeration lists the external-database categories extracted for a reaction.  The model category
 * is the reaction's ID in the source network, taken verbatim.  The MetaNetX category begins with the
 * export ID and continues with the deprecated IDs.  The enzyme commission numbers come from their own
 * column.  The rest are found by key in the reference field.
 *
 * @author Bruce Parrello
 *
 */
public enum ReactionCategory {
    MODEL(null) {
        @Override
        public List<String> extract(Map<String, String> record) {
            List<String> retVal = new ArrayList<String>(1);
            String id = record.get(FlatExportExtractor.REACTION_MODEL_ID);
            if (! StringUtils.isEmpty(id))
                retVal.add(id);
            return retVal;
        }
    },
    RHEA("rhea:"),
    BIGG("bigg:"),
    METANETX("deprecated:") {
        @Override
        public List<String> extract(Map<String, String> record) {
            List<String> retVal = new ArrayList<String>();
            String id = record.get(FlatExportExtractor.REACTION_METANETX);
            if (! StringUtils.isEmpty(id))
                retVal.add(id);
            for (String prior : super.extract(record)) {
                if (! retVal.contains(prior))
                    retVal.add(prior);
            }
            return retVal;
        }
    },
    ENZYME_COMMISSION(null) {
        @Override
        public List<String> extract(Map<String, String> record) {
            return ReferenceParser.split(record.get(FlatExportExtractor.REACTION_EC));
        }
    },
    KEGG("kegg:"),
    METACYC("metacyc:"),
    REACTOME("reactome:"),
    SABIORK("sabiork:"),
    SEED("seed:");

    /** key marking this category in an annotation string */
    private final String key;

    private ReactionCategory(String key) {
        this.key = key;
    }

    /**
     * @return the identifiers for this category in a reaction record
     *
     * @param record	reaction record from the flat export
     */
    public List<String> extract(Map<String, String> record) {
        return ReferenceParser.extract(record.get(FlatExportExtractor.REACTION_REFERENCE), this.key);
    }

    @Override
    public String toString() {
        return this.name().toLowerCase();
    }

}
