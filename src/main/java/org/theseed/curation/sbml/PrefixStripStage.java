/**
 *
 */
package org.theseed.curation.sbml;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.Annotation;
import org.sbml.jsbml.Species;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage removes the species-type prefix from species IDs, from the species references in the
 * reactions, from species metadata IDs, and from the "about" attribute of species annotations.  In
 * the annotation, the prefix follows the annotation marker.
 *
 * @author Bruce Parrello
 *
 */
public class PrefixStripStage extends TreeStage {

    public PrefixStripStage(CurationConfig config) {
        super(config, StageState.BOUNDARY_REWRITTEN);
    }

    @Override
    public String getName() {
        return "strip species prefix";
    }

    @Override
    public StageState getProvided() {
        return StageState.PREFIX_STRIPPED;
    }

    /**
     * Remove a prefix from the front of a string.  Repeated copies of the prefix are all removed, so
     * stripping a string twice gives the same result as stripping it once.
     *
     * @param value		string to strip
     * @param prefix	prefix to remove
     *
     * @return the string without the prefix
     */
    public static String stripPrefix(String value, String prefix) {
        String retVal = value;
        if (retVal != null && ! prefix.isEmpty()) {
            while (retVal.startsWith(prefix))
                retVal = retVal.substring(prefix.length());
        }
        return retVal;
    }

    @Override
    protected void edit(ModelTree tree, CurationReport report) {
        String prefix = this.getConfig().getSpeciesPrefix();
        Map<String, String> renames = new LinkedHashMap<String, String>();
        for (Species species : tree.getSpecies()) {
            String newId = stripPrefix(species.getId(), prefix);
            if (! newId.equals(species.getId()))
                renames.put(species.getId(), newId);
        }
        Map<String, Species> moved = tree.renameSpecies(renames, report);
        String marker = this.getConfig().getAnnotationMarker();
        for (Species species : moved.values()) {
            if (species.isSetMetaId()) {
                String metaId = stripPrefix(species.getMetaId(), prefix);
                if (ModelTree.isValidId(metaId) && ! metaId.equals(species.getMetaId()))
                    species.setMetaId(metaId);
            }
            if (species.isSetAnnotation()) {
                Annotation annotation = species.getAnnotation();
                String about = annotation.getAbout();
                if (about != null && about.startsWith(marker))
                    annotation.setAbout(marker + stripPrefix(about.substring(marker.length()), prefix));
                else if (StringUtils.isEmpty(about) && species.isSetMetaId())
                    annotation.setAbout(marker + species.getMetaId());
            }
        }
        log.info("{} species prefixes stripped.", moved.size());
    }

}
