/**
 *
 */
package org.theseed.curation.sbml;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sbml.jsbml.Species;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage moves boundary metabolites into the boundary compartment.  A boundary metabolite has an ID
 * of the form <i>base</i>_<i>x</i>_boundary, where <i>x</i> is a compartment letter.  The ID becomes
 * <i>base</i>_<i>b</i>, where <i>b</i> is the boundary compartment ID, and the species is placed in the
 * boundary compartment.  The species references in the reactions are changed in the same pass.  If the
 * boundary compartment does not exist, it is created.
 *
 * @author Bruce Parrello
 *
 */
public class BoundaryRewriteStage extends TreeStage {

    // FIELDS
    /** pattern for boundary metabolite IDs */
    private final Pattern boundaryPattern;

    public BoundaryRewriteStage(CurationConfig config) {
        super(config, StageState.COMPARTMENTS_NAMED);
        this.boundaryPattern = Pattern.compile("(.+)_[" + config.getBoundaryLetters() + "]_boundary");
    }

    @Override
    public String getName() {
        return "rewrite boundary metabolites";
    }

    @Override
    public StageState getProvided() {
        return StageState.BOUNDARY_REWRITTEN;
    }

    /**
     * @return the rewritten form of a species ID, or NULL if it is not a boundary metabolite
     *
     * @param id	species ID to check
     */
    public String rewrite(String id) {
        String retVal = null;
        Matcher m = this.boundaryPattern.matcher(id);
        if (m.matches())
            retVal = m.group(1) + "_" + this.getConfig().getBoundaryId();
        return retVal;
    }

    @Override
    protected void edit(ModelTree tree, CurationReport report) {
        String boundaryId = this.getConfig().getBoundaryId();
        Map<String, String> renames = new LinkedHashMap<String, String>();
        for (Species species : tree.getSpecies()) {
            String newId = this.rewrite(species.getId());
            if (newId != null)
                renames.put(species.getId(), newId);
        }
        if (! renames.isEmpty()) {
            if (tree.getCompartment(boundaryId) == null) {
                log.info("Creating boundary compartment {}.", boundaryId);
                tree.addCompartment(boundaryId, this.getConfig().getBoundaryName());
            }
            Map<String, Species> moved = tree.renameSpecies(renames, report);
            for (Species species : moved.values())
                species.setCompartment(boundaryId);
        }
        log.info("{} boundary metabolites found.", renames.size());
    }

}
