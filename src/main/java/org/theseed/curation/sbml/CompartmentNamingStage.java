/**
 *
 */
package org.theseed.curation.sbml;

import org.sbml.jsbml.Compartment;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage gives the boundary and extracellular compartments their descriptive names.
 *
 * @author Bruce Parrello
 *
 */
public class CompartmentNamingStage extends TreeStage {

    public CompartmentNamingStage(CurationConfig config) {
        super(config, StageState.LOADED);
    }

    @Override
    public String getName() {
        return "name compartments";
    }

    @Override
    public StageState getProvided() {
        return StageState.COMPARTMENTS_NAMED;
    }

    @Override
    protected void edit(ModelTree tree, CurationReport report) {
        CurationConfig config = this.getConfig();
        rename(tree, config.getBoundaryId(), config.getBoundaryName());
        rename(tree, config.getExtracellularId(), config.getExtracellularName());
    }

    /**
     * Rename a compartment if it exists.
     *
     * @param tree		model tree containing the compartment
     * @param id		ID of the compartment
     * @param name		new name for the compartment
     */
    private static void rename(ModelTree tree, String id, String name) {
        Compartment comp = tree.getCompartment(id);
        if (comp == null)
            log.debug("Compartment {} not found in model.", id);
        else {
            log.debug("Compartment {} renamed from \"{}\" to \"{}\".", id, comp.getName(), name);
            comp.setName(name);
        }
    }

}
