/**
 *
 */
package org.theseed.curation.sbml;

import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.CurationStage;
import org.theseed.curation.pipeline.StageState;

/**
 * This is the base class for stages that edit an SBML model tree.  Each stage edits a copy of its
 * input tree.
 *
 * @author Bruce Parrello
 *
 */
public abstract class TreeStage implements CurationStage<ModelTree> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TreeStage.class);
    /** curation configuration */
    private final CurationConfig config;
    /** states required by this stage */
    private final Set<StageState> required;

    /**
     * Construct a tree stage.
     *
     * @param config		curation configuration
     * @param required		states required by this stage
     */
    protected TreeStage(CurationConfig config, StageState... required) {
        this.config = config;
        this.required = EnumSet.noneOf(StageState.class);
        for (StageState state : required)
            this.required.add(state);
    }

    /**
     * @return the curation configuration
     */
    protected CurationConfig getConfig() {
        return this.config;
    }

    @Override
    public Set<StageState> getRequired() {
        return this.required;
    }

    @Override
    public ModelTree apply(ModelTree input, CurationReport report) throws CurationException {
        ModelTree retVal = input.copy();
        this.edit(retVal, report);
        return retVal;
    }

    /**
     * Edit a model tree.
     *
     * @param tree		tree to edit (a private copy)
     * @param report	report to receive record-level problems and notes
     *
     * @throws CurationException
     */
    protected abstract void edit(ModelTree tree, CurationReport report) throws CurationException;

}
