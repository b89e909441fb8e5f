/**
 *
 */
package org.theseed.curation.refine;

import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.pipeline.CurationStage;
import org.theseed.curation.pipeline.StageState;

/**
 * This is the base class for stages that apply a curator edit table to a structured model.  The
 * subclass edits a private copy of the input.
 *
 * @author Bruce Parrello
 *
 */
public abstract class RefinementStage implements CurationStage<CuratedModel> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RefinementStage.class);
    /** name of this stage */
    private final String name;
    /** states required */
    private final Set<StageState> required;
    /** state provided */
    private final StageState provided;

    /**
     * Construct a refinement stage.
     *
     * @param name			name of the stage
     * @param provided		state provided by the stage
     * @param required		states required by the stage
     */
    protected RefinementStage(String name, StageState provided, StageState... required) {
        this.name = name;
        this.provided = provided;
        this.required = EnumSet.noneOf(StageState.class);
        for (StageState state : required)
            this.required.add(state);
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public Set<StageState> getRequired() {
        return this.required;
    }

    @Override
    public StageState getProvided() {
        return this.provided;
    }

    @Override
    public CuratedModel apply(CuratedModel input, CurationReport report) throws CurationException {
        CuratedModel retVal = input.copy();
        this.edit(retVal, report);
        return retVal;
    }

    /**
     * Apply the edits for this stage to a model.
     *
     * @param model		model to edit (a private copy)
     * @param report	report to receive record-level problems and notes
     *
     * @throws CurationException
     */
    protected abstract void edit(CuratedModel model, CurationReport report) throws CurationException;

}
