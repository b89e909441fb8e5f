/**
 *
 */
package org.theseed.curation.refine;

import java.util.List;

import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage applies field overrides to the metabolites and reactions of a structured model.  An
 * override naming an ID that is neither a metabolite nor a reaction is an error.
 *
 * @author Bruce Parrello
 *
 */
public class FieldOverrideStage extends RefinementStage {

    // FIELDS
    /** overrides to apply, in order */
    private final List<FieldOverride> overrides;

    /**
     * Construct a field override stage.
     *
     * @param overrides		overrides to apply, in order
     */
    public FieldOverrideStage(List<FieldOverride> overrides) {
        super("override fields", StageState.FIELDS_OVERRIDDEN, StageState.IDENTIFIERS_TRANSLATED,
                StageState.REACTIONS_REMOVED);
        this.overrides = overrides;
    }

    @Override
    protected void edit(CuratedModel model, CurationReport report) throws MalformedEditTableException {
        for (FieldOverride override : this.overrides) {
            Metabolite metabolite = model.getMetabolite(override.getIdentifier());
            if (metabolite != null)
                override.getField().apply(metabolite, override.getValue());
            else {
                Reaction reaction = model.getReaction(override.getIdentifier());
                if (reaction == null)
                    throw new MalformedEditTableException("Override target " + override.getIdentifier()
                            + " is not a metabolite or reaction in the model.");
                override.getField().apply(reaction, override.getValue());
            }
        }
        log.info("{} field overrides applied.", this.overrides.size());
    }

}
