/**
 *
 */
package org.theseed.curation.refine;

import java.util.List;

import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage deletes reactions from a structured model.  The participants of a deleted reaction are
 * discarded with it.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionRemovalStage extends RefinementStage {

    // FIELDS
    /** IDs of the reactions to delete */
    private final List<String> reactionIds;

    /**
     * Construct a reaction removal stage.
     *
     * @param reactionIds	IDs of the reactions to delete
     */
    public ReactionRemovalStage(List<String> reactionIds) {
        super("remove reactions", StageState.REACTIONS_REMOVED, StageState.METABOLITES_REMOVED);
        this.reactionIds = reactionIds;
    }

    @Override
    protected void edit(CuratedModel model, CurationReport report) {
        int deleted = 0;
        for (String id : this.reactionIds) {
            if (model.removeReaction(id) != null)
                deleted++;
            else
                report.addNote("Reaction " + id + " was already absent from the model.");
        }
        log.info("{} reactions deleted.", deleted);
    }

}
