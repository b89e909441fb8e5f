/**
 *
 */
package org.theseed.curation.refine;

import java.util.ArrayList;
import java.util.List;

import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage removes metabolites from a structured model.  For each row of the removal table, the
 * metabolite is deleted (if it exists) and then every reaction in the model is scanned so that the
 * participants referring to it point at the replacement instead.  A missing or blank replacement
 * leaves dangling participants, which the integrity check reports.
 *
 * @author Bruce Parrello
 *
 */
public class MetaboliteRemovalStage extends RefinementStage {

    // FIELDS
    /** removals to apply, in order */
    private final List<MetaboliteRemoval> removals;

    /**
     * Construct a metabolite removal stage.
     *
     * @param removals	removals to apply, in order
     */
    public MetaboliteRemovalStage(List<MetaboliteRemoval> removals) {
        super("remove metabolites", StageState.METABOLITES_REMOVED, StageState.IDENTIFIERS_TRANSLATED);
        this.removals = removals;
    }

    @Override
    protected void edit(CuratedModel model, CurationReport report) {
        int deleted = 0;
        int repointed = 0;
        for (MetaboliteRemoval removal : this.removals) {
            String oldId = removal.getRemovalId();
            Metabolite gone = model.removeMetabolite(oldId);
            if (gone == null)
                log.debug("Metabolite {} is not in the model.", oldId);
            else
                deleted++;
            for (Reaction reaction : model.getReactions()) {
                if (reaction.uses(oldId)) {
                    List<Reaction.Participant> parts = new ArrayList<Reaction.Participant>(reaction.getParticipants().size());
                    for (Reaction.Participant part : reaction.getParticipants()) {
                        if (part.getMetaboliteId().equals(oldId)) {
                            parts.add(part.withMetabolite(removal.getReplacementId()));
                            repointed++;
                        } else
                            parts.add(part);
                    }
                    reaction.setParticipants(parts);
                }
            }
        }
        log.info("{} metabolites deleted and {} participants repointed.", deleted, repointed);
    }

}
