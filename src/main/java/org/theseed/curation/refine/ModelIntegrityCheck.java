/**
 *
 */
package org.theseed.curation.refine;

import java.util.ArrayList;
import java.util.List;

import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.pipeline.IntegrityCheck;

/**
 * This check verifies that every reaction participant in a structured model refers to a metabolite
 * and a compartment that exist in the model.
 *
 * @author Bruce Parrello
 *
 */
public class ModelIntegrityCheck implements IntegrityCheck<CuratedModel> {

    @Override
    public void verify(CuratedModel model) throws DanglingReferenceException {
        List<DanglingReferenceException.Violation> violations = findViolations(model);
        if (! violations.isEmpty())
            throw new DanglingReferenceException(violations);
    }

    /**
     * @return a list of the dangling references in a model
     *
     * @param model		model to check
     */
    public static List<DanglingReferenceException.Violation> findViolations(CuratedModel model) {
        List<DanglingReferenceException.Violation> retVal = new ArrayList<DanglingReferenceException.Violation>();
        for (Reaction reaction : model.getReactions()) {
            for (Reaction.Participant part : reaction.getParticipants()) {
                if (! model.hasMetabolite(part.getMetaboliteId()))
                    retVal.add(new DanglingReferenceException.Violation(reaction.getId(), "metabolite",
                            part.getMetaboliteId()));
                if (! model.hasCompartment(part.getCompartmentId()))
                    retVal.add(new DanglingReferenceException.Violation(reaction.getId(), "compartment",
                            part.getCompartmentId()));
            }
        }
        return retVal;
    }

}
