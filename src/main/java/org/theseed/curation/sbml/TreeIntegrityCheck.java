/**
 *
 */
package org.theseed.curation.sbml;

import java.util.ArrayList;
import java.util.List;

import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.theseed.curation.pipeline.IntegrityCheck;
import org.theseed.curation.refine.DanglingReferenceException;

/**
 * This check verifies that every species in an SBML model tree is in a known compartment and that
 * every species reference in a reaction names a known species.
 *
 * @author Bruce Parrello
 *
 */
public class TreeIntegrityCheck implements IntegrityCheck<ModelTree> {

    @Override
    public void verify(ModelTree tree) throws DanglingReferenceException {
        List<DanglingReferenceException.Violation> violations = new ArrayList<DanglingReferenceException.Violation>();
        for (Species species : tree.getSpecies()) {
            if (tree.getCompartment(species.getCompartment()) == null)
                violations.add(new DanglingReferenceException.Violation(species.getId(), "compartment",
                        species.getCompartment()));
        }
        for (Reaction reaction : tree.getReactions()) {
            List<SpeciesReference> refs = new ArrayList<SpeciesReference>(reaction.getListOfReactants());
            refs.addAll(reaction.getListOfProducts());
            for (SpeciesReference ref : refs) {
                if (tree.getSpecies(ref.getSpecies()) == null)
                    violations.add(new DanglingReferenceException.Violation(reaction.getId(), "metabolite",
                            ref.getSpecies()));
            }
        }
        if (! violations.isEmpty())
            throw new DanglingReferenceException(violations);
    }

}
