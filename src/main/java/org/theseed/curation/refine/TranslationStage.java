/**
 *
 */
package org.theseed.curation.refine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.pipeline.StageState;

/**
 * This stage applies an identifier translation table to the metabolites of a structured model.
 * The rows are applied in table order, so a later row sees the IDs produced by an earlier one.
 * Each row is computed against the whole metabolite set before anything is changed, and then
 * applied to the metabolites and the reaction participants together.
 *
 * If a translated ID already belongs to another metabolite, the two are merged:  the translated
 * metabolite is dropped and its references are added to the survivor.
 *
 * @author Bruce Parrello
 *
 */
public class TranslationStage extends RefinementStage {

    // FIELDS
    /** translations to apply, in order */
    private final List<TranslationEdit> edits;

    /**
     * Construct a translation stage.
     *
     * @param edits		translations to apply, in order
     */
    public TranslationStage(List<TranslationEdit> edits) {
        super("translate identifiers", StageState.IDENTIFIERS_TRANSLATED, StageState.EXTRACTED);
        this.edits = edits;
    }

    @Override
    protected void edit(CuratedModel model, CurationReport report) {
        for (TranslationEdit edit : this.edits) {
            IdentifierSubstitution sub = IdentifierSubstitution.forStructured(edit.getOriginal(), edit.getNovel());
            // Compute the renames for this row.
            Map<String, String> renames = new LinkedHashMap<String, String>();
            for (Metabolite metabolite : model.getMetabolites()) {
                String id = metabolite.getId();
                switch (sub.match(id)) {
                case REWRITE :
                    String newId = sub.apply(id);
                    if (! newId.equals(id))
                        renames.put(id, newId);
                    break;
                case AMBIGUOUS :
                    report.addProblem(sub.ambiguity(id));
                    break;
                case NONE :
                    break;
                }
            }
            if (! renames.isEmpty())
                applyRenames(model, renames, report);
        }
    }

    /**
     * Rename metabolites and update the reaction participants that refer to them.
     *
     * @param model		model to update
     * @param renames	map of old metabolite IDs to new ones
     * @param report	report to receive merge notes
     */
    protected static void applyRenames(CuratedModel model, Map<String, String> renames, CurationReport report) {
        // Pull out all the renamed metabolites first, so a rename can land on an ID that is itself moving.
        List<Metabolite> moving = new ArrayList<Metabolite>(renames.size());
        for (String oldId : renames.keySet())
            moving.add(model.removeMetabolite(oldId));
        for (Metabolite metabolite : moving) {
            String newId = renames.get(metabolite.getId());
            Metabolite survivor = model.getMetabolite(newId);
            if (survivor == null)
                model.addMetabolite(metabolite.copy(newId));
            else {
                survivor.getReferences().merge(metabolite.getReferences());
                report.addNote("Metabolite " + metabolite.getId() + " merged into " + newId + ".");
            }
        }
        // Now point the participants at the new IDs.
        for (Reaction reaction : model.getReactions()) {
            boolean changed = false;
            List<Reaction.Participant> parts = new ArrayList<Reaction.Participant>(reaction.getParticipants().size());
            for (Reaction.Participant part : reaction.getParticipants()) {
                String newId = renames.get(part.getMetaboliteId());
                if (newId == null)
                    parts.add(part);
                else {
                    parts.add(part.withMetabolite(newId));
                    changed = true;
                }
            }
            if (changed)
                reaction.setParticipants(parts);
        }
        log.debug("{} metabolites renamed.", renames.size());
    }

}
