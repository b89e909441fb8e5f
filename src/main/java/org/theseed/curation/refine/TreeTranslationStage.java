/**
 *
 */
package org.theseed.curation.refine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sbml.jsbml.Species;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.StageState;
import org.theseed.curation.sbml.ModelTree;
import org.theseed.curation.sbml.TreeStage;

/**
 * This stage applies an identifier translation table to the species of an SBML model tree.  The
 * table is written against species IDs with the prefix already removed, and each original identifier
 * is matched as the leading part of a species ID followed by an underscore, so that "glc__D" matches
 * "glc__D_c" and "glc__D_e".  Rows are applied in table order.  A species whose new ID is already in
 * use is merged into the existing species.
 *
 * @author Bruce Parrello
 *
 */
public class TreeTranslationStage extends TreeStage {

    // FIELDS
    /** translations to apply, in order */
    private final List<TranslationEdit> edits;

    /**
     * Construct a tree translation stage.
     *
     * @param config	curation configuration
     * @param edits		translations to apply, in order
     */
    public TreeTranslationStage(CurationConfig config, List<TranslationEdit> edits) {
        super(config, StageState.PREFIX_STRIPPED);
        this.edits = edits;
    }

    @Override
    public String getName() {
        return "translate species identifiers";
    }

    @Override
    public StageState getProvided() {
        return StageState.IDENTIFIERS_TRANSLATED;
    }

    @Override
    protected void edit(ModelTree tree, CurationReport report) {
        int count = 0;
        for (TranslationEdit edit : this.edits) {
            IdentifierSubstitution sub = IdentifierSubstitution.forTree(edit.getOriginal(), edit.getNovel());
            Map<String, String> renames = new LinkedHashMap<String, String>();
            for (Species species : tree.getSpecies()) {
                String id = species.getId();
                switch (sub.match(id)) {
                case REWRITE :
                    renames.put(id, sub.apply(id));
                    break;
                case AMBIGUOUS :
                    report.addProblem(sub.ambiguity(id));
                    break;
                case NONE :
                    break;
                }
            }
            count += tree.renameSpecies(renames, report).size();
        }
        log.info("{} translations applied to {} species.", this.edits.size(), count);
    }

}
