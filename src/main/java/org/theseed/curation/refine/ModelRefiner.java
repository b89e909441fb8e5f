/**
 *
 */
package org.theseed.curation.refine;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.pipeline.CurationPipeline;
import org.theseed.curation.pipeline.StageState;

/**
 * This object applies a set of curator edit tables to a structured model.  The edits are applied in
 * a fixed order:  identifier translations, metabolite removals, reaction removals, and field
 * overrides.  The integrity check runs after each batch, so a table that leaves a participant
 * without its metabolite or compartment stops the run.
 *
 * @author Bruce Parrello
 *
 */
public class ModelRefiner {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelRefiner.class);
    /** identifier translations */
    private List<TranslationEdit> translations;
    /** metabolite removals */
    private List<MetaboliteRemoval> metaboliteRemovals;
    /** reaction removals */
    private List<String> reactionRemovals;
    /** field overrides */
    private List<FieldOverride> overrides;

    /**
     * Construct a refiner with no edits.
     */
    public ModelRefiner() {
        this.translations = Collections.emptyList();
        this.metaboliteRemovals = Collections.emptyList();
        this.reactionRemovals = Collections.emptyList();
        this.overrides = Collections.emptyList();
    }

    /**
     * Specify the identifier translations.
     *
     * @param translations	translations to apply, in order
     *
     * @return this object, for chaining
     */
    public ModelRefiner setTranslations(List<TranslationEdit> translations) {
        this.translations = translations;
        return this;
    }

    /**
     * Specify the metabolite removals.
     *
     * @param metaboliteRemovals	removals to apply, in order
     *
     * @return this object, for chaining
     */
    public ModelRefiner setMetaboliteRemovals(List<MetaboliteRemoval> metaboliteRemovals) {
        this.metaboliteRemovals = metaboliteRemovals;
        return this;
    }

    /**
     * Specify the reaction removals.
     *
     * @param reactionRemovals		IDs of the reactions to delete
     *
     * @return this object, for chaining
     */
    public ModelRefiner setReactionRemovals(List<String> reactionRemovals) {
        this.reactionRemovals = reactionRemovals;
        return this;
    }

    /**
     * Specify the field overrides.
     *
     * @param overrides		overrides to apply, in order
     *
     * @return this object, for chaining
     */
    public ModelRefiner setOverrides(List<FieldOverride> overrides) {
        this.overrides = overrides;
        return this;
    }

    /**
     * Load the edit tables from files.  A NULL file means the corresponding table is empty.
     *
     * @param translationFile		identifier translation table
     * @param metaboliteFile		metabolite removal table
     * @param reactionFile			reaction removal table
     * @param overrideFile			field override table
     *
     * @return this object, for chaining
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    public ModelRefiner load(File translationFile, File metaboliteFile, File reactionFile, File overrideFile)
            throws IOException, MalformedEditTableException {
        if (translationFile != null)
            this.translations = EditTables.readTranslations(translationFile);
        if (metaboliteFile != null)
            this.metaboliteRemovals = EditTables.readMetaboliteRemovals(metaboliteFile);
        if (reactionFile != null)
            this.reactionRemovals = EditTables.readReactionRemovals(reactionFile);
        if (overrideFile != null)
            this.overrides = EditTables.readFieldOverrides(overrideFile);
        log.info("{} translations, {} metabolite removals, {} reaction removals, and {} overrides loaded.",
                this.translations.size(), this.metaboliteRemovals.size(), this.reactionRemovals.size(),
                this.overrides.size());
        return this;
    }

    /**
     * @return the pipeline of refinement stages
     */
    public CurationPipeline<CuratedModel> buildPipeline() {
        CurationPipeline<CuratedModel> retVal = new CurationPipeline<CuratedModel>(StageState.EXTRACTED,
                new ModelIntegrityCheck());
        retVal.add(new TranslationStage(this.translations))
                .add(new MetaboliteRemovalStage(this.metaboliteRemovals))
                .add(new ReactionRemovalStage(this.reactionRemovals))
                .add(new FieldOverrideStage(this.overrides));
        return retVal;
    }

    /**
     * Apply the edits to a model.
     *
     * @param model		model to refine (not modified)
     * @param report	report to receive record-level problems and notes
     *
     * @return the refined model
     *
     * @throws CurationException
     */
    public CuratedModel refine(CuratedModel model, CurationReport report) throws CurationException {
        CuratedModel retVal = this.buildPipeline().run(model, report);
        log.info("Refinement produced {}.", retVal);
        return retVal;
    }

}
