/**
 *
 */
package org.theseed.curation.meta;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;
import org.theseed.curation.pipeline.CurationPipeline;
import org.theseed.curation.pipeline.StageState;
import org.theseed.curation.refine.EditTables;
import org.theseed.curation.refine.MalformedEditTableException;
import org.theseed.curation.refine.TranslationEdit;
import org.theseed.curation.refine.TreeTranslationStage;
import org.theseed.curation.sbml.BoundaryRewriteStage;
import org.theseed.curation.sbml.CompartmentNamingStage;
import org.theseed.curation.sbml.MalformedModelException;
import org.theseed.curation.sbml.ModelTree;
import org.theseed.curation.sbml.PrefixStripStage;
import org.theseed.curation.sbml.TreeIntegrityCheck;

/**
 * This command normalizes an SBML model.  The boundary and extracellular compartments are given
 * descriptive names, boundary metabolites are moved to the boundary compartment, and the species
 * prefix is removed.  If a translation table is specified, the species identifiers are then translated.
 *
 * The positional parameters are the name of the input SBML file and the name of the output SBML file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --config		properties file containing curation settings
 * --prefix		species prefix to remove (overrides the configuration)
 * --boundary	ID of the boundary compartment (overrides the configuration)
 * --translate	identifier translation table to apply after normalization
 * --report		output file for the curation report
 *
 * @author Bruce Parrello
 *
 */
public class NormalizeProcessor extends BaseCurationProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NormalizeProcessor.class);
    /** input model tree */
    private ModelTree inputTree;
    /** translations to apply */
    private List<TranslationEdit> translations;

    // COMMAND-LINE OPTIONS

    /** species prefix override */
    @Option(name = "--prefix", metaVar = "M_", usage = "species prefix to remove")
    private String prefix;

    /** boundary compartment override */
    @Option(name = "--boundary", metaVar = "b", usage = "ID of the boundary compartment")
    private String boundaryId;

    /** identifier translation table */
    @Option(name = "--translate", metaVar = "translations.tsv", usage = "identifier translation table")
    private File translateFile;

    /** report output file */
    @Option(name = "--report", metaVar = "report.tsv", usage = "output file for curation problems and notes")
    private File reportFile;

    /** input SBML file */
    @Argument(index = 0, metaVar = "model.xml", usage = "input SBML model file", required = true)
    private File inFile;

    /** output SBML file */
    @Argument(index = 1, metaVar = "normal.xml", usage = "output SBML model file", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.prefix = null;
        this.boundaryId = null;
        this.translateFile = null;
        this.reportFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        CurationConfig config = this.getConfig();
        if (this.prefix != null)
            config.setSpeciesPrefix(this.prefix);
        if (this.boundaryId != null) {
            if (! ModelTree.isValidId(this.boundaryId))
                throw new ParseFailureException("Invalid boundary compartment ID \"" + this.boundaryId + "\".");
            config.setBoundaryId(this.boundaryId);
        }
        checkInput(this.inFile, "Input model");
        if (this.translateFile != null) {
            checkInput(this.translateFile, "Translation table");
            try {
                this.translations = EditTables.readTranslations(this.translateFile);
            } catch (MalformedEditTableException e) {
                throw new ParseFailureException(e.getMessage());
            }
        }
        try {
            this.inputTree = ModelTree.load(this.inFile);
        } catch (MalformedModelException e) {
            throw new ParseFailureException(e.getMessage());
        }
        return true;
    }

    /**
     * @return the normalization pipeline for a configuration
     *
     * @param config		curation configuration
     * @param translations	translations to apply, or NULL if none
     */
    public static CurationPipeline<ModelTree> buildPipeline(CurationConfig config, List<TranslationEdit> translations) {
        CurationPipeline<ModelTree> retVal = new CurationPipeline<ModelTree>(StageState.LOADED, new TreeIntegrityCheck());
        retVal.add(new CompartmentNamingStage(config))
                .add(new BoundaryRewriteStage(config))
                .add(new PrefixStripStage(config));
        if (translations != null)
            retVal.add(new TreeTranslationStage(config, translations));
        return retVal;
    }

    @Override
    protected void runCommand() throws Exception {
        CurationReport report = new CurationReport();
        CurationPipeline<ModelTree> pipeline = buildPipeline(this.getConfig(), this.translations);
        ModelTree result = pipeline.run(this.inputTree, report);
        result.save(this.outFile);
        this.writeReport(report, this.reportFile);
    }

}
