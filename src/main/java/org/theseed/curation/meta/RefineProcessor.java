/**
 *
 */
package org.theseed.curation.meta;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationReport;
import org.theseed.curation.io.ModelSnapshot;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.refine.MalformedEditTableException;
import org.theseed.curation.refine.ModelRefiner;

/**
 * This command applies curator edit tables to a structured model snapshot.  The translations are
 * applied first, then the metabolite removals, the reaction removals, and the field overrides.  If any
 * batch leaves a dangling reference, the command fails and no output is written.
 *
 * The positional parameters are the name of the input snapshot file and the name of the output
 * snapshot file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --config				properties file containing curation settings
 * --translate			identifier translation table
 * --removeMetabolites	metabolite removal table
 * --removeReactions	reaction removal table
 * --override			field override table
 * --report				output file for the curation report
 *
 * @author Bruce Parrello
 *
 */
public class RefineProcessor extends BaseCurationProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RefineProcessor.class);
    /** model refiner */
    private ModelRefiner refiner;

    // COMMAND-LINE OPTIONS

    /** identifier translation table */
    @Option(name = "--translate", metaVar = "translations.tsv", usage = "identifier translation table")
    private File translateFile;

    /** metabolite removal table */
    @Option(name = "--removeMetabolites", metaVar = "metabolites.tsv", usage = "metabolite removal table")
    private File metaboliteFile;

    /** reaction removal table */
    @Option(name = "--removeReactions", metaVar = "reactions.tsv", usage = "reaction removal table")
    private File reactionFile;

    /** field override table */
    @Option(name = "--override", metaVar = "overrides.tsv", usage = "field override table")
    private File overrideFile;

    /** report output file */
    @Option(name = "--report", metaVar = "report.tsv", usage = "output file for curation problems and notes")
    private File reportFile;

    /** input snapshot file */
    @Argument(index = 0, metaVar = "model.json", usage = "input snapshot file", required = true)
    private File inFile;

    /** output snapshot file */
    @Argument(index = 1, metaVar = "refined.json", usage = "output snapshot file", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.translateFile = null;
        this.metaboliteFile = null;
        this.reactionFile = null;
        this.overrideFile = null;
        this.reportFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        checkInput(this.inFile, "Input snapshot");
        for (File table : new File[] { this.translateFile, this.metaboliteFile, this.reactionFile, this.overrideFile }) {
            if (table != null)
                checkInput(table, "Edit table");
        }
        try {
            this.refiner = new ModelRefiner().load(this.translateFile, this.metaboliteFile, this.reactionFile,
                    this.overrideFile);
        } catch (MalformedEditTableException e) {
            throw new ParseFailureException(e.getMessage());
        }
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        CuratedModel model = ModelSnapshot.load(this.inFile);
        CurationReport report = new CurationReport();
        CuratedModel refined = this.refiner.refine(model, report);
        ModelSnapshot.save(refined, this.outFile);
        this.writeReport(report, this.reportFile);
    }

}
