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
import org.theseed.curation.extract.FlatExportExtractor;
import org.theseed.curation.io.ModelSnapshot;
import org.theseed.curation.model.CuratedModel;

/**
 * This command builds a structured model from the flat export of a metabolic network and saves it
 * as a JSON snapshot.
 *
 * The positional parameters are the names of the gene, compartment, metabolite, and reaction tables,
 * followed by the name of the output snapshot file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --config		properties file containing curation settings
 * --report		output file for the curation report
 *
 * @author Bruce Parrello
 *
 */
public class ExtractProcessor extends BaseCurationProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExtractProcessor.class);

    // COMMAND-LINE OPTIONS

    /** report output file */
    @Option(name = "--report", metaVar = "report.tsv", usage = "output file for curation problems and notes")
    private File reportFile;

    /** gene link table */
    @Argument(index = 0, metaVar = "genes.tsv", usage = "gene links by reaction", required = true)
    private File geneFile;

    /** compartment table */
    @Argument(index = 1, metaVar = "compartments.tsv", usage = "compartment table", required = true)
    private File compartmentFile;

    /** metabolite table */
    @Argument(index = 2, metaVar = "metabolites.tsv", usage = "metabolite table", required = true)
    private File metaboliteFile;

    /** reaction table */
    @Argument(index = 3, metaVar = "reactions.tsv", usage = "reaction table", required = true)
    private File reactionFile;

    /** output snapshot file */
    @Argument(index = 4, metaVar = "model.json", usage = "output snapshot file", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.reportFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        checkInput(this.geneFile, "Gene");
        checkInput(this.compartmentFile, "Compartment");
        checkInput(this.metaboliteFile, "Metabolite");
        checkInput(this.reactionFile, "Reaction");
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        FlatExportExtractor extractor = FlatExportExtractor.load(this.geneFile, this.compartmentFile,
                this.metaboliteFile, this.reactionFile);
        CurationReport report = new CurationReport();
        CuratedModel model = extractor.extract(report);
        ModelSnapshot.save(model, this.outFile);
        this.writeReport(report, this.reportFile);
    }

}
