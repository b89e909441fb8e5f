/**
 *
 */
package org.theseed.curation.meta;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.io.TabularWriter;
import org.theseed.curation.sbml.MalformedModelException;
import org.theseed.curation.sbml.ModelTree;

/**
 * This command lists the ID and name of each reaction in an SBML model.  The output is a starting
 * point for a table of reaction name overrides.
 *
 * The positional parameter is the name of the SBML file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --config		properties file containing curation settings
 *
 * @author Bruce Parrello
 *
 */
public class ReactionNamesProcessor extends BaseCurationProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionNamesProcessor.class);
    /** model tree */
    private ModelTree tree;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    /** input SBML file */
    @Argument(index = 0, metaVar = "model.xml", usage = "SBML model file", required = true)
    private File inFile;

    @Override
    protected void setDefaults() {
        this.outFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        checkInput(this.inFile, "Model");
        try {
            this.tree = ModelTree.load(this.inFile);
        } catch (MalformedModelException e) {
            throw new ParseFailureException(e.getMessage());
        }
        if (this.outFile == null)
            log.info("Output will be to the standard output.");
        else
            log.info("Output will be to {}.", this.outFile);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        OutputStream outStream = (this.outFile == null ? System.out : new FileOutputStream(this.outFile));
        try (TabularWriter writer = new TabularWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8),
                "identifier", "name")) {
            Map<String, String> record = new HashMap<String, String>(3);
            for (Map.Entry<String, String> entry : this.tree.getReactionNames().entrySet()) {
                record.put("identifier", entry.getKey());
                record.put("name", entry.getValue());
                writer.write(record);
            }
        }
        log.info("{} reaction names listed.", this.tree.getReactions().size());
    }

}
