/**
 *
 */
package org.theseed.curation.meta;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationReport;

/**
 * This is the base class for curation commands.  It parses the command line into the annotated fields
 * of the subclass, loads the curation configuration, and runs the command.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --config		properties file containing curation settings
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseCurationProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseCurationProcessor.class);
    /** curation configuration */
    private CurationConfig config;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true)
    private boolean help;

    /** TRUE to show debug-level log messages */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /** curation settings file */
    @Option(name = "--config", metaVar = "curation.properties", usage = "properties file for curation settings")
    private File configFile;

    /**
     * Parse the command line and validate the parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should not run
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.configFile = null;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug)
                    enableDebug();
                if (this.configFile == null)
                    this.config = new CurationConfig();
                else {
                    if (! this.configFile.canRead())
                        throw new FileNotFoundException("Configuration file " + this.configFile + " is not found or unreadable.");
                    this.config = new CurationConfig(this.configFile);
                    log.info("Curation settings loaded from {}.", this.configFile);
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.toString());
        }
        return retVal;
    }

    /**
     * Raise the root logging level to DEBUG.
     */
    private static void enableDebug() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Configuration ctxConfig = ctx.getConfiguration();
        LoggerConfig logConfig = ctxConfig.getLoggerConfig(LogManager.ROOT_LOGGER_NAME);
        logConfig.setLevel(Level.DEBUG);
        ctx.updateLoggers();
        log.debug("Debug logging enabled.");
    }

    /**
     * Run the command.
     *
     * @return TRUE if the command succeeded, FALSE if it failed
     */
    public boolean run() {
        boolean retVal = false;
        long start = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - start) / 1000.0);
            retVal = true;
        } catch (Exception e) {
            log.error("Command failed: {}", e.getMessage(), e);
        }
        return retVal;
    }

    /**
     * @return the curation configuration
     */
    protected CurationConfig getConfig() {
        return this.config;
    }

    /**
     * Write a curation report to a file.  If the file is NULL, the report summary is logged instead.
     *
     * @param report		report to write
     * @param reportFile	output file, or NULL
     *
     * @throws IOException
     */
    protected void writeReport(CurationReport report, File reportFile) throws IOException {
        if (reportFile == null)
            log.info("{}.", report);
        else {
            try (PrintWriter writer = new PrintWriter(reportFile, StandardCharsets.UTF_8)) {
                report.write(writer);
            }
            log.info("{} written to {}.", report, reportFile);
        }
    }

    /**
     * Verify that an input file can be read.
     *
     * @param file		file to check
     * @param type		description of the file, for error messages
     *
     * @throws FileNotFoundException
     */
    protected static void checkInput(File file, String type) throws FileNotFoundException {
        if (! file.canRead())
            throw new FileNotFoundException(type + " file " + file + " is not found or unreadable.");
    }

    /**
     * Set the option defaults for the subclass.
     */
    protected abstract void setDefaults();

    /**
     * Validate the subclass parameters and options.
     *
     * @return TRUE if the command should run
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
