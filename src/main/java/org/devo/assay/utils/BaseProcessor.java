/**
 *
 */
package org.devo.assay.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its command-line parameters as
 * args4j-annotated fields.  Processing happens in three phases:  the defaults are set, the command line is
 * parsed and validated, and then the command is run.
 *
 * The following command-line options are supported by every processor.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;
    /** TRUE if the command failed */
    private boolean failed;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "--help", aliases = { "-h" }, help = true, usage = "display command-line usage")
    private boolean helpMode;

    /** debug-message flag */
    @Option(name = "--verbose", aliases = { "-v", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command-line parameters and validate them.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.helpMode = false;
        this.debug = false;
        this.failed = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.helpMode)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger rootLogger =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    rootLogger.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        }
        return retVal;
    }

    /**
     * Run the command.  Errors are logged rather than thrown, and the failure is remembered.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("EXECUTION FAILED with {}: {}", e.getClass().getSimpleName(), e.getMessage(), e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if the command line was invalid or the command failed
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options.
     *
     * @return TRUE if processing should proceed, FALSE otherwise
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
