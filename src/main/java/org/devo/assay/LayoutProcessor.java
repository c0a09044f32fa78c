/**
 *
 */
package org.devo.assay;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;

import org.devo.assay.samples.WellLocation;
import org.devo.assay.templates.PlateTemplate;
import org.devo.assay.utils.BaseReportProcessor;
import org.devo.assay.utils.ParseFailureException;
import org.kohsuke.args4j.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command takes as input the three design templates for a plate and produces a simple report listing
 * all 96 wells along with the dilution, feeders and replicate of each.  It is used to check a set of
 * templates before processing instrument data with them.
 *
 * The positional parameters are the dilution template file, the feeder template file and the replicate
 * template file.  The report will be produced on the standard output.
 *
 * The following command-line options are supported:
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT)
 *
 */
public class LayoutProcessor extends BaseReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(LayoutProcessor.class);
    /** dilution template */
    private PlateTemplate dilutions;
    /** feeder template */
    private PlateTemplate feeders;
    /** replicate template */
    private PlateTemplate replicates;

    // COMMAND-LINE OPTIONS

    /** dilution template file */
    @Argument(index = 0, metaVar = "dilutions.tbl", usage = "dilution template file", required = true)
    private File dilutionFile;

    /** feeder template file */
    @Argument(index = 1, metaVar = "feeders.tbl", usage = "feeder template file", required = true)
    private File feederFile;

    /** replicate template file */
    @Argument(index = 2, metaVar = "replicates.tbl", usage = "replicate template file", required = true)
    private File replicateFile;

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        for (File templateFile : new File[] { this.dilutionFile, this.feederFile, this.replicateFile }) {
            if (! templateFile.canRead())
                throw new FileNotFoundException("Template file " + templateFile + " is not found or unreadable.");
        }
        this.dilutions = PlateTemplate.load(this.dilutionFile);
        this.feeders = PlateTemplate.load(this.feederFile);
        this.replicates = PlateTemplate.load(this.replicateFile);
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        writer.println("well\tdilution\tfeeders\treplicate");
        int unassigned = 0;
        for (char row : WellLocation.ROW_LETTERS.toCharArray()) {
            for (int col = 1; col <= WellLocation.COLUMNS; col++) {
                String dilution = this.dilutions.resolve(row, col);
                String feeder = this.feeders.resolve(row, col);
                String replicate = this.replicates.resolve(row, col);
                if (PlateTemplate.UNASSIGNED.equals(dilution) || PlateTemplate.UNASSIGNED.equals(feeder)
                        || PlateTemplate.UNASSIGNED.equals(replicate))
                    unassigned++;
                writer.println(row + Integer.toString(col) + "\t" + dilution + "\t" + feeder + "\t" + replicate);
            }
        }
        log.info("{} wells have at least one unassigned label.", unassigned);
    }

}
