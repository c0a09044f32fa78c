/**
 *
 */
package org.devo.assay;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import org.apache.commons.io.output.CloseShieldOutputStream;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.devo.assay.experiments.Batch;
import org.devo.assay.experiments.Plate;
import org.devo.assay.experiments.RawTable;
import org.devo.assay.experiments.SampleTable;
import org.devo.assay.experiments.SimoaFileReader;
import org.devo.assay.reports.WellReporter;
import org.devo.assay.templates.PlateTemplate;
import org.devo.assay.templates.TemplateMapper;
import org.devo.assay.utils.BaseProcessor;
import org.devo.assay.utils.ParseFailureException;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command reads a Simoa export file, splits it into batches and plates, applies the experiment-design
 * templates, and writes a report with one line per well.
 *
 * The positional parameter is the name of the export file (".xls", ".xlsx" or ".csv").  A missing file or an
 * unsupported file type produces no report.
 *
 * The following command-line options are supported:
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT; required for Excel output)
 *
 * --header		number of rows preceding the header row in the export (default 5)
 * --strict		if specified, a malformed location stops processing instead of skipping the row
 * --dilutions	dilution template file
 * --feeders	feeder template file
 * --replicates	replicate template file
 * --format		report format (TEXT or EXCEL)
 *
 */
public class BatchReportProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BatchReportProcessor.class);
    /** dilution template */
    private PlateTemplate dilutions;
    /** feeder template */
    private PlateTemplate feeders;
    /** replicate template */
    private PlateTemplate replicates;

    // COMMAND-LINE OPTIONS

    /** number of rows preceding the header */
    @Option(name = "--header", metaVar = "5", usage = "number of rows preceding the header row")
    private int headerRows;

    /** TRUE to stop on a malformed location */
    @Option(name = "--strict", usage = "if specified, a malformed location is an error")
    private boolean strict;

    /** dilution template file */
    @Option(name = "--dilutions", metaVar = "dilutions.tbl", usage = "dilution template file")
    private File dilutionFile;

    /** feeder template file */
    @Option(name = "--feeders", metaVar = "feeders.tbl", usage = "feeder template file")
    private File feederFile;

    /** replicate template file */
    @Option(name = "--replicates", metaVar = "replicates.tbl", usage = "replicate template file")
    private File replicateFile;

    /** report format */
    @Option(name = "--format", usage = "output report format")
    private WellReporter.Type outFormat;

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "wells.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    /** input export file */
    @Argument(index = 0, metaVar = "export.xls", usage = "Simoa export file to process", required = true)
    private File inFile;

    @Override
    protected void setDefaults() {
        this.headerRows = SimoaFileReader.DEFAULT_HEADER_ROWS;
        this.strict = false;
        this.dilutionFile = null;
        this.feederFile = null;
        this.replicateFile = null;
        this.outFormat = WellReporter.Type.TEXT;
        this.outFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.headerRows < 0)
            throw new ParseFailureException("Header row count cannot be negative.");
        if (this.outFormat == WellReporter.Type.EXCEL && this.outFile == null)
            throw new ParseFailureException("An output file is required for Excel output.");
        this.dilutions = loadTemplate(this.dilutionFile, "dilution");
        this.feeders = loadTemplate(this.feederFile, "feeder");
        this.replicates = loadTemplate(this.replicateFile, "replicate");
        if (this.strict)
            log.info("Malformed locations will stop processing.");
        return true;
    }

    /**
     * @return the template in a file, or NULL if no file was specified
     *
     * @param templateFile	template file name (may be NULL)
     * @param type			type of template, for messages
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    private static PlateTemplate loadTemplate(File templateFile, String type) throws IOException, ParseFailureException {
        PlateTemplate retVal = null;
        if (templateFile == null)
            log.info("No {} template specified.", type);
        else if (! templateFile.canRead())
            throw new FileNotFoundException("The " + type + " template file " + templateFile + " is not found or unreadable.");
        else
            retVal = PlateTemplate.load(templateFile);
        return retVal;
    }

    @Override
    protected void runCommand() throws Exception {
        RawTable raw = SimoaFileReader.read(this.inFile, this.headerRows);
        if (raw == null)
            log.warn("No data produced from {}.", this.inFile);
        else {
            SampleTable samples = SampleTable.normalize(raw, this.strict);
            List<Batch> batches = samples.partition();
            log.info("{} batches found in {}.", batches.size(), this.inFile);
            TemplateMapper.applyTemplates(batches, this.dilutions, this.feeders, this.replicates);
            for (Batch batch : batches) {
                StatisticalSummary stats = batch.getConcentrationStats();
                log.info("Batch {}: {} plates, {} rows, {} concentrations, highest value {} fg/ml.", batch.getName(),
                        batch.getPlates().size(), batch.size(), stats.getN(), batch.getHighestValue());
                for (Plate plate : batch)
                    log.debug("Plate {} of batch {} has {} wells.", plate.getPlateNumber(), batch.getName(), plate.size());
            }
            OutputStream outStream = (this.outFile == null ? CloseShieldOutputStream.wrap(System.out)
                    : new FileOutputStream(this.outFile));
            try (WellReporter reporter = this.outFormat.create(outStream)) {
                reporter.openReport();
                for (Batch batch : batches)
                    reporter.writeBatch(batch);
                log.info("{} wells written.", reporter.getWellCount());
            }
        }
    }

}
