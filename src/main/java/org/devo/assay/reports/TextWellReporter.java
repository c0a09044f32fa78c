/**
 *
 */
package org.devo.assay.reports;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.devo.assay.experiments.ExcelUtils;

/**
 * This reporter outputs the wells as a simple tab-delimited file, suitable for loading into a spreadsheet or
 * processing with standard software.  Measurements are written in plain decimal notation.
 *
 */
public class TextWellReporter extends WellReporter {

    // FIELDS
    /** output writer */
    private PrintWriter writer;

    public TextWellReporter(OutputStream outStream) {
        super(outStream);
        this.writer = null;
    }

    @Override
    protected void initReport(OutputStream oStream) {
        this.writer = new PrintWriter(new OutputStreamWriter(oStream, StandardCharsets.UTF_8));
    }

    @Override
    protected void writeHeaders(String[] labels, String[] values) {
        this.writer.println(StringUtils.join(labels, '\t') + "\t" + StringUtils.join(values, '\t'));
    }

    @Override
    protected void writeRow(String[] labels, double[] values) {
        String dataLine = Arrays.stream(values).mapToObj(x -> (Double.isNaN(x) ? "" : ExcelUtils.numberText(x)))
                .collect(Collectors.joining("\t"));
        this.writer.println(StringUtils.join(labels, '\t') + "\t" + dataLine);
    }

    @Override
    protected void cleanup() throws IOException {
        if (this.writer != null)
            this.writer.flush();
    }

}
