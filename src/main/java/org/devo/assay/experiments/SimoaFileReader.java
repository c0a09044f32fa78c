/**
 *
 */
package org.devo.assay.experiments;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.devo.assay.samples.SampleRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class reads the raw data from a Simoa export file.  The export begins with a block of descriptive
 * rows, followed by a header row containing the column names and then one row per sample well.  The header
 * row is the row whose 0-based index is the header-row count.  Only the columns needed for analysis are
 * kept.
 *
 * Excel exports (".xls" and ".xlsx") and comma-delimited exports (".csv") are supported.  A missing file or
 * an unsupported file type is not an error:  it simply produces no data.
 *
 */
public class SimoaFileReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimoaFileReader.class);

    /** default number of rows preceding the header row */
    public static final int DEFAULT_HEADER_ROWS = 5;

    /**
     * Read the raw data from an export file.
     *
     * @param inFile		export file to read
     * @param headerRows	number of rows preceding the header row
     *
     * @return a table of the required columns, or NULL if the file is missing or of an unsupported type
     *
     * @throws IOException
     */
    public static RawTable read(File inFile, int headerRows) throws IOException {
        RawTable retVal = null;
        String type = FilenameUtils.getExtension(inFile.getName()).toLowerCase();
        if (! inFile.canRead())
            log.warn("Export file {} is not found or unreadable.", inFile);
        else {
            switch (type) {
            case "xls" :
            case "xlsx" :
                retVal = readWorkbook(inFile, headerRows);
                break;
            case "csv" :
                retVal = readCsv(inFile, headerRows);
                break;
            default :
                log.warn("Export file {} has unsupported type \"{}\".", inFile, type);
            }
        }
        if (retVal != null) {
            retVal = retVal.project(SampleRow.REQUIRED_COLUMNS);
            log.info("{} data rows read from {}.", retVal.size(), inFile);
        }
        return retVal;
    }

    /**
     * Read the raw data from an export file with the default number of header rows.
     *
     * @param inFile	export file to read
     *
     * @return a table of the required columns, or NULL if the file is missing or of an unsupported type
     *
     * @throws IOException
     */
    public static RawTable read(File inFile) throws IOException {
        return read(inFile, DEFAULT_HEADER_ROWS);
    }

    /**
     * Read the first sheet of an Excel export.
     *
     * @param inFile		Excel file to read
     * @param headerRows	number of rows preceding the header row
     *
     * @return the raw table, or NULL if the file is not really a workbook
     *
     * @throws IOException
     */
    private static RawTable readWorkbook(File inFile, int headerRows) throws IOException {
        RawTable retVal = null;
        FileMagic magic = (inFile.length() == 0 ? FileMagic.UNKNOWN : FileMagic.valueOf(inFile));
        if (magic != FileMagic.OLE2 && magic != FileMagic.OOXML)
            log.warn("Export file {} is not a workbook (file type {}).", inFile, magic);
        else {
            try (Workbook workbook = WorkbookFactory.create(inFile, null, true)) {
                Sheet sheet = workbook.getSheetAt(0);
                FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
                Row headerRow = sheet.getRow(headerRows);
                int width = ExcelUtils.width(headerRow);
                retVal = new RawTable(ExcelUtils.rowValues(headerRow, width, evaluator));
                int blanks = 0;
                for (int r = headerRows + 1; r <= sheet.getLastRowNum(); r++) {
                    String[] fields = ExcelUtils.rowValues(sheet.getRow(r), width, evaluator);
                    if (isBlank(fields))
                        blanks++;
                    else
                        retVal.add(fields);
                }
                log.debug("{} blank rows skipped in {}.", blanks, inFile);
            } catch (UnsupportedFileFormatException | EmptyFileException e) {
                log.warn("Export file {} is not a supported workbook: {}", inFile, e.getMessage());
            }
        }
        return retVal;
    }

    /**
     * Read a comma-delimited export.  The file is decoded as UTF-8 with any byte-order mark removed.  Bytes
     * that are not valid UTF-8 (such as Latin-1 unit symbols) are replaced rather than rejected.
     *
     * @param inFile		CSV file to read
     * @param headerRows	number of rows preceding the header row
     *
     * @return the raw table
     *
     * @throws IOException
     */
    private static RawTable readCsv(File inFile, int headerRows) throws IOException {
        RawTable retVal = new RawTable();
        try (Reader reader = new BufferedReader(new InputStreamReader(BOMInputStream.builder().setPath(inFile.toPath()).get(),
                StandardCharsets.UTF_8))) {
            Iterator<CSVRecord> records = CSVFormat.DEFAULT.parse(reader).iterator();
            // Skip to the header row.
            for (int r = 0; r < headerRows && records.hasNext(); r++)
                records.next();
            if (records.hasNext()) {
                retVal = new RawTable(records.next().values());
                while (records.hasNext()) {
                    String[] fields = records.next().values();
                    if (! isBlank(fields))
                        retVal.add(fields);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return retVal;
    }

    /**
     * @return TRUE if all the fields in a data row are empty
     *
     * @param fields	array of field values
     */
    private static boolean isBlank(String[] fields) {
        return Arrays.stream(fields).allMatch(x -> StringUtils.isBlank(x));
    }

}
