/**
 *
 */
package org.devo.assay.reports;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This report version writes the wells to a single sheet of an Excel workbook.  Missing measurements are
 * left as empty cells.
 *
 */
public class ExcelWellReporter extends WellReporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExcelWellReporter.class);
    /** current workbook */
    private Workbook workbook;
    /** current worksheet */
    private Sheet worksheet;
    /** next row number */
    private int rowNum;
    /** current row */
    private Row ssRow;
    /** header style */
    private CellStyle headStyle;
    /** number style */
    private CellStyle numStyle;
    /** number of columns in each row */
    private int colCount;

    /** column width, in 1/256ths of a character */
    private static final int COLUMN_WIDTH = 14 * 256;

    public ExcelWellReporter(OutputStream outStream) {
        super(outStream);
        this.colCount = 0;
    }

    @Override
    protected void initReport(OutputStream oStream) {
        log.info("Initializing workbook.");
        this.workbook = new XSSFWorkbook();
        this.worksheet = this.workbook.createSheet("Wells");
        DataFormat format = this.workbook.createDataFormat();
        this.headStyle = this.workbook.createCellStyle();
        this.headStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        this.headStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        this.numStyle = this.workbook.createCellStyle();
        this.numStyle.setDataFormat(format.getFormat("###0.0000"));
        this.rowNum = 0;
    }

    @Override
    protected void writeHeaders(String[] labels, String[] values) {
        this.addRow();
        int col = 0;
        for (String label : labels)
            this.setHeadCell(col++, label);
        for (String value : values)
            this.setHeadCell(col++, value);
        this.colCount = col;
        this.worksheet.createFreezePane(0, 1);
    }

    @Override
    protected void writeRow(String[] labels, double[] values) {
        this.addRow();
        int col = 0;
        for (String label : labels)
            this.ssRow.createCell(col++).setCellValue(label);
        for (double value : values) {
            Cell dataCell = this.ssRow.createCell(col++);
            if (! Double.isNaN(value)) {
                dataCell.setCellValue(value);
                dataCell.setCellStyle(this.numStyle);
            }
        }
    }

    /**
     * Store a label in a header cell.
     *
     * @param col		column index of cell
     * @param label		text to store in cell
     */
    private void setHeadCell(int col, String label) {
        Cell labelCell = this.ssRow.createCell(col);
        labelCell.setCellValue(label);
        labelCell.setCellStyle(this.headStyle);
    }

    /**
     * Add a new row to the spreadsheet.
     */
    private void addRow() {
        this.ssRow = this.worksheet.createRow(this.rowNum);
        this.rowNum++;
    }

    @Override
    protected void cleanup() throws IOException {
        if (this.workbook != null) {
            for (int i = 0; i < this.colCount; i++)
                this.worksheet.setColumnWidth(i, COLUMN_WIDTH);
            log.info("Writing workbook.");
            this.workbook.write(this.getOutStream());
            this.workbook.close();
        }
    }

}
