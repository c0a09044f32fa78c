/**
 *
 */
package org.devo.assay.experiments;

import java.math.BigDecimal;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;

/**
 * This is a simple static class that contains useful Excel functions.
 *
 */
public class ExcelUtils {

    /** cell formatter that produces the displayed text of a cell */
    private static final DataFormatter FORMATTER = new DataFormatter();

    /**
     * @return the text of a cell, trimmed, or an empty string if it has none.  Numbers are rendered at full
     * 		   precision with no exponent, so that a long barcode or a precise measurement survives; dates and
     * 		   other values are rendered as displayed.
     *
     * @param cell		spreadsheet cell to examine
     * @param evaluator	formula evaluator for the cell's workbook
     */
    public static String stringValue(Cell cell, FormulaEvaluator evaluator) {
        String retVal = "";
        if (cell != null) {
            switch (cell.getCellType()) {
            case BLANK :
            case ERROR :
                break;
            case NUMERIC :
                if (DateUtil.isCellDateFormatted(cell))
                    retVal = StringUtils.trim(FORMATTER.formatCellValue(cell, evaluator));
                else
                    retVal = numberText(cell.getNumericCellValue());
                break;
            case FORMULA :
                CellValue value = evaluator.evaluate(cell);
                if (value != null && value.getCellType() == CellType.NUMERIC && ! DateUtil.isCellDateFormatted(cell))
                    retVal = numberText(value.getNumberValue());
                else if (value != null && value.getCellType() != CellType.ERROR)
                    retVal = StringUtils.trim(FORMATTER.formatCellValue(cell, evaluator));
                break;
            default:
                retVal = StringUtils.trim(FORMATTER.formatCellValue(cell, evaluator));
                break;
            }
        }
        return retVal;
    }

    /**
     * @return the plain decimal text of a number, with no exponent and no trailing zeroes
     *
     * @param value		number to convert
     */
    public static String numberText(double value) {
        String retVal;
        if (Double.isNaN(value) || Double.isInfinite(value))
            retVal = Double.toString(value);
        else
            retVal = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return retVal;
    }

    /**
     * @return the text of every cell in a row, up to the specified width
     *
     * @param row		spreadsheet row to examine (may be NULL)
     * @param width		number of cells to return
     * @param evaluator	formula evaluator for the row's workbook
     */
    public static String[] rowValues(Row row, int width, FormulaEvaluator evaluator) {
        String[] retVal = new String[width];
        for (int c = 0; c < width; c++) {
            Cell cell = (row == null ? null : row.getCell(c));
            retVal[c] = stringValue(cell, evaluator);
        }
        return retVal;
    }

    /**
     * @return the number of cells in a row, or 0 if the row does not exist
     *
     * @param row	spreadsheet row to examine
     */
    public static int width(Row row) {
        int retVal = 0;
        if (row != null && row.getLastCellNum() > 0)
            retVal = row.getLastCellNum();
        return retVal;
    }

}
