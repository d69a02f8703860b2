package io.github.pierce.xmlflat.export;

import io.github.pierce.xmlflat.DenormalizedResult;
import io.github.pierce.xmlflat.FlattenedTable;
import io.github.pierce.xmlflat.RowSet;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Excel output with Apache POI. A row set becomes one sheet; a denormalized
 * result becomes one sheet per table, named after the table.
 */
public class XlsxRowSetWriter implements RowSetWriter {

    private static final Logger LOG = LoggerFactory.getLogger(XlsxRowSetWriter.class);

    static final String DEFAULT_SHEET = "rows";

    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    private static final int COLUMN_WIDTH_CHARS = 24;

    @Override
    public void write(RowSet rows, Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(target)) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            createSheet(workbook, DEFAULT_SHEET, rows, headerStyle);
            workbook.write(out);
        }
        LOG.info("Wrote {} rows to {}", rows.size(), target);
    }

    public void write(DenormalizedResult result, Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(target)) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            for (FlattenedTable table : result.tables()) {
                createSheet(workbook, table.getName(), table.getRowSet(), headerStyle);
            }
            workbook.write(out);
        }
        LOG.info("Wrote {} tables to {}", result.getTables().size(), target);
    }

    private void createSheet(Workbook workbook, String name, RowSet rows, CellStyle headerStyle) {
        Sheet sheet = workbook.createSheet(uniqueSheetName(workbook, name));
        List<String> header = new ArrayList<>(rows.getColumns());

        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < header.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(header.get(i));
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, COLUMN_WIDTH_CHARS * 256);
        }

        int rowNum = 1;
        for (Map<String, String> values : rows.getRows()) {
            Row row = sheet.createRow(rowNum++);
            for (int i = 0; i < header.size(); i++) {
                String value = values.get(header.get(i));
                if (value != null) {
                    row.createCell(i).setCellValue(fitCell(value, name, header.get(i)));
                }
            }
        }
        sheet.createFreezePane(0, 1);
    }

    private static String fitCell(String value, String sheet, String column) {
        if (value.length() <= MAX_CELL_TEXT) {
            return value;
        }
        LOG.warn("Truncating value of {}.{} to {} characters", sheet, column, MAX_CELL_TEXT);
        return value.substring(0, MAX_CELL_TEXT);
    }

    /**
     * Sheet names are limited to 31 characters, so distinct table names can
     * collide once made safe; later ones get a numeric suffix.
     */
    private static String uniqueSheetName(Workbook workbook, String name) {
        String safe = WorkbookUtil.createSafeSheetName(name);
        String candidate = safe;
        int suffix = 2;
        while (workbook.getSheet(candidate) != null) {
            String tail = "_" + suffix++;
            candidate = safe.substring(0, Math.min(safe.length(), 31 - tail.length())) + tail;
        }
        return candidate;
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    @Override
    public String extension() {
        return "xlsx";
    }
}
