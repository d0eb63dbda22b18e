package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.exception.ValidationException;
import com.myorg.specdiff.model.DiffRecordEntry;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.DiffSummary;
import com.myorg.specdiff.model.TokenRange;
import com.myorg.specdiff.service.DiffReporter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes a comparison as an Excel workbook: a summary sheet, one row per diff record and the
 * unresolved correspondences.
 */
@Slf4j
public class ExcelDiffReporter implements DiffReporter {
    static final String SUMMARY_SHEET = "Summary";
    static final String CHANGES_SHEET = "Changes";
    static final String UNRESOLVED_SHEET = "Unresolved";

    private static final String[] CHANGE_COLUMNS = {
            "model_item", "node", "entity", "operation", "name", "old", "new", "whitespace"};

    private final File outputFile;

    public ExcelDiffReporter(File outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public void report(DiffResult result) {
        if (outputFile == null) {
            log.warn("outputFile is null, skipping the Excel report");
            return;
        }
        File parent = outputFile.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories for: {}", parent.getAbsolutePath());
        }
        try {
            writeExcel(result.toSummary(), result.toEntries());
        } catch (IOException e) {
            throw new ValidationException("Writing the diff report failed", e);
        }
    }

    private void writeExcel(DiffSummary summary, List<DiffRecordEntry> entries) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle header = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header.setFont(bold);

            Sheet sSummary = workbook.createSheet(SUMMARY_SHEET);
            int row = 0;
            addRow(sSummary, row++, header, "Metric", "Value");
            addRow(sSummary, row++, null, "Old document", summary.getOldRoot());
            addRow(sSummary, row++, null, "New document", summary.getNewRoot());
            addRow(sSummary, row++, null, "Records", String.valueOf(summary.getRecordCount()));
            addRow(sSummary, row++, null, "Changed items", String.valueOf(summary.getModelItemCount()));
            addRow(sSummary, row++, null, "Unresolved", String.valueOf(summary.getUnresolvedCount()));
            addRow(sSummary, row++, null, "Complete", String.valueOf(summary.getComplete()));
            row++;
            for (Map.Entry<String, Integer> e : summary.getCounts().entrySet()) {
                addRow(sSummary, row++, null, e.getKey(), String.valueOf(e.getValue()));
            }

            Sheet sChanges = workbook.createSheet(CHANGES_SHEET);
            addRow(sChanges, 0, header, CHANGE_COLUMNS);
            for (int i = 0; i < entries.size(); i++) {
                DiffRecordEntry e = entries.get(i);
                addRow(sChanges, i + 1, null,
                        e.getModelItem(),
                        e.getNode(),
                        e.getEntity().name().toLowerCase(),
                        e.getOperation().name().toLowerCase(),
                        e.getName() != null ? e.getName() : e.getElem(),
                        e.getOldRange() != null ? range(e.getOldRange()) : e.getValue(),
                        e.getNewRange() != null ? range(e.getNewRange()) : e.getValue2(),
                        e.getWhitespace() == null ? "" : String.valueOf(e.getWhitespace()));
            }

            Sheet sUnresolved = workbook.createSheet(UNRESOLVED_SHEET);
            addRow(sUnresolved, 0, header, "correspondence");
            List<String> unresolved = summary.getUnresolved();
            for (int i = 0; i < unresolved.size(); i++) {
                addRow(sUnresolved, i + 1, null, unresolved.get(i));
            }

            fitColumns(sChanges, CHANGE_COLUMNS.length);
            fitColumns(sSummary, 2);
            fitColumns(sUnresolved, 1);

            try (FileOutputStream fos = new FileOutputStream(outputFile)) {
                workbook.write(fos);
            }
            log.info("✅ Diff report written to {} ({} records, {} unresolved)",
                    outputFile.getAbsolutePath(), entries.size(), unresolved.size());
        }
    }

    private static String range(TokenRange r) {
        return r.getStart() + ":" + r.getEnd();
    }

    private void addRow(Sheet sheet, int rowIndex, CellStyle style, String... values) {
        Row row = sheet.createRow(rowIndex);
        for (int c = 0; c < values.length; c++) {
            Cell cell = row.createCell(c);
            cell.setCellValue(values[c] == null ? "" : values[c]);
            if (style != null) cell.setCellStyle(style);
        }
    }

    // width from text length; Sheet.autoSizeColumn needs AWT fonts, which headless hosts may lack
    private void fitColumns(Sheet sheet, int cols) {
        int[] widest = new int[cols];
        for (Row row : sheet) {
            for (int c = 0; c < cols; c++) {
                Cell cell = row.getCell(c);
                if (cell != null) widest[c] = Math.max(widest[c], cell.getStringCellValue().length());
            }
        }
        for (int c = 0; c < cols; c++) {
            sheet.setColumnWidth(c, Math.min(255, Math.max(8, widest[c] + 2)) * 256);
        }
    }
}
