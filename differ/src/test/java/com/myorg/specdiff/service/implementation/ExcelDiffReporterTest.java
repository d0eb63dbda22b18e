package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.model.DiffResult;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileInputStream;
import java.nio.file.Path;

import static com.myorg.specdiff.Documents.NEW_JSON;
import static com.myorg.specdiff.Documents.OLD_JSON;
import static com.myorg.specdiff.Documents.enumeration;
import static com.myorg.specdiff.Documents.load;
import static com.myorg.specdiff.Documents.model;
import static com.myorg.specdiff.Documents.parameter;
import static org.assertj.core.api.Assertions.assertThat;

class ExcelDiffReporterTest {

    private final SpecDiffEngine engine = new SpecDiffEngine(DiffOptions.defaults());

    @Test
    void report_writesSummaryChangesAndUnresolvedSheets(@TempDir Path dir) throws Exception {
        DiffResult result = engine.compare(load(OLD_JSON), load(NEW_JSON));
        File out = dir.resolve("report/diff_report.xlsx").toFile();

        new ExcelDiffReporter(out).report(result);

        assertThat(out).exists();
        try (FileInputStream in = new FileInputStream(out); Workbook wb = new XSSFWorkbook(in)) {
            Sheet changes = wb.getSheet(ExcelDiffReporter.CHANGES_SHEET);
            assertThat(changes.getLastRowNum()).isEqualTo(5);
            assertThat(changes.getRow(1).getCell(2).getStringCellValue()).isEqualTo("attribute");
            assertThat(changes.getRow(1).getCell(4).getStringCellValue()).isEqualTo("status");
            assertThat(changes.getRow(1).getCell(5).getStringCellValue()).isEqualTo("current");
            assertThat(changes.getRow(4).getCell(5).getStringCellValue()).isEqualTo("4:5");

            Sheet summary = wb.getSheet(ExcelDiffReporter.SUMMARY_SHEET);
            assertThat(summary.getRow(3).getCell(1).getStringCellValue()).isEqualTo("5");
            assertThat(summary.getRow(6).getCell(1).getStringCellValue()).isEqualTo("true");

            assertThat(wb.getSheet(ExcelDiffReporter.UNRESOLVED_SHEET).getLastRowNum()).isZero();
        }
    }

    @Test
    void report_listsUnresolvedCorrespondences(@TempDir Path dir) throws Exception {
        DiffResult result = engine.compare(
                model(parameter("Mode", null, enumeration("A"))),
                model(parameter("Mode", null, enumeration("A"), enumeration("A"))));
        File out = dir.resolve("diff_report.xlsx").toFile();

        new ExcelDiffReporter(out).report(result);

        try (FileInputStream in = new FileInputStream(out); Workbook wb = new XSSFWorkbook(in)) {
            Sheet unresolved = wb.getSheet(ExcelDiffReporter.UNRESOLVED_SHEET);
            assertThat(unresolved.getLastRowNum()).isEqualTo(1);
            assertThat(unresolved.getRow(1).getCell(0).getStringCellValue()).contains("multiple enumeration");
        }
    }
}
