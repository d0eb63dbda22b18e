package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.model.DiffRecordEntry;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.service.DocumentStore;
import com.myorg.specdiff.service.JsonlWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Standalone runner: compares two JSON documents and writes the results.
 *
 * Usage: run main with args: <old-json> <new-json> [output-dir]
 *
 * - diffs.jsonl: one line per diff record
 * - annotated.json: the new document with change directives and visibility applied
 * - diff_report.xlsx: summary workbook
 */
@Slf4j
public class SpecDiffRunner {
    public static final String DIFFS_FILE = "diffs.jsonl";
    public static final String ANNOTATED_FILE = "annotated.json";
    public static final String REPORT_FILE = "diff_report.xlsx";

    private final DocumentStore store;
    private final SpecDiffEngine engine;
    private final JsonlWriter<DiffRecordEntry> writer = new JacksonJsonlWriter<>();

    public SpecDiffRunner(DiffOptions options) {
        this(new JacksonDocumentStore(), new SpecDiffEngine(options));
    }

    public SpecDiffRunner(DocumentStore store, SpecDiffEngine engine) {
        this.store = store;
        this.engine = engine;
    }

    /**
     * Compare and write all outputs into {@code outputDir}.
     *
     * @param oldPath   older document
     * @param newPath   newer document
     * @param outputDir directory for the results (created if missing)
     * @return the comparison; check {@link DiffResult#isComplete()}
     * @throws IOException on IO errors
     */
    public DiffResult run(Path oldPath, Path newPath, Path outputDir) throws IOException {
        Node oldRoot = load(oldPath);
        Node newRoot = load(newPath);

        DiffResult result = engine.compare(List.of(oldRoot, newRoot));
        write(result, outputDir);

        log.info("Completed: records={}, items={}, unresolved={} -> {}",
                result.getDiffMap().size(), result.getDiffMap().modelItems().size(),
                result.getUnresolvedCount(), outputDir);
        return result;
    }

    /**
     * Write diffs.jsonl, annotated.json and diff_report.xlsx for a finished comparison.
     */
    public void write(DiffResult result, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        writer.write(outputDir.resolve(DIFFS_FILE).toFile(), result.toEntries());
        store.write(outputDir.resolve(ANNOTATED_FILE).toFile(), result.getNewRoot());
        new ExcelDiffReporter(outputDir.resolve(REPORT_FILE).toFile()).report(result);
    }

    private Node load(Path path) throws IOException {
        File file = path.toFile();
        if (!file.exists()) {
            throw new FileNotFoundException("Document not found: " + file.getAbsolutePath());
        }
        log.info("Reading document: {}", file.getAbsolutePath());
        return store.read(file);
    }

    /* ----------------- main for quick testing ----------------- */
    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            log.error("Usage: SpecDiffRunner <old-json> <new-json> [output-dir]");
            System.exit(2);
        }
        Path out = (args.length >= 3) ? Path.of(args[2]) : Path.of("output");
        SpecDiffRunner runner = new SpecDiffRunner(DiffOptions.defaults());
        DiffResult result = runner.run(Path.of(args[0]), Path.of(args[1]), out);
        if (!result.isComplete()) {
            System.exit(1);
        }
    }
}
