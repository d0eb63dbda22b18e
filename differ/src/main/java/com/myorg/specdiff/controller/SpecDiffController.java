package com.myorg.specdiff.controller;

import com.myorg.specdiff.config.DiffProperties;
import com.myorg.specdiff.config.StorageProperties;
import com.myorg.specdiff.exception.ValidationException;
import com.myorg.specdiff.metrics.PerfProbe;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.DiffSummary;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.service.DocumentStore;
import com.myorg.specdiff.service.implementation.JacksonDocumentStore;
import com.myorg.specdiff.service.implementation.SpecDiffEngine;
import com.myorg.specdiff.service.implementation.SpecDiffRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/diff")
public class SpecDiffController {

    private static final Map<String, String> RESULT_FILES = Map.of(
            "diffs", SpecDiffRunner.DIFFS_FILE,
            "annotated", SpecDiffRunner.ANNOTATED_FILE,
            "report", SpecDiffRunner.REPORT_FILE);

    private final StorageProperties storageProperties;
    private final DiffProperties diffProperties;

    @PostMapping
    public ResponseEntity<DiffSummary> compare(@RequestParam("old") MultipartFile oldFile,
                                               @RequestParam("new") MultipartFile newFile) throws IOException {
        checkUpload(oldFile, "old");
        checkUpload(newFile, "new");

        PerfProbe probe = new PerfProbe("upload");
        DocumentStore store = new JacksonDocumentStore();
        Node oldRoot = read(store, oldFile);
        Node newRoot = read(store, newFile);
        probe.mark("documents read", oldFile.getSize() + newFile.getSize());

        SpecDiffEngine engine = new SpecDiffEngine(diffProperties.toOptions());
        DiffResult result = engine.compare(List.of(oldRoot, newRoot));

        Path outDir = outDir();
        new SpecDiffRunner(store, engine).write(result, outDir);

        probe.mark("results written", result.getDiffMap().size());
        probe.done(oldFile.getOriginalFilename() + " vs " + newFile.getOriginalFilename());

        return ResponseEntity.ok(result.toSummary());
    }

    @GetMapping("/results/{name}")
    public ResponseEntity<FileSystemResource> getResult(@PathVariable("name") String name) {
        String fileName = RESULT_FILES.get(name);
        if (fileName == null) {
            throw new ValidationException("Unknown result '" + name + "'; expected one of " + RESULT_FILES.keySet());
        }
        File f = outDir().resolve(fileName).toFile();

        if (!f.exists()) return ResponseEntity.notFound().build();

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + fileName + "\"")
                .body(new FileSystemResource(f));
    }

    // ===== Helpers =====

    private static void checkUpload(MultipartFile file, String part) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty '" + part + "' document.");
        }
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename().toLowerCase();
        String contentType = file.getContentType() == null ? "" : file.getContentType().toLowerCase();
        if (!(name.endsWith(".json") || contentType.contains("json"))) {
            throw new ValidationException("Only JSON documents are accepted ('" + part + "').");
        }
    }

    private static Node read(DocumentStore store, MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            Node root = store.read(in);
            log.info("Read {} from upload {}", root, file.getOriginalFilename());
            return root;
        }
    }

    private Path outDir() {
        return Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
    }
}
