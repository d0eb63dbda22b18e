package com.myorg.specdiff.service.implementation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.myorg.specdiff.service.JsonlWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes objects as JSON Lines using Jackson. A comparison without differences still leaves an
 * empty file behind.
 */
@Slf4j
public class JacksonJsonlWriter<T> implements JsonlWriter<T> {

    private static final ObjectWriter LINE_WRITER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .writer()
            .withRootValueSeparator("\n");

    @Override
    public void write(File outputFile, List<T> rows) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        Path path = outputFile.toPath().toAbsolutePath();
        Files.createDirectories(path.getParent());

        int written = 0;
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter lines = LINE_WRITER.writeValues(out)) {
            if (rows != null) {
                for (T row : rows) {
                    lines.write(row);
                    written++;
                }
            }
        }
        log.info("JSONL written: {} records -> {}", written, path);
    }
}
