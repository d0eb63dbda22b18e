package com.myorg.specdiff.controller;

import com.myorg.specdiff.config.DiffProperties;
import com.myorg.specdiff.config.StorageProperties;
import com.myorg.specdiff.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.myorg.specdiff.Documents.NEW_JSON;
import static com.myorg.specdiff.Documents.OLD_JSON;
import static com.myorg.specdiff.Documents.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SpecDiffControllerTest {

    @TempDir
    Path storage;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        StorageProperties storageProperties = new StorageProperties();
        storageProperties.setBasePath(storage.toString());
        mvc = MockMvcBuilders.standaloneSetup(new SpecDiffController(storageProperties, new DiffProperties()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static MockMultipartFile upload(String part, String name, byte[] content) {
        return new MockMultipartFile(part, name, MediaType.APPLICATION_JSON_VALUE, content);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void compare_returnsTheSummaryAndStoresResults() throws Exception {
        mvc.perform(multipart("/api/diff")
                        .file(upload("old", "old.json", bytes(OLD_JSON)))
                        .file(upload("new", "new.json", bytes(NEW_JSON))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.record_count").value(5))
                .andExpect(jsonPath("$.model_item_count").value(3))
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.counts.element_removed").value(2))
                .andExpect(jsonPath("$.changed_items[0]").value("Device:2.Device.WiFi."));

        assertThat(storage.resolve("diffs.jsonl")).exists();
        assertThat(storage.resolve("annotated.json")).exists();

        mvc.perform(get("/api/diff/results/annotated"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"annotated.json\""));
    }

    @Test
    void results_missingBeforeAnyComparison() throws Exception {
        mvc.perform(get("/api/diff/results/report")).andExpect(status().isNotFound());
    }

    @Test
    void results_unknownNameIsABadRequest() throws Exception {
        mvc.perform(get("/api/diff/results/everything"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void compare_rejectsNonJsonUploads() throws Exception {
        mvc.perform(multipart("/api/diff")
                        .file(new MockMultipartFile("old", "old.pdf", "application/pdf", utf8("%PDF")))
                        .file(upload("new", "new.json", bytes(NEW_JSON))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Only JSON documents are accepted ('old')."));
    }

    @Test
    void compare_rejectsEmptyUploads() throws Exception {
        mvc.perform(multipart("/api/diff")
                        .file(upload("old", "old.json", new byte[0]))
                        .file(upload("new", "new.json", bytes(NEW_JSON))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void compare_malformedDocumentIsABadRequest() throws Exception {
        mvc.perform(multipart("/api/diff")
                        .file(upload("old", "old.json", utf8("{\"kind\": ")))
                        .file(upload("new", "new.json", bytes(NEW_JSON))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.startsWith("Malformed document")));
    }

    @Test
    void compare_documentsOfDifferentKindsAreUnprocessable() throws Exception {
        mvc.perform(multipart("/api/diff")
                        .file(upload("old", "old.json", utf8("{\"kind\": \"model\"}")))
                        .file(upload("new", "new.json", utf8("{\"kind\": \"profile\"}"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("cannot compare")));
    }
}
