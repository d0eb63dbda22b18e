package com.myorg.specdiff.service.implementation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.specdiff.exception.ValidationException;
import com.myorg.specdiff.model.Content;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.service.DocumentStore;
import com.myorg.specdiff.service.processing.ContentTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes document trees as JSON.
 * <pre>
 * {"kind": "object", "key": ["tr-181.xml", "Device.WiFi."], "attributes": {"name": "WiFi."},
 *  "describable": true, "content": "Text with {{param|Enable}}.", "children": [...]}
 * </pre>
 * {@code content} may also be an object {@code {"body": "...", "footer": "..."}}, which is how
 * annotated trees are written back.
 */
@Slf4j
public class JacksonDocumentStore implements DocumentStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Node read(File file) throws IOException {
        if (file == null || !file.exists()) {
            throw new IOException("Document does not exist: " + (file == null ? "null" : file.getAbsolutePath()));
        }
        Node root = toNode(MAPPER.readTree(file), "$");
        log.info("Read {} from {}", root, file.getName());
        return root;
    }

    @Override
    public Node read(InputStream in) throws IOException {
        JsonNode json = MAPPER.readTree(in);
        if (json == null || json.isMissingNode()) {
            throw new ValidationException("Document is empty");
        }
        return toNode(json, "$");
    }

    @Override
    public void write(File file, Node root) throws IOException {
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories: {}", parent.getAbsolutePath());
        }
        MAPPER.writeValue(file, root);
        log.info("Annotated document written -> {}", file.getAbsolutePath());
    }

    private Node toNode(JsonNode json, String where) {
        if (!json.isObject()) {
            throw new ValidationException(where + ": expected an element object");
        }
        String kind = json.path("kind").asText("");
        if (kind.isBlank()) {
            throw new ValidationException(where + ": element has no kind");
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.path("attributes").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            attributes.put(f.getKey(), f.getValue().isNull() ? "" : f.getValue().asText());
        }

        List<String> key = null;
        JsonNode keyJson = json.get("key");
        if (keyJson != null && keyJson.isArray()) {
            key = new ArrayList<>();
            for (JsonNode k : keyJson) key.add(k.asText());
        }

        Node node = Node.builder()
                .kind(kind)
                .attributes(attributes)
                .identityKey(key)
                .describable(json.path("describable").asBoolean(false))
                .content(toContent(json.get("content")))
                .build();

        JsonNode children = json.path("children");
        for (int i = 0; i < children.size(); i++) {
            node.addChild(toNode(children.get(i), where + ".children[" + i + "]"));
        }
        return node;
    }

    private static Content toContent(JsonNode json) {
        if (json == null || json.isNull()) return null;
        if (json.isObject()) {
            Content content = ContentTokenizer.toContent(json.path("body").asText(""));
            JsonNode footer = json.get("footer");
            if (footer != null && !footer.isNull()) content.setFooter(footer.asText());
            return content;
        }
        return ContentTokenizer.toContent(json.asText());
    }
}
