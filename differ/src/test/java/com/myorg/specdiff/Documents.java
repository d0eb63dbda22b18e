package com.myorg.specdiff;

import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.service.implementation.JacksonDocumentStore;
import com.myorg.specdiff.service.processing.ContentTokenizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Small trees and sample documents shared by the tests.
 */
public final class Documents {

    public static final String OLD_JSON = "/documents/old.json";
    public static final String NEW_JSON = "/documents/new.json";

    private Documents() {}

    public static Node load(String resource) {
        try (InputStream in = Documents.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("missing test resource " + resource);
            return new JacksonDocumentStore().read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] bytes(String resource) {
        try (InputStream in = Documents.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("missing test resource " + resource);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Node model(Node... children) {
        return Node.builder().kind("model").attribute("name", "Device:2").describable(true)
                .children(List.of(children)).build();
    }

    public static Node object(String file, String path, Node... children) {
        return Node.builder().kind("object").identityKey(List.of(file, path))
                .attribute("name", path).describable(true)
                .children(List.of(children)).build();
    }

    public static Node parameter(String name, String description, Node... children) {
        return Node.builder().kind("parameter").identityKey(List.of("tr-181.xml", name))
                .attribute("name", name).describable(true)
                .content(description == null ? null : ContentTokenizer.toContent(description))
                .children(List.of(children)).build();
    }

    public static Node enumeration(String value) {
        return Node.builder().kind("enumeration").attribute("value", value).build();
    }
}
