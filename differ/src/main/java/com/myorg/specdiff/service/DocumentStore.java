package com.myorg.specdiff.service;

import com.myorg.specdiff.model.Node;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public interface DocumentStore {

    Node read(File file) throws IOException;

    Node read(InputStream in) throws IOException;

    void write(File file, Node root) throws IOException;
}
