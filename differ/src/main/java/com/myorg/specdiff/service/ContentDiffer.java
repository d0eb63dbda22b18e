package com.myorg.specdiff.service;

import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.Node;

public interface ContentDiffer {

    /**
     * Appends one content record per non-equal opcode between the two nodes' bodies.
     */
    void diff(Node oldNode, Node newNode, DiffMap diffs);
}
