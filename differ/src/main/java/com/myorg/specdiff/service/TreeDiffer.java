package com.myorg.specdiff.service;

import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.Node;

public interface TreeDiffer {

    /**
     * Compares two trees whose roots have the same kind. Neither tree is modified.
     */
    DiffResult diff(Node oldRoot, Node newRoot);
}
