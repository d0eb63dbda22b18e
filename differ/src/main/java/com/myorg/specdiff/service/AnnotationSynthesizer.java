package com.myorg.specdiff.service;

import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.Node;

public interface AnnotationSynthesizer {

    /**
     * Rewrites {@code newRoot} in place: change footers, spliced content and visibility.
     * Must complete before the tree is rendered.
     */
    void annotate(DiffMap diffs, Node newRoot);
}
