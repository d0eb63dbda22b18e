package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.exception.ContractViolationException;
import com.myorg.specdiff.metrics.PerfProbe;
import com.myorg.specdiff.model.DiffKey;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.service.AnnotationSynthesizer;
import com.myorg.specdiff.service.TreeDiffer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares an old and a new document tree and annotates the new one with the changes.
 */
@Slf4j
public class SpecDiffEngine {

    private final TreeDiffer treeDiffer;
    private final AnnotationSynthesizer synthesizer;

    public SpecDiffEngine(DiffOptions options) {
        this(new StructuralTreeDiffer(options, new MyersContentDiffer()), new DirectiveAnnotationSynthesizer(options));
    }

    public SpecDiffEngine(TreeDiffer treeDiffer, AnnotationSynthesizer synthesizer) {
        this.treeDiffer = treeDiffer;
        this.synthesizer = synthesizer;
    }

    /**
     * @param roots exactly two roots, old first
     * @throws ContractViolationException for any other number of trees, the same tree twice, or
     *                                    roots of different kinds
     */
    public DiffResult compare(List<Node> roots) {
        if (roots == null || roots.size() != 2) {
            throw new ContractViolationException(String.format(
                    "need two documents (old and new) to compute diffs (%d were supplied)",
                    roots == null ? 0 : roots.size()));
        }
        return compare(roots.get(0), roots.get(1));
    }

    public DiffResult compare(Node oldRoot, Node newRoot) {
        if (oldRoot == null || newRoot == null) {
            throw new ContractViolationException("need two documents (old and new) to compute diffs");
        }
        if (oldRoot == newRoot) {
            throw new ContractViolationException("old and new documents are the same tree");
        }
        if (!oldRoot.getKind().equals(newRoot.getKind())) {
            throw new ContractViolationException(String.format("cannot compare a %s with a %s",
                    oldRoot.getKind(), newRoot.getKind()));
        }

        PerfProbe probe = new PerfProbe("diff");
        log.info("comparing {} and {}", oldRoot.getPath(), newRoot.getPath());
        DiffResult result = treeDiffer.diff(oldRoot, newRoot);
        probe.mark("trees compared", countNodes(oldRoot) + countNodes(newRoot));
        log.info("compared the two documents: {} records on {} items",
                result.getDiffMap().size(), result.getDiffMap().modelItems().size());

        synthesizer.annotate(result.getDiffMap(), newRoot);
        probe.mark("annotations synthesized", result.getDiffMap().modelItems().size());
        probe.done("compare");

        logSummary(result);
        return result;
    }

    private static void logSummary(DiffResult result) {
        Map<DiffKey, Integer> counts = result.getCounts();
        String table = counts.entrySet().stream()
                .map(e -> String.format("%s %s = %d", e.getKey().entity().name().toLowerCase(),
                        e.getKey().operation().name().toLowerCase(), e.getValue()))
                .collect(Collectors.joining(", "));
        log.info("appended {{diffs}} directive refs: {}{}unresolved = {}", table, table.isEmpty() ? "" : ", ",
                result.getUnresolvedCount());
        if (!result.isComplete()) {
            log.error("{} correspondences could not be resolved; the comparison is incomplete",
                    result.getUnresolvedCount());
        }
    }

    private static long countNodes(Node node) {
        long n = 1;
        for (Node child : node.getChildren()) {
            n += countNodes(child);
        }
        return n;
    }
}
