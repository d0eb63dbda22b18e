package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.exception.ContractViolationException;
import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.DiffRecord;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.Entity;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.model.Operation;
import com.myorg.specdiff.service.ContentDiffer;
import com.myorg.specdiff.service.TreeDiffer;
import com.myorg.specdiff.service.matching.MatchStrategy;
import com.myorg.specdiff.service.processing.AttributeDiffer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Depth-first tree matcher.
 * <p>
 * Old children are paired with new children of the same kind whose identity keys agree (once the
 * leading source-file components are dropped). Several candidates are narrowed with the configured
 * {@link MatchStrategy} list; if that still leaves no single winner the child is reported as
 * unresolved and not diffed at all.
 */
@Slf4j
public class StructuralTreeDiffer implements TreeDiffer {

    private final DiffOptions options;
    private final ContentDiffer contentDiffer;

    public StructuralTreeDiffer(DiffOptions options, ContentDiffer contentDiffer) {
        this.options = options;
        this.contentDiffer = contentDiffer;
    }

    @Override
    public DiffResult diff(Node oldRoot, Node newRoot) {
        if (oldRoot == null || newRoot == null) {
            throw new ContractViolationException("need two documents (old and new) to compute diffs");
        }
        DiffMap diffs = new DiffMap();
        List<String> unresolved = new ArrayList<>();
        diffNodes(oldRoot, newRoot, diffs, unresolved, 0);
        return new DiffResult(oldRoot, newRoot, diffs, unresolved);
    }

    private void diffNodes(Node oldNode, Node newNode, DiffMap diffs, List<String> unresolved, int level) {
        if (!oldNode.getKind().equals(newNode.getKind())) {
            throw new ContractViolationException(String.format("cannot compare %s %s with %s %s",
                    oldNode.getKind(), oldNode.getPath(), newNode.getKind(), newNode.getPath()));
        }
        log.trace("{}{} {}", "  ".repeat(level), newNode.getKind(), newNode.getPath());

        AttributeDiffer.diff(oldNode, newNode, options.getIgnoredAttributes(), diffs);
        contentDiffer.diff(oldNode, newNode, diffs);

        Set<Node> matched = new HashSet<>();
        for (Node oldChild : oldNode.getChildren()) {
            if (options.getIgnoredKinds().contains(oldChild.getKind())) continue;

            List<Node> candidates = newNode.getChildren().stream()
                    .filter(c -> c.getKind().equals(oldChild.getKind()) && keysCorrespond(oldChild, c))
                    .collect(Collectors.toList());

            if (candidates.isEmpty()) {
                diffs.append(elementRecord(oldNode, newNode, Operation.REMOVED, oldChild));
                continue;
            }

            Optional<Node> match = candidates.size() == 1 ? Optional.of(candidates.get(0)) : narrow(oldChild, candidates);
            if (match.isEmpty()) {
                String report = String.format("%s: multiple %s matches %s", oldNode.getPath(), oldChild.getKind(),
                        candidates.stream().map(StructuralTreeDiffer::describe).collect(Collectors.toList()));
                log.error("AmbiguousCorrespondence {}", report);
                unresolved.add(report);
                continue;
            }

            Node newChild = match.get();
            diffNodes(oldChild, newChild, diffs, unresolved, level + 1);
            matched.add(newChild);
        }

        for (Node newChild : newNode.getChildren()) {
            if (options.getIgnoredKinds().contains(newChild.getKind()) || matched.contains(newChild)) continue;
            diffs.append(elementRecord(oldNode, newNode, Operation.ADDED, newChild));
        }
    }

    private Optional<Node> narrow(Node oldChild, List<Node> candidates) {
        for (MatchStrategy strategy : options.getMatchStrategies()) {
            Optional<Node> picked = strategy.select(oldChild, candidates);
            if (picked.isPresent()) return picked;
        }
        return Optional.empty();
    }

    /**
     * Keys only constrain the match when both sides have one.
     */
    boolean keysCorrespond(Node oldChild, Node newChild) {
        if (!oldChild.hasIdentityKey() || !newChild.hasIdentityKey()) return true;
        return dropLeading(oldChild.getIdentityKey()).equals(dropLeading(newChild.getIdentityKey()));
    }

    private List<String> dropLeading(List<String> key) {
        int skip = Math.min(options.getKeyComponentsToSkip(), key.size());
        return key.subList(skip, key.size());
    }

    private static DiffRecord elementRecord(Node oldNode, Node newNode, Operation op, Node elem) {
        return DiffRecord.builder()
                .oldNode(oldNode)
                .newNode(newNode)
                .entity(Entity.ELEMENT)
                .operation(op)
                .elem(elem)
                .build();
    }

    private static String describe(Node node) {
        return node.hasIdentityKey() ? node.getIdentityKey().toString() : node.toString();
    }
}
