package com.myorg.specdiff.service.matching;

import com.myorg.specdiff.model.Node;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the single candidate whose label (the node's structural string) equals the old child's.
 */
public class LabelMatchStrategy implements MatchStrategy {

    @Override
    public Optional<Node> select(Node oldChild, List<Node> candidates) {
        String label = oldChild.getLabel();
        List<Node> same = candidates.stream()
                .filter(c -> c.getLabel().equals(label))
                .collect(Collectors.toList());
        return same.size() == 1 ? Optional.of(same.get(0)) : Optional.empty();
    }
}
