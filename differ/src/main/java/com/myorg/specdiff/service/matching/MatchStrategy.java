package com.myorg.specdiff.service.matching;

import com.myorg.specdiff.model.Node;

import java.util.List;
import java.util.Optional;

/**
 * Tie-breaker for an old child that has several same-kind, key-compatible candidates in the new
 * tree. A strategy either picks exactly one candidate or declines; it must never guess.
 */
@FunctionalInterface
public interface MatchStrategy {

    Optional<Node> select(Node oldChild, List<Node> candidates);
}
