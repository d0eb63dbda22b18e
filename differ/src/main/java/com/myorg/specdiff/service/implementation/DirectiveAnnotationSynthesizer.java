package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.model.Content;
import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.DiffRecord;
import com.myorg.specdiff.model.Entity;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.model.Segment;
import com.myorg.specdiff.service.AnnotationSynthesizer;
import com.myorg.specdiff.service.processing.DirectiveEscaper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a finished {@link DiffMap} into {@code {{diffs}}}, {@code {{replaced}}},
 * {@code {{removed}}} and {@code {{inserted}}} directives in the new tree, and makes every changed
 * region visible.
 * <p>
 * Change phrases go to the model item's content footer, so rewriting the body afterwards can't
 * drop them.
 */
@Slf4j
public class DirectiveAnnotationSynthesizer implements AnnotationSynthesizer {

    static final String DIFFS = "diffs";
    static final String REPLACED = "replaced";
    static final String REMOVED = "removed";
    static final String INSERTED = "inserted";

    private final DiffOptions options;

    public DirectiveAnnotationSynthesizer(DiffOptions options) {
        this.options = options;
    }

    @Override
    public void annotate(DiffMap diffs, Node newRoot) {
        if (options.isHideUnchanged()) {
            newRoot.hideAll();
        }

        for (Map.Entry<Node, List<DiffRecord>> entry : diffs.entries()) {
            Node modelItem = entry.getKey();
            List<DiffRecord> records = entry.getValue();

            boolean anyStructural = records.stream().anyMatch(d -> d.getEntity() != Entity.CONTENT);
            boolean anyVisibleContent = records.stream()
                    .anyMatch(d -> d.getEntity() == Entity.CONTENT && !d.isWhitespace());

            List<String> phrases = new ArrayList<>();
            // content records per changed node and the old node it was compared with, in discovery order
            Map<Node, Map<Node, List<DiffRecord>>> contentEdits = new LinkedHashMap<>();

            for (DiffRecord record : records) {
                Node newNode = record.getNewNode();
                if (anyStructural || anyVisibleContent) {
                    modelItem.unhide(true);
                    newNode.unhide(true);
                }

                String context = context(newNode, modelItem);
                switch (record.getEntity()) {
                    case ATTRIBUTE:
                        phrases.add(attributePhrase(record, context));
                        break;
                    case ELEMENT:
                        phrases.add(elementPhrase(record, context));
                        break;
                    case CONTENT:
                        contentEdits.computeIfAbsent(newNode, k -> new LinkedHashMap<>())
                                .computeIfAbsent(record.getOldNode(), k -> new ArrayList<>())
                                .add(record);
                        break;
                    default:
                        throw new IllegalStateException("unknown entity " + record.getEntity());
                }
            }

            if (!phrases.isEmpty()) {
                Content content = modelItem.getContent();
                if (content == null) {
                    content = Content.empty();
                    modelItem.setContent(content);
                }
                String footer = directive(DIFFS, phrases);
                content.setFooter(footer);
                log.debug("{} {} footer {}", modelItem.getPath(), modelItem.getKind(), footer);
            }

            contentEdits.forEach(this::spliceFirstPairing);
        }
    }

    private String attributePhrase(DiffRecord d, String context) {
        String name = emph(d.getName());
        switch (d.getOperation()) {
            case ADDED:
                return String.format("Added %sattribute %s = %s", context, name, emph(d.getValue()));
            case REMOVED:
                return String.format("Removed %sattribute %s = %s", context, name, emph(d.getValue()));
            default:
                return String.format("Changed %sattribute %s from %s to %s", context, name,
                        emph(d.getValue()), emph(d.getValue2()));
        }
    }

    private String elementPhrase(DiffRecord d, String context) {
        Node elem = d.getElem();
        switch (d.getOperation()) {
            case ADDED: {
                // added content must never stay hidden
                elem.unhide(false);
                elem.unhide(true);
                log.debug("{} {} (and down and up) unhidden", elem.getPath(), elem.getKind());
                String ref = reference(elem);
                return ref.isEmpty()
                        ? String.format("Added %s%s", context, elem.getKind())
                        : String.format("Added %s%s %s", context, ref, elem.getKind());
            }
            case REMOVED:
                // no reference: it no longer exists in the new tree
                return String.format("Removed %s%s%s", context, emphNode(elem), elem.getKind());
            default:
                throw new IllegalStateException("elements are only added or removed, not " + d.getOperation());
        }
    }

    /**
     * Names the changed node when it isn't the model item itself; empty otherwise.
     */
    private static String context(Node newNode, Node modelItem) {
        if (newNode == modelItem) return "";
        StringBuilder context = new StringBuilder();
        String label = newNode.getLabel();
        if (!newNode.hasContent() && !label.isEmpty() && !label.contains(newNode.getKind())) {
            context.append(emph(label)).append(' ');
        }
        return context.append(newNode.getKind()).append(' ').toString();
    }

    private String reference(Node elem) {
        String directive = options.getReferenceDirectives().get(elem.getKind());
        String label = elem.getLabel();
        if (elem.isDescribable() && directive != null && !label.isEmpty()) {
            return directive(directive, List.of(DirectiveEscaper.escape(label)));
        }
        return label.isEmpty() ? "" : emph(label);
    }

    /**
     * A new node matched by several old nodes has one opcode set per pairing, and the sets overlap.
     * Only the first pairing is spliced; the others are reported and left out of the body.
     */
    private void spliceFirstPairing(Node node, Map<Node, List<DiffRecord>> byOldNode) {
        boolean first = true;
        for (Map.Entry<Node, List<DiffRecord>> pairing : byOldNode.entrySet()) {
            if (first) {
                splice(node, pairing.getKey(), pairing.getValue());
                first = false;
            } else {
                log.error("{}: content also compared with {}; {} edits not spliced: {}", node.getPath(),
                        pairing.getKey().getPath(), pairing.getValue().size(), pairing.getValue());
            }
        }
    }

    /**
     * Rebuilds the node's body left to right, splicing a change directive in for every
     * non-whitespace opcode. Whitespace-only opcodes keep their new tokens as they are.
     */
    private void splice(Node node, Node oldNode, List<DiffRecord> edits) {
        List<Segment> oldBody = MyersContentDiffer.bodyOf(oldNode);
        List<Segment> newBody = MyersContentDiffer.bodyOf(node);

        List<DiffRecord> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(d -> d.getNewRange().getStart()));

        List<Segment> body = new ArrayList<>(newBody.size() + ordered.size());
        int j = 0;
        for (DiffRecord d : ordered) {
            int j1 = d.getNewRange().getStart();
            int j2 = d.getNewRange().getEnd();
            if (j1 < j) {
                throw new IllegalStateException(String.format("%s: overlapping content edits at %d (cursor %d)",
                        node.getPath(), j1, j));
            }
            body.addAll(newBody.subList(j, j1));

            List<Segment> inserted = newBody.subList(j1, j2);
            if (d.isWhitespace()) {
                body.addAll(inserted);
            } else {
                String oldText = DirectiveEscaper.escape(Content.render(oldBody.subList(
                        d.getOldRange().getStart(), d.getOldRange().getEnd())));
                String newText = DirectiveEscaper.escape(Content.render(inserted));
                switch (d.getOpcode()) {
                    case REPLACE:
                        body.add(Segment.annotation(REPLACED, List.of(oldText, newText), inserted));
                        break;
                    case DELETE:
                        body.add(Segment.annotation(REMOVED, List.of(oldText), List.of()));
                        break;
                    case INSERT:
                        body.add(Segment.annotation(INSERTED, List.of(newText), inserted));
                        break;
                    default:
                        throw new IllegalStateException("unexpected opcode " + d.getOpcode());
                }
            }
            j = j2;
        }
        body.addAll(newBody.subList(j, newBody.size()));

        Content current = node.getContent();
        Content rewritten = current == null ? new Content(body) : current.withBody(body);
        node.setContent(rewritten);
        log.debug("{} {} content {}", node.getPath(), node.getKind(), rewritten.render());
    }

    static String directive(String name, List<String> args) {
        return Segment.call(name, args).render();
    }

    private static String emph(String text) {
        return text == null || text.isEmpty() ? "\"\"" : "*" + DirectiveEscaper.escape(text) + "*";
    }

    // note the trailing space
    private static String emphNode(Node node) {
        String label = node.getLabel();
        return label.isEmpty() ? "" : emph(label) + " ";
    }
}
