package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Element of a parsed document tree.
 * <p>
 * All element kinds (object, parameter, command, enumeration, ...) share this one type and are told
 * apart by {@link #getKind()}. The diff engine only ever mutates {@link #getContent()} and
 * {@link #isVisible()}; everything else is fixed once the tree is built.
 * <p>
 * Equality is identity: two structurally identical nodes are still different nodes.
 */
@Getter
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"kind", "key", "attributes", "describable", "visible", "content", "children"})
public class Node {

    private static final List<String> LABEL_ATTRIBUTES = List.of("name", "value", "ref", "base");

    @JsonProperty("kind")
    private final String kind;

    @JsonProperty("attributes")
    private final Map<String, String> attributes;

    /** Ordered identity tuple; null when the kind is not keyed. */
    @JsonProperty("key")
    private final List<String> identityKey;

    @JsonProperty("describable")
    private final boolean describable;

    @JsonProperty("children")
    private final List<Node> children = new ArrayList<>();

    private Node parent;

    @Setter
    @JsonProperty("content")
    private Content content;

    @Setter
    @JsonProperty("visible")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private boolean visible = true;

    @Builder
    private Node(String kind, @Singular Map<String, String> attributes, List<String> identityKey,
                 boolean describable, Content content, @Singular List<Node> children) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("node kind must not be blank");
        }
        this.kind = kind;
        this.attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.identityKey = identityKey == null ? null : List.copyOf(identityKey);
        this.describable = describable;
        this.content = content;
        if (children != null) {
            children.forEach(this::addChild);
        }
    }

    /**
     * Appends a child and points its parent link here.
     */
    public Node addChild(Node child) {
        Objects.requireNonNull(child, "child must not be null");
        if (child.parent != null) {
            throw new IllegalArgumentException("node " + child + " already has a parent");
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Node> childrenOfKind(String childKind) {
        return children.stream().filter(c -> c.kind.equals(childKind)).collect(Collectors.toList());
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasContent() {
        return content != null;
    }

    public boolean hasIdentityKey() {
        return identityKey != null && !identityKey.isEmpty();
    }

    /**
     * Short human-readable name: last key component, else the first of name/value/ref/base, else "".
     * Two nodes of the same kind with equal labels are considered the same element when keys
     * can't decide.
     */
    public String getLabel() {
        if (hasIdentityKey()) {
            return identityKey.get(identityKey.size() - 1);
        }
        for (String attr : LABEL_ATTRIBUTES) {
            String v = attributes.get(attr);
            if (v != null) {
                return v;
            }
        }
        return "";
    }

    /**
     * Nearest describable ancestor-or-self, or this node when there is none.
     */
    public Node getModelItem() {
        for (Node n = this; n != null; n = n.parent) {
            if (n.describable) {
                return n;
            }
        }
        return this;
    }

    /** Dotted path of labels (kinds where a label is missing) from the root, for log messages. */
    public String getPath() {
        List<String> parts = new ArrayList<>();
        for (Node n = this; n != null; n = n.parent) {
            String label = n.getLabel();
            parts.add(label.isEmpty() ? n.kind : label);
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    /** Marks this node and, if {@code upwards}, all its ancestors, else all its descendants, visible. */
    public void unhide(boolean upwards) {
        visible = true;
        if (upwards) {
            for (Node n = parent; n != null; n = n.parent) {
                n.visible = true;
            }
        } else {
            children.forEach(c -> c.unhide(false));
        }
    }

    public void hideAll() {
        visible = false;
        children.forEach(Node::hideAll);
    }

    /**
     * Deep copy with no parent; content bodies are shared since they are immutable lists.
     */
    public Node copy() {
        Content contentCopy = null;
        if (content != null) {
            contentCopy = new Content(content.getBody());
            contentCopy.setFooter(content.getFooter());
        }
        Node out = new Node(kind, attributes, identityKey, describable, contentCopy, null);
        out.visible = visible;
        for (Node child : children) {
            out.addChild(child.copy());
        }
        return out;
    }

    @Override
    public String toString() {
        String label = getLabel();
        return label.isEmpty() ? kind : kind + " " + label;
    }
}
