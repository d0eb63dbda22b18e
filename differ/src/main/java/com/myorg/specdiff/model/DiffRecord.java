package com.myorg.specdiff.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * A single discovered difference between a matched old/new node pair.
 * <p>
 * Attribute records carry {@code name}, {@code value} and (for changes) {@code value2}.
 * Element records carry {@code elem}: the removed old child or the added new child, while
 * {@code newNode} is the new-tree parent. Content records carry the opcode, its name and the
 * old/new token ranges.
 */
@Getter
@Builder
public class DiffRecord {

    @NonNull
    private final Node oldNode;

    @NonNull
    private final Node newNode;

    @NonNull
    private final Entity entity;

    @NonNull
    private final Operation operation;

    private final String name;

    private final String value;

    private final String value2;

    private final Node elem;

    private final OpcodeTag opcode;

    private final TokenRange oldRange;

    private final TokenRange newRange;

    private final boolean whitespace;

    @Override
    public String toString() {
        String what = name != null ? name : elem != null ? elem.getKind() : entity.name().toLowerCase();
        StringBuilder text = new StringBuilder()
                .append(operation.name().toLowerCase()).append(' ').append(what).append(' ');
        if (whitespace) {
            text.append("(W) ");
        }
        switch (entity) {
            case ATTRIBUTE:
                if (operation == Operation.CHANGED) {
                    text.append(value).append(" -> ").append(value2);
                } else {
                    text.append(value);
                }
                break;
            case ELEMENT:
                text.append(elem);
                break;
            case CONTENT:
                text.append(oldRange).append(" -> ").append(newRange);
                break;
            default:
                break;
        }
        return text.toString().trim();
    }
}
