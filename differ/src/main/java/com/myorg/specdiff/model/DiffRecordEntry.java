package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Flat, serializable view of a {@link DiffRecord} (one line of diffs.jsonl / one report row).
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffRecordEntry {

    @JsonProperty("model_item")
    private String modelItem;

    @JsonProperty("node")
    private String node;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("entity")
    private Entity entity;

    @JsonProperty("operation")
    private Operation operation;

    @JsonProperty("name")
    private String name;

    @JsonProperty("value")
    private String value;

    @JsonProperty("value2")
    private String value2;

    @JsonProperty("elem")
    private String elem;

    @JsonProperty("old_range")
    private TokenRange oldRange;

    @JsonProperty("new_range")
    private TokenRange newRange;

    @JsonProperty("whitespace")
    private Boolean whitespace;

    public static DiffRecordEntry from(Node modelItem, DiffRecord record) {
        return DiffRecordEntry.builder()
                .modelItem(modelItem.getPath())
                .node(record.getNewNode().getPath())
                .kind(record.getNewNode().getKind())
                .entity(record.getEntity())
                .operation(record.getOperation())
                .name(record.getName())
                // content records carry their token ranges in value/value2 as well
                .value(record.getOldRange() != null ? record.getOldRange().toString() : record.getValue())
                .value2(record.getNewRange() != null ? record.getNewRange().toString() : record.getValue2())
                .elem(record.getElem() == null ? null : record.getElem().toString())
                .oldRange(record.getOldRange())
                .newRange(record.getNewRange())
                // only meaningful for content
                .whitespace(record.getEntity() == Entity.CONTENT ? record.isWhitespace() : null)
                .build();
    }
}
