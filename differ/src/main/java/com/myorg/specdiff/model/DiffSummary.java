package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one comparison, as returned by the REST endpoint and written to the Excel report.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffSummary {

    @JsonProperty("old_root")
    private String oldRoot;

    @JsonProperty("new_root")
    private String newRoot;

    @JsonProperty("record_count")
    private Integer recordCount;

    @JsonProperty("model_item_count")
    private Integer modelItemCount;

    @JsonProperty("unresolved_count")
    private Integer unresolvedCount;

    /** False when some correspondence could not be resolved; the diff is then incomplete. */
    @JsonProperty("complete")
    private Boolean complete;

    // keys like "attribute_changed", sorted by entity then operation
    @JsonProperty("counts")
    private Map<String, Integer> counts;

    @JsonProperty("changed_items")
    private List<String> changedItems;

    @JsonProperty("unresolved")
    private List<String> unresolved;

    public Map<String, Integer> getCounts() {
        return counts == null ? Map.of() : counts;
    }

    public List<String> getChangedItems() {
        return changedItems == null ? List.of() : List.copyOf(changedItems);
    }

    public List<String> getUnresolved() {
        return unresolved == null ? List.of() : List.copyOf(unresolved);
    }
}
