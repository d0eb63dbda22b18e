package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured text of a node: a token body plus a footer slot for synthesized summary text.
 */
@Getter
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Content {

    private final List<Segment> body;

    @Setter
    @JsonProperty("footer")
    private String footer;

    public Content(List<Segment> body) {
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    public static Content empty() {
        return new Content(List.of());
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    /**
     * Replaces the body and keeps the footer.
     */
    public Content withBody(List<Segment> newBody) {
        Content replaced = new Content(newBody);
        replaced.setFooter(footer);
        return replaced;
    }

    public List<Segment> slice(TokenRange range) {
        return body.subList(range.getStart(), range.getEnd());
    }

    @JsonProperty("body")
    public String render() {
        return render(body);
    }

    public static String render(List<Segment> segments) {
        return segments.stream().map(Segment::render).collect(Collectors.joining());
    }

    /**
     * Body with every synthesized change directive replaced by the new-tree tokens it stands for.
     */
    public List<Segment> stripAnnotations() {
        List<Segment> out = new ArrayList<>(body.size());
        for (Segment s : body) {
            if (s.isAnnotation()) {
                out.addAll(s.getRetained());
            } else {
                out.add(s);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
