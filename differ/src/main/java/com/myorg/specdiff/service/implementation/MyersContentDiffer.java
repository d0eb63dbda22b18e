package com.myorg.specdiff.service.implementation;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;
import com.myorg.specdiff.model.Content;
import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.DiffRecord;
import com.myorg.specdiff.model.Entity;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.model.OpcodeTag;
import com.myorg.specdiff.model.Operation;
import com.myorg.specdiff.model.Segment;
import com.myorg.specdiff.model.TokenRange;
import com.myorg.specdiff.service.ContentDiffer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Token-level content differ using the Myers algorithm from java-diff-utils.
 */
@Slf4j
public class MyersContentDiffer implements ContentDiffer {

    // {{nl}} -> }}{{div|{{classes}}| is what paragraph wrapping does to a line break
    private static final List<Segment> REWRAP_OLD = List.of(Segment.call("nl"));
    private static final List<Segment> REWRAP_NEW = List.of(
            Segment.close("div"), Segment.open("div"), Segment.call("classes"), Segment.ARGSEP);

    @Override
    public void diff(Node oldNode, Node newNode, DiffMap diffs) {
        List<Segment> body1 = bodyOf(oldNode);
        List<Segment> body2 = bodyOf(newNode);
        if (body1.isEmpty() && body2.isEmpty()) return;
        if (body1.equals(body2)) return;

        Patch<Segment> patch = DiffUtils.diff(body1, body2);
        boolean doneHeader = false;
        for (AbstractDelta<Segment> delta : patch.getDeltas()) {
            OpcodeTag tag = toOpcode(delta);
            if (tag == OpcodeTag.EQUAL) continue;

            Chunk<Segment> source = delta.getSource();
            Chunk<Segment> target = delta.getTarget();
            List<Segment> chunk1 = source.getLines();
            List<Segment> chunk2 = target.getLines();
            boolean whitespace = isWhitespaceOnly(chunk1, chunk2);

            if (!doneHeader && log.isDebugEnabled()) {
                log.debug("{}", newNode.getPath());
                log.debug("  {} body1 {}", body1.size(), body1);
                log.debug("  {} body2 {}", body2.size(), body2);
                doneHeader = true;
            }

            TokenRange oldRange = TokenRange.of(source.getPosition(), source.getPosition() + source.size());
            TokenRange newRange = TokenRange.of(target.getPosition(), target.getPosition() + target.size());
            log.debug("    {} value{} -> value2{} {} {} -> {}", String.format("%-7s", tag.getLabel()),
                    oldRange, newRange, whitespace ? "(W)" : "...", chunk1, chunk2);

            diffs.append(DiffRecord.builder()
                    .oldNode(oldNode)
                    .newNode(newNode)
                    .entity(Entity.CONTENT)
                    .operation(Operation.CHANGED)
                    .name(tag.getLabel())
                    .opcode(tag)
                    .oldRange(oldRange)
                    .newRange(newRange)
                    .whitespace(whitespace)
                    .build());
        }
    }

    /**
     * True when both sides hold nothing but empty or whitespace text, or when the change is the
     * paragraph rewrap artifact. Nothing broader is treated as cosmetic.
     */
    static boolean isWhitespaceOnly(List<Segment> chunk1, List<Segment> chunk2) {
        if (chunk1.stream().allMatch(Segment::isWhitespace) && chunk2.stream().allMatch(Segment::isWhitespace)) {
            return true;
        }
        return chunk1.equals(REWRAP_OLD) && chunk2.equals(REWRAP_NEW);
    }

    private static OpcodeTag toOpcode(AbstractDelta<Segment> delta) {
        switch (delta.getType()) {
            case CHANGE:
                return OpcodeTag.REPLACE;
            case DELETE:
                return OpcodeTag.DELETE;
            case INSERT:
                return OpcodeTag.INSERT;
            default:
                return OpcodeTag.EQUAL;
        }
    }

    static List<Segment> bodyOf(Node node) {
        Content content = node.getContent();
        return content == null ? List.of() : content.getBody();
    }
}
