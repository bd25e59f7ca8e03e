package org.dxworks.codelint.linter;

import org.dxworks.codelint.model.Edit;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the edits of a single report. Edits must not overlap each other; they may be added in any
 * order and are handed out sorted by start offset.
 */
public class RangeRewriter {

    private static final Comparator<Edit> BY_POSITION = Comparator
            .comparingInt((Edit e) -> e.startByte)
            .thenComparingInt(e -> e.endByte);

    private final List<Edit> edits = new ArrayList<>();

    public RangeRewriter replaceRange(int startByte, int endByte, String replacement) {
        Edit edit = new Edit(startByte, endByte, replacement);
        for (Edit existing : edits) {
            if (existing.overlaps(edit)) {
                throw new IllegalStateException("Edit [" + startByte + ", " + endByte
                        + ") overlaps [" + existing.startByte + ", " + existing.endByte + ")");
            }
        }
        edits.add(edit);
        return this;
    }

    public RangeRewriter replaceNode(TSNode node, String replacement) {
        return replaceRange(node.getStartByte(), node.getEndByte(), replacement);
    }

    public RangeRewriter remove(int startByte, int endByte) {
        return replaceRange(startByte, endByte, "");
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public List<Edit> edits() {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort(BY_POSITION);
        return sorted;
    }
}
