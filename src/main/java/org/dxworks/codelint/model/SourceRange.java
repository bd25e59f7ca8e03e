package org.dxworks.codelint.model;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;

/**
 * Location of a reported node. Byte offsets are UTF-8 and zero based, lines and columns are one based
 * (columns count bytes, as tree-sitter does).
 */
public class SourceRange {
    public int startByte;
    public int endByte;
    public int startLine;
    public int startColumn;
    public int endLine;
    public int endColumn;

    public static SourceRange of(TSNode node) {
        SourceRange range = new SourceRange();
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        range.startByte = node.getStartByte();
        range.endByte = node.getEndByte();
        range.startLine = start.getRow() + 1;
        range.startColumn = start.getColumn() + 1;
        range.endLine = end.getRow() + 1;
        range.endColumn = end.getColumn() + 1;
        return range;
    }

    /**
     * From the start of {@code first} up to the start of {@code end}.
     */
    public static SourceRange between(TSNode first, TSNode end) {
        SourceRange range = of(first);
        TSPoint stop = end.getStartPoint();
        range.endByte = end.getStartByte();
        range.endLine = stop.getRow() + 1;
        range.endColumn = stop.getColumn() + 1;
        return range;
    }
}
