package org.dxworks.codelint.model;

/**
 * Replacement of the half-open UTF-8 byte range {@code [startByte, endByte)} with {@code replacement}.
 * An empty range is an insertion, an empty replacement is a removal.
 */
public class Edit {
    public int startByte;
    public int endByte;
    public String replacement;

    public Edit(int startByte, int endByte, String replacement) {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid edit range [" + startByte + ", " + endByte + ")");
        }
        this.startByte = startByte;
        this.endByte = endByte;
        this.replacement = replacement == null ? "" : replacement;
    }

    public boolean overlaps(Edit other) {
        return startByte < other.endByte && other.startByte < endByte;
    }
}
