package org.dxworks.codelint.rules.typestyle;

public class ConsistentIndexedObjectStyleOptions {
    public IndexedObjectStyle style;

    public ConsistentIndexedObjectStyleOptions() {
    }

    public ConsistentIndexedObjectStyleOptions(IndexedObjectStyle style) {
        this.style = style;
    }

    public IndexedObjectStyle resolveStyle() {
        return style != null ? style : IndexedObjectStyle.RECORD;
    }
}
