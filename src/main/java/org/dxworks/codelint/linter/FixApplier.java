package org.dxworks.codelint.linter;

import org.dxworks.codelint.model.Edit;
import org.dxworks.codelint.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies one pass of fixes. A fix covers the span from its first edit's start to its last edit's end;
 * fixes are taken in order of that span and any fix touching the span of an already accepted one is
 * left for a later pass.
 */
public class FixApplier {

    private static final Logger LOG = LoggerFactory.getLogger(FixApplier.class);

    public static class Pass {
        public final String output;
        public final int applied;
        public final int skipped;

        Pass(String output, int applied, int skipped) {
            this.output = output;
            this.applied = applied;
            this.skipped = skipped;
        }
    }

    public Pass apply(String source, List<Violation> violations) {
        List<Violation> fixable = new ArrayList<>();
        for (Violation v : violations) {
            if (v.hasFix()) fixable.add(v);
        }
        fixable.sort(Comparator.comparingInt(Violation::fixStart).thenComparingInt(Violation::fixEnd));

        List<Edit> accepted = new ArrayList<>();
        int lastEnd = -1;
        int applied = 0;
        int skipped = 0;
        for (Violation v : fixable) {
            if (v.fixStart() <= lastEnd) {
                skipped++;
                LOG.debug("Skipping fix for {} at byte {}: overlaps a previous fix", v.ruleName, v.fixStart());
                continue;
            }
            accepted.addAll(v.fix);
            lastEnd = v.fixEnd();
            applied++;
        }
        if (applied == 0) {
            return new Pass(source, 0, skipped);
        }
        return new Pass(rewrite(source, accepted), applied, skipped);
    }

    /**
     * Applies edits that are already sorted and disjoint.
     */
    static String rewrite(String source, List<Edit> edits) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + 64);
        int cursor = 0;
        for (Edit edit : edits) {
            if (edit.startByte < cursor || edit.endByte > bytes.length) {
                throw new IllegalStateException("Edit [" + edit.startByte + ", " + edit.endByte
                        + ") is out of order or beyond the end of the source");
            }
            out.write(bytes, cursor, edit.startByte - cursor);
            byte[] replacement = edit.replacement.getBytes(StandardCharsets.UTF_8);
            out.write(replacement, 0, replacement.length);
            cursor = edit.endByte;
        }
        out.write(bytes, cursor, bytes.length - cursor);
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
