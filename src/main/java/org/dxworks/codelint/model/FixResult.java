package org.dxworks.codelint.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of repeatedly applying fixes to one source text.
 */
public class FixResult {
    public String output;
    public int passes;
    public int appliedFixes;
    public List<Violation> remaining = new ArrayList<>();

    public boolean isChanged(String original) {
        return !original.equals(output);
    }
}
