package org.dxworks.codelint.model;

import java.util.ArrayList;
import java.util.List;

public class FileLintResult {
    public String kind = "file";
    public String filePath;
    public String language = "typescript";
    public List<Violation> violations = new ArrayList<>();
    public Integer fixPasses; // only set when fixes were applied

    public long countBySeverity(String severity) {
        return violations.stream().filter(v -> severity.equals(v.severity)).count();
    }
}
