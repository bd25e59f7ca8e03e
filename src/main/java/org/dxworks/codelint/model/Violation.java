package org.dxworks.codelint.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Violation {
    public String ruleName;
    public String severity;
    public String messageId;
    public String message;
    public Map<String, String> data = new LinkedHashMap<>();
    public SourceRange range;
    public List<Edit> fix; // null when the violation has no safe rewrite
    public List<Suggestion> suggestions = new ArrayList<>();

    public boolean hasFix() {
        return fix != null && !fix.isEmpty();
    }

    public int fixStart() {
        return fix.get(0).startByte;
    }

    public int fixEnd() {
        return fix.get(fix.size() - 1).endByte;
    }
}
