package org.dxworks.codelint.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An alternative rewrite offered alongside a violation. Never applied automatically.
 */
public class Suggestion {
    public String messageId;
    public String message;
    public Map<String, String> data = new LinkedHashMap<>();
    public List<Edit> edits = new ArrayList<>();
}
