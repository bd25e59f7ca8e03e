package org.dxworks.codelint.rules.bantypes;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

public class BanTypesOptions {
    // values: false, true, null, a message string or {message, fixWith, suggest}
    public Map<String, JsonNode> types = new LinkedHashMap<>();
    @JsonAlias("extend_defaults")
    public Boolean extendDefaults;

    public boolean isExtendDefaults() {
        return extendDefaults == null || extendDefaults;
    }
}
