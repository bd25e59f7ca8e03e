package org.dxworks.codelint.rules.classes;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public class ClassMethodsUseThisOptions {
    static final String PUBLIC_FIELDS = "public-fields";

    @JsonAlias("except_methods")
    public List<String> exceptMethods = new ArrayList<>();
    @JsonAlias("enforce_for_class_fields")
    public Boolean enforceForClassFields;
    @JsonAlias("ignore_override_methods")
    public Boolean ignoreOverrideMethods;
    // true, false or "public-fields"
    @JsonAlias("ignore_classes_that_implement_an_interface")
    public JsonNode ignoreClassesThatImplementAnInterface;

    public boolean isEnforceForClassFields() {
        return enforceForClassFields == null || enforceForClassFields;
    }

    public boolean isIgnoreOverrideMethods() {
        return ignoreOverrideMethods != null && ignoreOverrideMethods;
    }

    public InterfaceExemption resolveInterfaceExemption() {
        JsonNode value = ignoreClassesThatImplementAnInterface;
        if (value == null || value.isNull()) return InterfaceExemption.NONE;
        if (value.isBoolean()) return value.booleanValue() ? InterfaceExemption.ALL_MEMBERS : InterfaceExemption.NONE;
        if (value.isTextual() && PUBLIC_FIELDS.equals(value.textValue())) return InterfaceExemption.PUBLIC_MEMBERS;
        throw new IllegalArgumentException("ignoreClassesThatImplementAnInterface must be a boolean or \""
                + PUBLIC_FIELDS + "\", got " + value);
    }

    public enum InterfaceExemption {
        NONE,
        ALL_MEMBERS,
        PUBLIC_MEMBERS
    }
}
