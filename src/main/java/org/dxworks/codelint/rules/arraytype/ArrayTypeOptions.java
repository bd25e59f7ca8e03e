package org.dxworks.codelint.rules.arraytype;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ArrayTypeOptions {
    @JsonProperty("default")
    public ArrayOption defaultOption;
    public ArrayOption readonly;

    public ArrayTypeOptions() {
    }

    public ArrayTypeOptions(ArrayOption defaultOption, ArrayOption readonly) {
        this.defaultOption = defaultOption;
        this.readonly = readonly;
    }

    public ArrayOption resolveDefault() {
        return defaultOption != null ? defaultOption : ArrayOption.ARRAY;
    }

    public ArrayOption resolveReadonly() {
        return readonly != null ? readonly : resolveDefault();
    }
}
