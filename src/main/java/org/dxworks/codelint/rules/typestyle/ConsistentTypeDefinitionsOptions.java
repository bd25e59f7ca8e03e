package org.dxworks.codelint.rules.typestyle;

public class ConsistentTypeDefinitionsOptions {
    public TypeDefinitionStyle style;

    public ConsistentTypeDefinitionsOptions() {
    }

    public ConsistentTypeDefinitionsOptions(TypeDefinitionStyle style) {
        this.style = style;
    }

    public TypeDefinitionStyle resolveStyle() {
        return style != null ? style : TypeDefinitionStyle.INTERFACE;
    }
}
