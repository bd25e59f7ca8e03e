package org.dxworks.codelint.rules.typestyle;

public class ConsistentGenericConstructorsOptions {
    public GenericConstructorStyle style;

    public ConsistentGenericConstructorsOptions() {
    }

    public ConsistentGenericConstructorsOptions(GenericConstructorStyle style) {
        this.style = style;
    }

    public GenericConstructorStyle resolveStyle() {
        return style != null ? style : GenericConstructorStyle.CONSTRUCTOR;
    }
}
