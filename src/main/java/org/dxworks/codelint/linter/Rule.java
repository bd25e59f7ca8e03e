package org.dxworks.codelint.linter;

import java.util.Map;

public interface Rule {

    String name();

    /**
     * Message templates keyed by message id. Placeholders use the {@code {{key}}} form.
     */
    Map<String, String> messages();

    void check(RuleContext context);
}
