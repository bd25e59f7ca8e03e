package org.dxworks.codelint.rules.bantypes;

import java.util.Collections;
import java.util.List;

/**
 * What to do with one banned type name. Immutable.
 */
public class BanPolicy {

    public enum Action {
        /** Explicitly allowed; cancels a default ban. */
        ALLOWED,
        DISALLOW,
        DISALLOW_WITH_MESSAGE,
        DISALLOW_WITH_FIX
    }

    private final String name;
    private final Action action;
    private final String message;
    private final String fixWith;
    private final List<String> suggest;

    private BanPolicy(String name, Action action, String message, String fixWith, List<String> suggest) {
        this.name = name;
        this.action = action;
        this.message = message;
        this.fixWith = fixWith;
        this.suggest = suggest == null ? Collections.emptyList() : List.copyOf(suggest);
    }

    public static BanPolicy allowed(String name) {
        return new BanPolicy(name, Action.ALLOWED, null, null, null);
    }

    public static BanPolicy disallow(String name) {
        return new BanPolicy(name, Action.DISALLOW, null, null, null);
    }

    public static BanPolicy withMessage(String name, String message) {
        return new BanPolicy(name, Action.DISALLOW_WITH_MESSAGE, message, null, null);
    }

    /**
     * Picks the narrowest action for the given parts; {@code message}, {@code fixWith} and {@code suggest}
     * may each be absent.
     */
    public static BanPolicy of(String name, String message, String fixWith, List<String> suggest) {
        if (fixWith != null || (suggest != null && !suggest.isEmpty())) {
            return new BanPolicy(name, Action.DISALLOW_WITH_FIX, message, fixWith, suggest);
        }
        if (message != null) return withMessage(name, message);
        return disallow(name);
    }

    public String getName() {
        return name;
    }

    public Action getAction() {
        return action;
    }

    public boolean isBanned() {
        return action != Action.ALLOWED;
    }

    public String getMessage() {
        return message;
    }

    public String getFixWith() {
        return fixWith;
    }

    public List<String> getSuggest() {
        return suggest;
    }

    /**
     * Message tail appended to the report, with a leading space, or empty.
     */
    public String customMessage() {
        return message == null || message.isEmpty() ? "" : " " + message;
    }
}
