package org.dxworks.codelint.rules.bantypes;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.codelint.linter.TreeSitterHelper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Banned type names keyed by their whitespace-free spelling. Built once per configuration, read-only after.
 */
public class BannedTypeTable {

    private static final Map<String, BanPolicy> DEFAULTS = buildDefaults();

    private final Map<String, BanPolicy> policies;

    private BannedTypeTable(Map<String, BanPolicy> policies) {
        this.policies = Collections.unmodifiableMap(policies);
    }

    public static BannedTypeTable defaults() {
        return new BannedTypeTable(new LinkedHashMap<>(DEFAULTS));
    }

    public static BannedTypeTable of(BanTypesOptions options) {
        Map<String, BanPolicy> policies = new LinkedHashMap<>();
        if (options.isExtendDefaults()) {
            policies.putAll(DEFAULTS);
        }
        if (options.types != null) {
            for (Map.Entry<String, JsonNode> entry : options.types.entrySet()) {
                String key = normalize(entry.getKey());
                policies.put(key, parsePolicy(key, entry.getValue()));
            }
        }
        return new BannedTypeTable(policies);
    }

    public static String normalize(String typeText) {
        return TreeSitterHelper.removeWhitespace(typeText);
    }

    /**
     * The ban for the given type text, if it is banned. Explicitly allowed names yield nothing.
     */
    public Optional<BanPolicy> lookup(String typeText) {
        BanPolicy policy = policies.get(normalize(typeText));
        return policy != null && policy.isBanned() ? Optional.of(policy) : Optional.empty();
    }

    public Map<String, BanPolicy> getPolicies() {
        return policies;
    }

    static BanPolicy parsePolicy(String name, JsonNode value) {
        if (value == null || value.isNull()) return BanPolicy.disallow(name);
        if (value.isBoolean()) return value.asBoolean() ? BanPolicy.disallow(name) : BanPolicy.allowed(name);
        if (value.isTextual()) return BanPolicy.withMessage(name, value.asText());
        if (value.isObject()) {
            String message = textOrNull(value.get("message"));
            JsonNode fixNode = value.has("fixWith") ? value.get("fixWith") : value.get("fix_with");
            List<String> suggest = new ArrayList<>();
            JsonNode suggestNode = value.get("suggest");
            if (suggestNode != null && !suggestNode.isNull()) {
                if (!suggestNode.isArray()) {
                    throw new IllegalArgumentException("'suggest' of banned type '" + name + "' must be a list");
                }
                suggestNode.forEach(s -> suggest.add(s.asText()));
            }
            return BanPolicy.of(name, message, textOrNull(fixNode), suggest);
        }
        throw new IllegalArgumentException("Unsupported ban for type '" + name + "': " + value);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Map<String, BanPolicy> buildDefaults() {
        Map<String, BanPolicy> defaults = new LinkedHashMap<>();
        primitiveWrapper(defaults, "String", "string");
        primitiveWrapper(defaults, "Boolean", "boolean");
        primitiveWrapper(defaults, "Number", "number");
        primitiveWrapper(defaults, "Symbol", "symbol");
        primitiveWrapper(defaults, "BigInt", "bigint");
        defaults.put("Function", BanPolicy.withMessage("Function", String.join("\n",
                "The `Function` type accepts any function-like value.",
                "It provides no type safety when calling the function, which can be a common source of bugs.",
                "It also accepts things like class declarations, which will throw at runtime as they will not be called with `new`.",
                "If you are expecting the function to accept certain arguments, you should explicitly define the function shape.")));
        defaults.put("Object", BanPolicy.of("Object", String.join("\n",
                "The `Object` type actually means \"any non-nullish value\", so it is marginally better than `unknown`.",
                "- If you want a type meaning \"any object\", you probably want `object` instead.",
                "- If you want a type meaning \"any value\", you probably want `unknown` instead.",
                "- If you really want a type meaning \"any non-nullish value\", you probably want `NonNullable<unknown>` instead."),
                null, List.of("object", "unknown", "NonNullable<unknown>")));
        defaults.put("{}", BanPolicy.of("{}", String.join("\n",
                "`{}` actually means \"any non-nullish value\".",
                "- If you want a type meaning \"any object\", you probably want `object` instead.",
                "- If you want a type meaning \"any value\", you probably want `unknown` instead.",
                "- If you want a type meaning \"empty object\", you probably want `Record<string, never>` instead.",
                "- If you really want a type meaning \"any non-nullish value\", you probably want `NonNullable<unknown>` instead."),
                null, List.of("object", "unknown", "Record<string, never>", "NonNullable<unknown>")));
        return defaults;
    }

    private static void primitiveWrapper(Map<String, BanPolicy> defaults, String name, String keyword) {
        defaults.put(name, BanPolicy.of(name, "Use " + keyword + " instead", keyword, null));
    }
}
