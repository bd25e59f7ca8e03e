package org.dxworks.codelint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codelint.linter.ConfiguredRule;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleLevel;
import org.dxworks.codelint.rules.arraytype.ArrayTypeOptions;
import org.dxworks.codelint.rules.arraytype.ArrayTypeRule;
import org.dxworks.codelint.rules.bantypes.BanTypesOptions;
import org.dxworks.codelint.rules.bantypes.BanTypesRule;
import org.dxworks.codelint.rules.classes.ClassLiteralPropertyStyleOptions;
import org.dxworks.codelint.rules.classes.ClassLiteralPropertyStyleRule;
import org.dxworks.codelint.rules.classes.ClassMethodsUseThisOptions;
import org.dxworks.codelint.rules.classes.ClassMethodsUseThisRule;
import org.dxworks.codelint.rules.comments.BanTsCommentOptions;
import org.dxworks.codelint.rules.comments.BanTsCommentRule;
import org.dxworks.codelint.rules.comments.BanTslintCommentRule;
import org.dxworks.codelint.rules.functions.DefaultParamLastRule;
import org.dxworks.codelint.rules.overload.AdjacentOverloadSignaturesRule;
import org.dxworks.codelint.rules.typestyle.ConsistentGenericConstructorsOptions;
import org.dxworks.codelint.rules.typestyle.ConsistentGenericConstructorsRule;
import org.dxworks.codelint.rules.typestyle.ConsistentIndexedObjectStyleOptions;
import org.dxworks.codelint.rules.typestyle.ConsistentIndexedObjectStyleRule;
import org.dxworks.codelint.rules.typestyle.ConsistentTypeDefinitionsOptions;
import org.dxworks.codelint.rules.typestyle.ConsistentTypeDefinitionsRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

public class RuleRegistry {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, Function<Map<String, Object>, Rule>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(AdjacentOverloadSignaturesRule.NAME, options -> new AdjacentOverloadSignaturesRule());
        FACTORIES.put(ArrayTypeRule.NAME, options -> new ArrayTypeRule(convert(options, ArrayTypeOptions.class)));
        FACTORIES.put(BanTypesRule.NAME, options -> new BanTypesRule(convert(options, BanTypesOptions.class)));
        FACTORIES.put(BanTsCommentRule.NAME, options -> new BanTsCommentRule(convert(options, BanTsCommentOptions.class)));
        FACTORIES.put(BanTslintCommentRule.NAME, options -> new BanTslintCommentRule());
        FACTORIES.put(ClassLiteralPropertyStyleRule.NAME,
                options -> new ClassLiteralPropertyStyleRule(convert(options, ClassLiteralPropertyStyleOptions.class)));
        FACTORIES.put(ClassMethodsUseThisRule.NAME,
                options -> new ClassMethodsUseThisRule(convert(options, ClassMethodsUseThisOptions.class)));
        FACTORIES.put(ConsistentGenericConstructorsRule.NAME,
                options -> new ConsistentGenericConstructorsRule(convert(options, ConsistentGenericConstructorsOptions.class)));
        FACTORIES.put(ConsistentIndexedObjectStyleRule.NAME,
                options -> new ConsistentIndexedObjectStyleRule(convert(options, ConsistentIndexedObjectStyleOptions.class)));
        FACTORIES.put(ConsistentTypeDefinitionsRule.NAME,
                options -> new ConsistentTypeDefinitionsRule(convert(options, ConsistentTypeDefinitionsOptions.class)));
        FACTORIES.put(DefaultParamLastRule.NAME, options -> new DefaultParamLastRule());
    }

    private RuleRegistry() {
    }

    public static Set<String> ruleNames() {
        return Collections.unmodifiableSet(FACTORIES.keySet());
    }

    public static Rule create(String name, Map<String, Object> options) {
        Function<Map<String, Object>, Rule> factory = FACTORIES.get(name);
        if (factory == null) {
            throw new CodelintConfigException("Unknown rule '" + name + "'. Known rules: " + FACTORIES.keySet());
        }
        try {
            return factory.apply(options == null ? Collections.emptyMap() : options);
        } catch (IllegalArgumentException e) {
            throw new CodelintConfigException("Invalid options for rule '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Every known rule at {@link RuleLevel#ERROR} with default options.
     */
    public static List<ConfiguredRule> allRules() {
        List<ConfiguredRule> rules = new ArrayList<>();
        for (String name : FACTORIES.keySet()) {
            rules.add(new ConfiguredRule(create(name, null), RuleLevel.ERROR));
        }
        return rules;
    }

    private static <T> T convert(Map<String, Object> options, Class<T> type) {
        // convertValue reports bad shapes as IllegalArgumentException
        return MAPPER.convertValue(options, type);
    }
}
