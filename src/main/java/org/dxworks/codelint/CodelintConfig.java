package org.dxworks.codelint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codelint.linter.ConfiguredRule;
import org.dxworks.codelint.linter.Linter;
import org.dxworks.codelint.linter.RuleLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class CodelintConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CodelintConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    public static final String CONFIG_FILE_NAME = "codelint-config.yml";

    private final int maxFileLines;
    private final List<String> excludes;
    private final List<ConfiguredRule> rules;

    private CodelintConfig(int maxFileLines, List<String> excludes, List<ConfiguredRule> rules) {
        this.maxFileLines = maxFileLines;
        this.excludes = List.copyOf(excludes);
        this.rules = List.copyOf(rules);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public List<ConfiguredRule> getRules() {
        return rules;
    }

    public Linter createLinter() {
        return new Linter(rules);
    }

    public static CodelintConfig defaults() {
        return new CodelintConfig(DEFAULT_MAX_FILE_LINES, Collections.emptyList(), RuleRegistry.allRules());
    }

    public static CodelintConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * A missing or unreadable file yields the defaults. A readable file with invalid content is an error.
     */
    public static CodelintConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        JsonNode tree;
        try {
            tree = yamlMapper.readTree(configPath.toFile());
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return defaults();
        }
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return defaults();
        }

        YamlConfig yamlConfig;
        try {
            yamlConfig = yamlMapper.treeToValue(tree, YamlConfig.class);
        } catch (JsonProcessingException e) {
            throw new CodelintConfigException("Invalid configuration in " + configPath + ": " + e.getOriginalMessage(), e);
        }
        return fromYaml(yamlConfig);
    }

    static CodelintConfig fromYaml(YamlConfig yamlConfig) {
        int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                ? yamlConfig.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        List<String> excludes = yamlConfig.excludes != null ? yamlConfig.excludes : Collections.emptyList();

        // no rules section: everything at error
        if (yamlConfig.rules == null) {
            return new CodelintConfig(effectiveMaxFileLines, excludes, RuleRegistry.allRules());
        }
        List<ConfiguredRule> rules = new ArrayList<>();
        for (Map.Entry<String, RuleSettings> entry : yamlConfig.rules.entrySet()) {
            RuleSettings settings = entry.getValue() != null ? entry.getValue() : new RuleSettings();
            RuleLevel level = settings.level != null ? settings.level : RuleLevel.ERROR;
            rules.add(new ConfiguredRule(RuleRegistry.create(entry.getKey(), settings.options), level));
        }
        return new CodelintConfig(effectiveMaxFileLines, excludes, rules);
    }

    static class YamlConfig {
        public Integer maxFileLines;
        public List<String> excludes;
        public Map<String, RuleSettings> rules;
    }

    static class RuleSettings {
        public RuleLevel level;
        public Map<String, Object> options;
    }
}
