package org.dxworks.codelint;

import org.dxworks.codelint.linter.ConfiguredRule;
import org.dxworks.codelint.linter.Linter;
import org.dxworks.codelint.linter.RuleLevel;
import org.dxworks.codelint.model.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodelintConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileEnablesEveryRuleAtError() {
        CodelintConfig config = CodelintConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(List.copyOf(RuleRegistry.ruleNames()), ruleNames(config));
        assertTrue(config.getRules().stream().allMatch(r -> r.level == RuleLevel.ERROR));
        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.getExcludes().isEmpty());
    }

    @Test
    void malformedFileFallsBackToDefaults() throws IOException {
        CodelintConfig config = CodelintConfig.load(write("rules: [unclosed\n"));

        assertEquals(RuleRegistry.ruleNames().size(), config.getRules().size());
    }

    @Test
    void listedRulesAreTheOnlyOnesRun() throws IOException {
        CodelintConfig config = CodelintConfig.load(write(
                "maxFileLines: 500\n"
                        + "excludes:\n"
                        + "  - \"**/generated/**\"\n"
                        + "rules:\n"
                        + "  ban-types:\n"
                        + "    level: warn\n"
                        + "  ban-tslint-comment:\n"
                        + "    level: \"off\"\n"));

        assertEquals(List.of("ban-types", "ban-tslint-comment"), ruleNames(config));
        assertEquals(RuleLevel.WARN, config.getRules().get(0).level);
        assertFalse(config.getRules().get(1).isEnabled());
        assertEquals(500, config.getMaxFileLines());
        assertEquals(List.of("**/generated/**"), config.getExcludes());

        List<Violation> violations = config.createLinter().lint("a.ts", "// tslint:disable\nlet a: Array<String>;\n");
        assertEquals(1, violations.size());
        assertEquals("ban-types", violations.get(0).ruleName);
        assertEquals("warn", violations.get(0).severity);
    }

    @Test
    void unquotedOffDisablesTheRule() throws IOException {
        CodelintConfig config = CodelintConfig.load(write("rules:\n  array-type:\n    level: off\n"));

        assertEquals(RuleLevel.OFF, config.getRules().get(0).level);
    }

    @Test
    void ruleWithoutSettingsRunsAtError() throws IOException {
        CodelintConfig config = CodelintConfig.load(write("rules:\n  adjacent-overload-signatures:\n"));

        assertEquals(1, config.getRules().size());
        assertEquals(RuleLevel.ERROR, config.getRules().get(0).level);
    }

    @Test
    void ruleOptionsReachTheRule() throws IOException {
        CodelintConfig config = CodelintConfig.load(write(
                "rules:\n"
                        + "  array-type:\n"
                        + "    options:\n"
                        + "      default: generic\n"
                        + "  ban-types:\n"
                        + "    options:\n"
                        + "      extendDefaults: false\n"
                        + "      types:\n"
                        + "        Foo:\n"
                        + "          message: Use Bar instead.\n"
                        + "          fixWith: Bar\n"));
        Linter linter = config.createLinter();

        assertEquals("let a: Array<Bar>;\nlet b: String;\n",
                linter.fix("a.ts", "let a: Foo[];\nlet b: String;\n").output);
    }

    @Test
    void styleOptionsReachTheRule() throws IOException {
        CodelintConfig config = CodelintConfig.load(write(
                "rules:\n"
                        + "  consistent-type-definitions:\n"
                        + "    options:\n"
                        + "      style: type\n"
                        + "  default-param-last:\n"));
        Linter linter = config.createLinter();

        assertEquals("type T = { x: number; }\nfunction f(a = 1, b) {}\n",
                linter.fix("a.ts", "interface T { x: number; }\nfunction f(a = 1, b) {}\n").output);
        assertEquals(List.of("consistent-type-definitions", "default-param-last"),
                linter.lint("a.ts", "interface T {}\nfunction f(a = 1, b) {}\n").stream()
                        .map(v -> v.ruleName).collect(Collectors.toList()));
    }

    @Test
    void invalidStyleIsRejected() throws IOException {
        Path path = write("rules:\n  consistent-indexed-object-style:\n    options:\n      style: map\n");

        assertThrows(CodelintConfigException.class, () -> CodelintConfig.load(path));
    }

    @Test
    void unknownRuleIsRejected() throws IOException {
        Path path = write("rules:\n  no-such-rule:\n    level: error\n");

        CodelintConfigException e = assertThrows(CodelintConfigException.class, () -> CodelintConfig.load(path));
        assertTrue(e.getMessage().contains("no-such-rule"));
    }

    @Test
    void invalidOptionIsRejected() throws IOException {
        Path path = write("rules:\n  array-type:\n    options:\n      default: sometimes\n");

        assertThrows(CodelintConfigException.class, () -> CodelintConfig.load(path));
    }

    @Test
    void invalidLevelIsRejected() throws IOException {
        Path path = write("rules:\n  array-type:\n    level: loud\n");

        assertThrows(CodelintConfigException.class, () -> CodelintConfig.load(path));
    }

    @Test
    void nonPositiveMaxFileLinesKeepsTheDefault() throws IOException {
        CodelintConfig config = CodelintConfig.load(write("maxFileLines: 0\n"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(RuleRegistry.ruleNames().size(), config.getRules().size());
    }

    private Path write(String yaml) throws IOException {
        Path path = tempDir.resolve(CodelintConfig.CONFIG_FILE_NAME);
        Files.writeString(path, yaml, StandardCharsets.UTF_8);
        return path;
    }

    private static List<String> ruleNames(CodelintConfig config) {
        return config.getRules().stream().map(r -> r.rule.name()).collect(Collectors.toList());
    }
}
