package org.dxworks.codelint.rules.bantypes;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codelint.TestUtils;
import org.dxworks.codelint.model.Suggestion;
import org.dxworks.codelint.model.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class BanTypesRuleTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String NS_OPTIONS =
            "{\"types\": {\"NS.Bad\": {\"message\": \"Use NS.Good instead.\", \"fixWith\": \"NS.Good\"}}}";

    static Stream<Arguments> validCode() {
        return Stream.of(
                arguments(null, "let f = Object();"),
                arguments(null, "let f: { x: number; y: number } = { x: 1, y: 1 };"),
                arguments(null, "let h = String(false);"),
                arguments(null, "let e: foo.String;"),
                arguments(null, "interface Foo {}"),
                arguments(null, "let a: [];"),
                arguments(NS_OPTIONS, "let a: _.NS.Bad;"),
                arguments(NS_OPTIONS, "let a: NS.Bad._;"),
                arguments("{\"extendDefaults\": false, \"types\": {\"Number\": {\"fixWith\": \"number\"}}}", "let a: String;"),
                arguments("{\"types\": {\"null\": {\"message\": \"Use undefined instead.\", \"fixWith\": \"undefined\"}}}",
                        "let a: undefined;"),
                arguments("{\"extendDefaults\": false, \"types\": {\"undefined\": null}}", "let a: null;"),
                arguments("{\"extendDefaults\": true, \"types\": {\"{}\": false}}", "type Props = {};")
        );
    }

    static Stream<Arguments> fixedCode() {
        return Stream.of(
                arguments(null, "let a: String;", "let a: string;"),
                arguments(null, "let b: { c: String };", "let b: { c: string };"),
                arguments(null, "function foo(a: String) {}", "function foo(a: string) {}"),
                arguments(null, "'a' as String;", "'a' as string;"),
                arguments("{\"types\": {\"String\": {\"fixWith\": \"string\"}}}", "let a: String;", "let a: string;"),
                arguments(NS_OPTIONS, "let a: NS.Bad;", "let a: NS.Good;"),
                arguments(NS_OPTIONS, "let a: NS . Bad;", "let a: NS.Good;"),
                arguments("{\"types\": {\"F\": {\"fixWith\": \"T\"}}}", "let a: Foo<   F   >;", "let a: Foo<   T   >;"),
                arguments("{\"types\": {\"{   }\": {\"message\": \"Use object instead.\", \"fixWith\": \"object\"}}}",
                        "let foo: {} = {};\nlet bar: {     } = {};\nlet baz: {\n} = {};\n",
                        "let foo: object = {};\nlet bar: object = {};\nlet baz: object = {};\n"),
                arguments("{\"types\": {\"[]\": {\"fixWith\": \"any[]\"}}}", "let a: [];", "let a: any[];"),
                arguments(null,
                        "class Foo<F = String> extends Bar<String> implements Baz<Object> {\n"
                                + "  constructor(foo: String | Object) {}\n"
                                + "}\n",
                        "class Foo<F = string> extends Bar<string> implements Baz<Object> {\n"
                                + "  constructor(foo: string | Object) {}\n"
                                + "}\n")
        );
    }

    @ParameterizedTest
    @MethodSource("validCode")
    void validCodeHasNoViolations(String options, String code) throws IOException {
        assertTrue(TestUtils.lint(rule(options), code).isEmpty(), code);
    }

    @ParameterizedTest
    @MethodSource("fixedCode")
    void bannedTypesWithReplacementAreFixed(String options, String code, String expected) throws IOException {
        assertEquals(expected, TestUtils.fix(rule(options), code));
    }

    @Test
    void reportPointsAtTheBannedType() {
        List<Violation> violations = TestUtils.lint(new BanTypesRule(), "function foo(a: String) {}");

        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertEquals("banned_type_message", violation.messageId);
        assertEquals("String", violation.data.get("name"));
        assertEquals(" Use string instead", violation.data.get("custom_message"));
        assertEquals(1, violation.range.startLine);
        assertEquals(17, violation.range.startColumn);
    }

    @Test
    void objectGetsSuggestionsButNoFix() {
        List<Violation> violations = TestUtils.lint(new BanTypesRule(), "let a: Object;");

        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertNull(violation.fix);
        assertTrue(violation.message.startsWith("Don't use `Object` as a type. The `Object` type actually means"));
        assertEquals(4, violation.message.split("\n").length);

        List<Suggestion> suggestions = violation.suggestions;
        assertEquals(3, suggestions.size());
        assertEquals("banned_type_replacement", suggestions.get(0).messageId);
        assertEquals("Replace `Object` with `object`", suggestions.get(0).message);
        assertEquals("NonNullable<unknown>", suggestions.get(2).edits.get(0).replacement);
        assertEquals(7, suggestions.get(2).edits.get(0).startByte);
        assertEquals(13, suggestions.get(2).edits.get(0).endByte);
    }

    @Test
    void emptyTypeLiteralIsBannedByDefault() {
        List<Violation> violations = TestUtils.lint(new BanTypesRule(), "let foo: {} = {};");

        assertEquals(1, violations.size());
        assertEquals("{}", violations.get(0).data.get("name"));
        assertEquals(10, violations.get(0).range.startColumn);
        assertEquals(4, violations.get(0).suggestions.size());
    }

    @Test
    void genericsAreMatchedByTheirFullText() throws IOException {
        BanTypesRule rule = rule("{\"types\": {\"Bar<any>\": \"Use Bar<unknown>\", \"Bar<A, B>\": null}}");

        Violation single = TestUtils.lint(rule, "type Foo = Bar<any>;").get(0);
        Violation pair = TestUtils.lint(rule, "type Foo = Bar<A,B>;").get(0);

        assertEquals("Bar<any>", single.data.get("name"));
        assertEquals("Don't use `Bar<any>` as a type. Use Bar<unknown>", single.message);
        assertEquals(12, single.range.startColumn);
        assertEquals("Bar<A,B>", pair.data.get("name"));
        assertEquals("", pair.data.get("custom_message"));
    }

    @Test
    void emptyTupleIsMatchedWhereverItIs() throws IOException {
        BanTypesRule rule = rule("{\"types\": {\"[]\": \"Use any[] instead.\"}}");

        List<Violation> spaced = TestUtils.lint(rule, "let a:  [ ] ;");
        List<Violation> nested = TestUtils.lint(rule, "let a: [[]];");

        assertEquals(1, spaced.size());
        assertEquals("[]", spaced.get(0).data.get("name"));
        assertEquals(9, spaced.get(0).range.startColumn);
        assertEquals(1, nested.size());
        assertEquals(9, nested.get(0).range.startColumn);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "type Baz = 1 & Foo;",
            "interface Bar extends Foo {}",
            "interface Bar extends Baz, Foo {}",
            "class Bar implements Foo {}",
            "class Bar implements Baz, Foo {}"
    })
    void typeReferencesInHeritageAndIntersections(String code) throws IOException {
        assertEquals(1, TestUtils.lint(rule("{\"types\": {\"Foo\": {\"message\": \"\"}}}"), code).size(), code);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "any", "bigint", "boolean", "never", "null", "number", "object", "string", "symbol", "undefined",
            "unknown", "void"
    })
    void keywordTypesCanBeBanned(String keyword) throws IOException {
        BanTypesRule rule = rule("{\"extendDefaults\": false, \"types\": {\"" + keyword + "\": null}}");

        List<Violation> violations = TestUtils.lint(rule, "function foo(x: " + keyword + ") {}");

        assertEquals(1, violations.size(), keyword);
        assertEquals(keyword, violations.get(0).data.get("name"));
        assertEquals("", violations.get(0).data.get("custom_message"));
        assertEquals(17, violations.get(0).range.startColumn);
    }

    private static BanTypesRule rule(String options) throws IOException {
        if (options == null) return new BanTypesRule();
        return new BanTypesRule(MAPPER.readValue(options, BanTypesOptions.class));
    }
}
