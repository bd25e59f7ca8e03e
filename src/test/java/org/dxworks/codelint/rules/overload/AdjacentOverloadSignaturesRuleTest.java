package org.dxworks.codelint.rules.overload;

import org.dxworks.codelint.TestUtils;
import org.dxworks.codelint.model.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdjacentOverloadSignaturesRuleTest {

    private final AdjacentOverloadSignaturesRule rule = new AdjacentOverloadSignaturesRule();

    static Stream<String> validCode() {
        return Stream.of(
                lines("function error(a: string);",
                        "function error(b: number);",
                        "function error(ab: string | number) {}",
                        "export { error };"),
                lines("export const foo = 'a', bar = 'b';",
                        "export interface Foo {}",
                        "export class Foo {}"),
                lines("export function foo(s: string);",
                        "export function foo(n: number);",
                        "export function foo(sn: string | number) {}",
                        "export function bar(): void {}",
                        "export function baz(): void {}"),
                lines("declare function foo(s: string);",
                        "declare function foo(n: number);",
                        "declare function foo(sn: string | number);",
                        "declare function bar(): void;"),
                lines("declare module 'Foo' {",
                        "  export function foo(s: string): void;",
                        "  export function foo(n: number): void;",
                        "  export function foo(sn: string | number): void;",
                        "  export function bar(): void;",
                        "}"),
                lines("declare namespace Foo {",
                        "  export function foo(s: string): void;",
                        "  export function foo(n: number): void;",
                        "  export function bar(): void;",
                        "}"),
                lines("type Foo = {",
                        "  foo(s: string): void;",
                        "  foo(n: number): void;",
                        "  bar(): void;",
                        "};"),
                lines("type Foo = {",
                        "  foo(s: string): void;",
                        "  ['foo'](n: number): void;",
                        "  foo(sn: string | number): void;",
                        "  bar(): void;",
                        "};"),
                lines("interface Foo {",
                        "  (s: string): void;",
                        "  (n: number): void;",
                        "  foo(n: number): void;",
                        "  bar(): void;",
                        "  call(): void;",
                        "}"),
                lines("interface Foo {",
                        "  foo(): void;",
                        "  bar: {",
                        "    baz(s: string): void;",
                        "    baz(n: number): void;",
                        "    baz(sn: string | number): void;",
                        "  };",
                        "}"),
                lines("interface Foo {",
                        "  new (s: string);",
                        "  new (n: number);",
                        "  foo(): void;",
                        "}"),
                lines("class Foo {",
                        "  constructor(s: string);",
                        "  constructor(n: number);",
                        "  constructor(sn: string | number) {}",
                        "  bar(): void {}",
                        "}"),
                lines("class Foo {",
                        "  foo(s: string): void;",
                        "  // implementation",
                        "  foo(sn: string | number): void {}",
                        "  bar(): void {}",
                        "}"),
                lines("class Test {",
                        "  static test() {}",
                        "  untest() {}",
                        "  test() {}",
                        "}"),
                "export default function <T>(foo: T) {}",
                "export default function named<T>(foo: T) {}",
                lines("interface Foo {",
                        "  [Symbol.toStringTag](): void;",
                        "  [Symbol.iterator](): void;",
                        "}"),
                lines("class Test {",
                        "  #private(): void;",
                        "  #private(arg: number): void {}",
                        "  bar() {}",
                        "  '#private'(): void;",
                        "  '#private'(arg: number): void {}",
                        "}"),
                lines("function wrap() {",
                        "  function foo(s: string);",
                        "  function foo(n: number);",
                        "  function foo(sn: string | number) {}",
                        "}"),
                lines("function foo(s: string);",
                        "function foo(n: number);",
                        "function foo(sn: string | number) {}",
                        "function wrap() {",
                        "  function foo(): void {}",
                        "}")
        );
    }

    @ParameterizedTest
    @MethodSource("validCode")
    void validCodeHasNoViolations(String code) {
        assertTrue(TestUtils.lint(rule, code).isEmpty(), code);
    }

    @Test
    void interleavedFunctionIsReportedAtTheLateOverload() {
        String code = lines(
                "function foo(s: string);",
                "function foo(n: number);",
                "function bar(): void {}",
                "function foo(sn: string | number) {}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertEquals("adjacent_signature", violation.messageId);
        assertEquals("All foo signatures should be adjacent.", violation.message);
        assertEquals("foo", violation.data.get("name"));
        assertEquals(4, violation.range.startLine);
        assertEquals(1, violation.range.startColumn);
        assertNull(violation.fix);
    }

    @Test
    void typeAliasBreaksRunInsideBlock() {
        String code = lines(
                "function wrap() {",
                "  function foo(s: string);",
                "  function foo(n: number);",
                "  type bar = number;",
                "  function foo(sn: string | number) {}",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals(5, violations.get(0).range.startLine);
        assertEquals(3, violations.get(0).range.startColumn);
    }

    @Test
    void exportedOverloadsAreReportedAtTheExportStatement() {
        String code = lines(
                "export function foo(s: string);",
                "export function foo(n: number);",
                "export type bar = number;",
                "export function foo(sn: string | number) {}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals(4, violations.get(0).range.startLine);
        assertEquals(1, violations.get(0).range.startColumn);
        assertEquals(0, violations.get(0).range.startByte - code.lastIndexOf("export"));
    }

    @Test
    void ambientModuleMembersAreScopedToTheModule() {
        String code = lines(
                "declare module 'Foo' {",
                "  export function foo(s: string): void;",
                "  export function foo(n: number): void;",
                "  export function foo(sn: string | number): void;",
                "  function baz(s: string): void;",
                "  export function bar(): void;",
                "  function baz(n: number): void;",
                "  function baz(sn: string | number): void;",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals("All baz signatures should be adjacent.", violations.get(0).message);
        assertEquals(7, violations.get(0).range.startLine);
        assertEquals(3, violations.get(0).range.startColumn);
    }

    @Test
    void classMembersAreCheckedSeparatelyFromTopLevelFunctions() {
        String code = lines(
                "function foo(s: string) {}",
                "function foo(n: number) {}",
                "class Bar {",
                "  foo(s: string);",
                "  foo(n: number);",
                "  name: string;",
                "  foo(sn: string | number) {}",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals(7, violations.get(0).range.startLine);
        assertEquals(3, violations.get(0).range.startColumn);
    }

    @Test
    void staticMemberIsNamedWithItsModifier() {
        String code = lines(
                "class Foo {",
                "  static foo(s: string): void;",
                "  bar(): void {}",
                "  static foo(sn: string | number): void {}",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals("static foo", violations.get(0).data.get("name"));
    }

    @Test
    void callAndConstructSignaturesInInterfaces() {
        String code = lines(
                "interface Foo {",
                "  (s: string): void;",
                "  foo(n: number): void;",
                "  (sn: string | number): void;",
                "  new (s: string);",
                "  bar(): void;",
                "  new (n: number);",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(2, violations.size());
        assertEquals("All call signatures should be adjacent.", violations.get(0).message);
        assertEquals(4, violations.get(0).range.startLine);
        assertEquals("All new signatures should be adjacent.", violations.get(1).message);
        assertEquals(7, violations.get(1).range.startLine);
    }

    @Test
    void quotedAndComputedNamesMatchPlainNames() {
        String code = lines(
                "type Foo = {",
                "  foo(s: string): void;",
                "  bar(): void;",
                "  'foo'(n: number): void;",
                "  'a-b'(): void;",
                "  baz(): void;",
                "  ['a-b'](x: number): void;",
                "};");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(2, violations.size());
        assertEquals("foo", violations.get(0).data.get("name"));
        assertEquals("\"a-b\"", violations.get(1).data.get("name"));
    }

    @Test
    void declarationsOnOneLineAreScannedPastTheFirstStatement() {
        String code = "function foo(s);function foo(n);function bar(){}function foo(sn){}";

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals("foo", violations.get(0).data.get("name"));
        assertEquals(code.lastIndexOf("function foo"), violations.get(0).range.startByte);
    }

    @Test
    void numericNamesMatchByValue() {
        String code = "class A { 1(): void; bar() {} 1.0(): void {} }";

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals("\"1\"", violations.get(0).data.get("name"));
    }

    @Test
    void hexAndQuotedNumericNamesMatchDecimal() {
        String code = lines(
                "class A {",
                "  16(): void;",
                "  bar() {}",
                "  0x10(): void {}",
                "  baz() {}",
                "  ['16'](): void {}",
                "}");

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(2, violations.size());
        assertEquals(4, violations.get(0).range.startLine);
        assertEquals(6, violations.get(1).range.startLine);
    }

    @Test
    void quotedNonAsciiIdentifierMatchesPlainName() {
        String code = "class A { ñ(): void; bar() {} 'ñ'(): void {} }";

        List<Violation> violations = TestUtils.lint(rule, code);

        assertEquals(1, violations.size());
        assertEquals("ñ", violations.get(0).data.get("name"));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }
}
