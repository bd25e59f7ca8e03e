package org.dxworks.codelint.linter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PropertyNamesTest {

    @ParameterizedTest
    @CsvSource({
            "1, 1",
            "1.0, 1",
            "0x1, 1",
            "0b101, 5",
            "0o17, 15",
            "017, 15",
            "1_000, 1000",
            "1e21, 1e+21",
            "1.5e-7, 1.5e-7",
            "0.000001, 0.000001",
            "0.5, 0.5",
            "10n, 10"
    })
    void numericLiteralsBecomeTheirPropertyKey(String literal, String expected) {
        assertEquals(expected, PropertyNames.numericKey(literal));
    }

    @Test
    void memberNamesResolveToStaticValues() {
        String source = "class A { foo(){} 'bar'(){} 123(){} [`baz`](){} [a](){} #qux(){} [`x${y}`](){} }";
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterTypescript());
        TSTree tree = parser.parseString(null, source);
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);

        List<String> names = new ArrayList<>();
        for (TSNode method : TreeSitterHelper.findAllDescendantsOfTypes(tree.getRootNode(), "method_definition")) {
            names.add(PropertyNames.staticName(TreeSitterHelper.getChildByFieldName(method, "name"), bytes));
        }

        assertEquals("foo", names.get(0));
        assertEquals("bar", names.get(1));
        assertEquals("123", names.get(2));
        assertEquals("baz", names.get(3));
        assertNull(names.get(4));
        assertNull(names.get(5));
        assertNull(names.get(6));
    }
}
