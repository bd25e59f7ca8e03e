package org.dxworks.codelint.linter;

import org.treesitter.TSNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Static values of member and property keys, as JavaScript would turn them into property names.
 */
public class PropertyNames {

    private PropertyNames() {
    }

    /**
     * The key a member name resolves to without running code, or {@code null} for private names and
     * computed keys that are not literals.
     */
    public static String staticName(TSNode nameNode, byte[] source) {
        if (TreeSitterHelper.isNull(nameNode)) return null;
        String text = TreeSitterHelper.getNodeText(source, nameNode);
        switch (nameNode.getType()) {
            case "property_identifier":
            case "identifier":
                return text;
            case "string":
                return unquote(text);
            case "number":
                return numericKey(text);
            case "computed_property_name": {
                TSNode inner = TreeSitterHelper.getFirstNamedChild(nameNode);
                if (inner == null) return null;
                String innerText = TreeSitterHelper.getNodeText(source, inner);
                switch (inner.getType()) {
                    case "string":
                        return unquote(innerText);
                    case "number":
                        return numericKey(innerText);
                    case "template_string":
                        return TreeSitterHelper.findFirstChild(inner, "template_substitution") == null
                                ? unquote(innerText) : null;
                    default:
                        return null;
                }
            }
            default:
                return null;
        }
    }

    public static String unquote(String literal) {
        return literal.length() >= 2 ? literal.substring(1, literal.length() - 1) : literal;
    }

    /**
     * Property key of a numeric literal, so {@code 1}, {@code 1.0} and {@code 0x1} all name member "1".
     */
    public static String numericKey(String literal) {
        String digits = literal.replace("_", "").toLowerCase(Locale.ROOT);
        if (digits.endsWith("n")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        double value;
        try {
            if (digits.startsWith("0x")) {
                value = new BigInteger(digits.substring(2), 16).doubleValue();
            } else if (digits.startsWith("0o")) {
                value = new BigInteger(digits.substring(2), 8).doubleValue();
            } else if (digits.startsWith("0b")) {
                value = new BigInteger(digits.substring(2), 2).doubleValue();
            } else if (digits.length() > 1 && digits.startsWith("0") && digits.chars().allMatch(c -> c >= '0' && c <= '7')) {
                // legacy octal
                value = new BigInteger(digits.substring(1), 8).doubleValue();
            } else {
                value = Double.parseDouble(digits);
            }
        } catch (NumberFormatException e) {
            return literal;
        }
        return formatNumber(value);
    }

    private static String formatNumber(double value) {
        if (Double.isInfinite(value)) return "Infinity";
        if (value == 0) return "0";
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String significand = decimal.unscaledValue().toString();
        int k = significand.length();
        int n = k - decimal.scale();
        if (k <= n && n <= 21) {
            return significand + "0".repeat(n - k);
        }
        if (0 < n && n <= 21) {
            return significand.substring(0, n) + "." + significand.substring(n);
        }
        if (-6 < n && n <= 0) {
            return "0." + "0".repeat(-n) + significand;
        }
        String exponent = (n - 1 >= 0 ? "+" : "-") + Math.abs(n - 1);
        if (k == 1) return significand + "e" + exponent;
        return significand.charAt(0) + "." + significand.substring(1) + "e" + exponent;
    }
}
