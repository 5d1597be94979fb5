/*
 * The MIT License
 *
 * Copyright 2022 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.boundednumber.processor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;

/**
 * A bound of a BoundedNumber annotation, which is written as a Java numeric
 * literal, parsed into an exact BigDecimal. Whether it was written as a
 * floating point literal matters: a floating point bound may be rounded to
 * the nearest value of a floating point storage type, as the same literal
 * would be in source, but a whole-number literal must convert exactly.
 *
 * @author Tim Boudreau
 */
final class BoundLiteral {

    private static final Map<String, BigDecimal> CONSTANTS = new TreeMap<>();

    static {
        CONSTANTS.put("Byte.MIN_VALUE", BigDecimal.valueOf(Byte.MIN_VALUE));
        CONSTANTS.put("Byte.MAX_VALUE", BigDecimal.valueOf(Byte.MAX_VALUE));
        CONSTANTS.put("Short.MIN_VALUE", BigDecimal.valueOf(Short.MIN_VALUE));
        CONSTANTS.put("Short.MAX_VALUE", BigDecimal.valueOf(Short.MAX_VALUE));
        CONSTANTS.put("Integer.MIN_VALUE", BigDecimal.valueOf(Integer.MIN_VALUE));
        CONSTANTS.put("Integer.MAX_VALUE", BigDecimal.valueOf(Integer.MAX_VALUE));
        CONSTANTS.put("Long.MIN_VALUE", BigDecimal.valueOf(Long.MIN_VALUE));
        CONSTANTS.put("Long.MAX_VALUE", BigDecimal.valueOf(Long.MAX_VALUE));
        CONSTANTS.put("Float.MAX_VALUE", new BigDecimal(Float.MAX_VALUE));
        CONSTANTS.put("Double.MAX_VALUE", new BigDecimal(Double.MAX_VALUE));
    }

    private final String text;
    private final BigDecimal value;
    private final boolean floatingPoint;

    BoundLiteral(String text, BigDecimal value, boolean floatingPoint) {
        this.text = text;
        this.value = value;
        this.floatingPoint = floatingPoint;
    }

    String text() {
        return text;
    }

    BigDecimal value() {
        return value;
    }

    boolean isFloatingPoint() {
        return floatingPoint;
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Parse a bound.
     *
     * @param text The text of the annotation attribute
     * @return A bound
     * @throws NumberFormatException if the text is not a finite numeric
     * literal or a supported constant
     */
    static BoundLiteral parse(String text) {
        if (text == null) {
            throw new NumberFormatException("Bound is null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new NumberFormatException("Bound is empty");
        }
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            s = s.substring(1).trim();
        }
        BigDecimal magnitude = parseUnsigned(s, text);
        return new BoundLiteral(text.trim(), negative ? magnitude.negate() : magnitude,
                isFloatingPointSyntax(s));
    }

    private static boolean isFloatingPointSyntax(String s) {
        String lower = s.toLowerCase();
        if (lower.startsWith("java.lang.")) {
            lower = lower.substring(10);
        }
        if (lower.startsWith("float.") || lower.startsWith("double.")) {
            return true;
        }
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return false;
        }
        if (!isDigit(lower.charAt(0)) && lower.charAt(0) != '.') {
            // Integer.MAX_VALUE and friends
            return false;
        }
        return lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0
                || lower.endsWith("f") || lower.endsWith("d");
    }

    private static BigDecimal parseUnsigned(String s, String original) {
        if (s.isEmpty()) {
            throw new NumberFormatException("No digits in '" + original + "'");
        }
        String constantName = s.startsWith("java.lang.") ? s.substring(10) : s;
        BigDecimal constant = CONSTANTS.get(constantName);
        if (constant != null) {
            return constant;
        }
        if (constantName.equals("Float.MIN_VALUE") || constantName.equals("Double.MIN_VALUE")) {
            throw new NumberFormatException(constantName + " is the smallest positive "
                    + "value, not the most negative one; write the bound out instead");
        }
        if (!isDigit(s.charAt(0)) && s.charAt(0) != '.') {
            throw new NumberFormatException("Not a numeric literal: '" + original + "'");
        }
        if (s.startsWith("_") || s.endsWith("_") || s.contains("_.") || s.contains("._")) {
            throw new NumberFormatException("Misplaced underscore in '" + original + "'");
        }
        s = s.replace("_", "");
        String lower = s.toLowerCase();
        if (lower.startsWith("0x")) {
            return new BigDecimal(parseRadix(stripLongSuffix(s.substring(2)), 16, original));
        }
        if (lower.startsWith("0b")) {
            return new BigDecimal(parseRadix(stripLongSuffix(s.substring(2)), 2, original));
        }
        char last = lower.charAt(lower.length() - 1);
        boolean decimal = lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0;
        if (last == 'l') {
            if (decimal) {
                throw new NumberFormatException("L suffix on a decimal number: '" + original + "'");
            }
            return new BigDecimal(parseWhole(s.substring(0, s.length() - 1), original));
        }
        if (last == 'f') {
            float f = parseFloatingPoint(s.substring(0, s.length() - 1), original).floatValue();
            if (Float.isInfinite(f)) {
                throw new NumberFormatException("Out of range for float: '" + original + "'");
            }
            return new BigDecimal(f);
        }
        if (last == 'd') {
            return parseFloatingPoint(s.substring(0, s.length() - 1), original);
        }
        if (decimal) {
            return parseFloatingPoint(s, original);
        }
        return new BigDecimal(parseWhole(s, original));
    }

    private static String stripLongSuffix(String digits) {
        if (digits.endsWith("l") || digits.endsWith("L")) {
            return digits.substring(0, digits.length() - 1);
        }
        return digits;
    }

    private static BigInteger parseRadix(String digits, int radix, String original) {
        if (digits.isEmpty()) {
            throw new NumberFormatException("No digits in '" + original + "'");
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = Character.toLowerCase(digits.charAt(i));
            boolean legal = radix == 16 ? isDigit(c) || (c >= 'a' && c <= 'f') : c == '0' || c == '1';
            if (!legal) {
                throw new NumberFormatException("Bad base-" + radix + " literal '" + original + "'");
            }
        }
        try {
            return new BigInteger(digits, radix);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Bad base-" + radix + " literal '" + original + "'");
        }
    }

    private static BigInteger parseWhole(String digits, String original) {
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new NumberFormatException("Octal literals are not supported: '" + original + "'");
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isDigit(digits.charAt(i))) {
                throw new NumberFormatException("Not a numeric literal: '" + original + "'");
            }
        }
        return new BigInteger(digits);
    }

    private static BigDecimal parseFloatingPoint(String digits, String original) {
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (!isDigit(c) && c != '.' && c != 'e' && c != 'E' && c != '-' && c != '+') {
                throw new NumberFormatException("Not a numeric literal: '" + original + "'");
            }
        }
        try {
            return new BigDecimal(digits);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Not a numeric literal: '" + original + "'");
        }
    }

    // Character.isDigit() also accepts non-ASCII digits, which Java literals cannot contain
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
