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

import static com.mastfrog.boundednumber.processor.NumericCategory.FLOATING_POINT;
import static com.mastfrog.boundednumber.processor.NumericCategory.INTEGRAL;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.lang.model.type.TypeKind;

/**
 * The primitive numeric types a bounded number can be stored in or assigned
 * from, with their representable ranges expressed as BigDecimals so that
 * comparisons against bounds of any type are exact.
 * <p>
 * {@link #UNSIGNED_LONG} is an input-only type: a Java <code>long</code>
 * whose bits are read as an unsigned 64-bit value.
 * </p>
 *
 * @author Tim Boudreau
 */
public enum NumericType {
    BYTE("byte", "Byte", INTEGRAL, BigDecimal.valueOf(Byte.MIN_VALUE),
            BigDecimal.valueOf(Byte.MAX_VALUE)),
    SHORT("short", "Short", INTEGRAL, BigDecimal.valueOf(Short.MIN_VALUE),
            BigDecimal.valueOf(Short.MAX_VALUE)),
    INT("int", "Integer", INTEGRAL, BigDecimal.valueOf(Integer.MIN_VALUE),
            BigDecimal.valueOf(Integer.MAX_VALUE)),
    LONG("long", "Long", INTEGRAL, BigDecimal.valueOf(Long.MIN_VALUE),
            BigDecimal.valueOf(Long.MAX_VALUE)),
    UNSIGNED_LONG("long", "Long", INTEGRAL, BigDecimal.ZERO,
            new BigDecimal(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE))),
    FLOAT("float", "Float", FLOATING_POINT, new BigDecimal(-Float.MAX_VALUE),
            new BigDecimal(Float.MAX_VALUE)),
    DOUBLE("double", "Double", FLOATING_POINT, new BigDecimal(-Double.MAX_VALUE),
            new BigDecimal(Double.MAX_VALUE));

    private final String javaName;
    private final String boxedName;
    private final NumericCategory category;
    private final BigDecimal lowest;
    private final BigDecimal highest;

    NumericType(String javaName, String boxedName, NumericCategory category,
            BigDecimal lowest, BigDecimal highest) {
        this.javaName = javaName;
        this.boxedName = boxedName;
        this.category = category;
        this.lowest = lowest;
        this.highest = highest;
    }

    /**
     * The Java keyword for the primitive type.
     *
     * @return A type name
     */
    public String javaName() {
        return javaName;
    }

    public String boxedName() {
        return boxedName;
    }

    public NumericCategory category() {
        return category;
    }

    public boolean isIntegral() {
        return category == INTEGRAL;
    }

    public boolean isFloatingPoint() {
        return category == FLOATING_POINT;
    }

    /**
     * The most negative finite value of this type.
     *
     * @return The lowest value
     */
    public BigDecimal lowest() {
        return lowest;
    }

    /**
     * The largest finite value of this type.
     *
     * @return The highest value
     */
    public BigDecimal highest() {
        return highest;
    }

    /**
     * Whether values of this type can be used as the storage of a bounded
     * number.
     *
     * @return true for everything but UNSIGNED_LONG
     */
    public boolean isStorable() {
        return this != UNSIGNED_LONG;
    }

    /**
     * Determine if both types are integral or both are floating point.
     *
     * @param other Another type
     * @return true if they are in the same category
     */
    public boolean sameCategory(NumericType other) {
        return category == other.category;
    }

    /**
     * Determine whether a bounded number stored as this type may be assigned
     * from values of the passed type: any type of the same category, or any
     * integral type if this type is floating point. Floating point values are
     * never accepted into integral storage, since that would silently drop
     * their fractional part.
     *
     * @param input The type of the value being assigned
     * @return true if it is accepted
     */
    public boolean accepts(NumericType input) {
        return sameCategory(input) || (isFloatingPoint() && input.isIntegral());
    }

    /**
     * The storable types values of this type may be assigned from, in
     * declaration order.
     *
     * @return A list of types
     */
    public List<NumericType> acceptedInputs() {
        List<NumericType> result = new ArrayList<>();
        for (NumericType t : values()) {
            if (t.isStorable() && accepts(t)) {
                result.add(t);
            }
        }
        return result;
    }

    public boolean inRange(BigDecimal value) {
        return lowest.compareTo(value) <= 0 && highest.compareTo(value) >= 0;
    }

    /**
     * Strict representability: the value converts to this type and back with
     * no change at all.
     *
     * @param value A value
     * @return true if it is exactly representable
     */
    public boolean represents(BigDecimal value) {
        if (!inRange(value)) {
            return false;
        }
        switch (this) {
            case FLOAT:
                return new BigDecimal(value.floatValue()).compareTo(value) == 0;
            case DOUBLE:
                return new BigDecimal(value.doubleValue()).compareTo(value) == 0;
            default:
                return isWholeNumber(value);
        }
    }

    /**
     * Whether this type can represent both values exactly, so a value of this
     * type can be clamped against them without first being converted to some
     * other type.
     *
     * @param minimum The lower bound
     * @param maximum The upper bound
     * @return true if both are exactly representable
     */
    public boolean representsBounds(BigDecimal minimum, BigDecimal maximum) {
        return represents(minimum) && represents(maximum);
    }

    /**
     * Whether a bound written in source as a whole-number literal can be held
     * by this type: it must be within range and must convert exactly.
     *
     * @param bound A bound
     * @return true if the bound is usable with this type
     */
    public boolean canHold(BigDecimal bound) {
        return canHold(bound, false);
    }

    /**
     * Whether a bound written in source can be held by this type. It must be
     * within range and must be a whole number for integral types. A bound
     * written as a floating point literal takes the nearest value of a
     * floating point type, as the same Java literal would; anything else must
     * convert exactly.
     *
     * @param bound A bound
     * @param floatingPointLiteral Whether the bound was written with a
     * decimal point, exponent or F/D suffix
     * @return true if the bound is usable with this type
     */
    public boolean canHold(BigDecimal bound, boolean floatingPointLiteral) {
        if (!inRange(bound)) {
            return false;
        }
        if (isFloatingPoint() && floatingPointLiteral) {
            return true;
        }
        return represents(bound);
    }

    /**
     * Whether this type can store a value bounded by the passed minimum and
     * maximum, both written as whole-number literals: both must be holdable
     * by this type, and the minimum must not exceed the maximum. Equal bounds
     * are legal.
     *
     * @param minimum The lower bound
     * @param maximum The upper bound
     * @return true if a bounded number over these bounds can be stored in
     * this type
     */
    public boolean canRepresentBounds(BigDecimal minimum, BigDecimal maximum) {
        return isStorable() && canHold(minimum) && canHold(maximum)
                && minimum.compareTo(maximum) <= 0;
    }

    boolean canRepresentBounds(BoundLiteral minimum, BoundLiteral maximum) {
        return isStorable()
                && canHold(minimum.value(), minimum.isFloatingPoint())
                && canHold(maximum.value(), maximum.isFloatingPoint())
                && minimum.value().compareTo(maximum.value()) <= 0;
    }

    /**
     * Convert a bound which {@link #canHold(BigDecimal, boolean)} accepts to the exact
     * value it will have once stored in this type.
     *
     * @param bound A bound
     * @return The stored value
     */
    public BigDecimal round(BigDecimal bound) {
        switch (this) {
            case FLOAT:
                return new BigDecimal(bound.floatValue());
            case DOUBLE:
                return new BigDecimal(bound.doubleValue());
            default:
                return bound;
        }
    }

    /**
     * The primitive type in which <code>Clamping.clamp()</code> operates on
     * values of this type, since Java promotes byte and short arithmetic to
     * int.
     *
     * @return A primitive type name
     */
    public String clampDomain() {
        switch (this) {
            case BYTE:
            case SHORT:
            case INT:
                return "int";
            case UNSIGNED_LONG:
                return "long";
            default:
                return javaName;
        }
    }

    /**
     * Format a stored value as a Java expression of this type, suitable for
     * initializing a constant.
     *
     * @param stored A value as returned by round()
     * @return A source expression
     */
    public String sourceLiteral(BigDecimal stored) {
        switch (this) {
            case BYTE:
            case SHORT:
                return "(" + javaName + ") " + stored.toBigIntegerExact();
            case INT:
                return stored.toBigIntegerExact().toString();
            case LONG:
            case UNSIGNED_LONG:
                return stored.toBigIntegerExact() + "L";
            case FLOAT:
                return Float.toString(stored.floatValue()) + "F";
            case DOUBLE:
                return Double.toString(stored.doubleValue());
            default:
                throw new AssertionError(this);
        }
    }

    /**
     * Format a stored value the way string concatenation of the primitive
     * would render it at runtime.
     *
     * @param stored A value as returned by round()
     * @return A string
     */
    public String display(BigDecimal stored) {
        switch (this) {
            case FLOAT:
                return Float.toString(stored.floatValue());
            case DOUBLE:
                return Double.toString(stored.doubleValue());
            default:
                return stored.toBigIntegerExact().toString();
        }
    }

    /**
     * Whether a value of the passed primitive type can be assigned to this
     * one without a cast.
     *
     * @param primitive A primitive type name as returned by clampDomain()
     * @return true if the assignment is a widening or identity conversion
     */
    public boolean isAssignableFrom(String primitive) {
        if (javaName.equals(primitive)) {
            return true;
        }
        switch (primitive) {
            case "int":
                return this == LONG || this == FLOAT || this == DOUBLE;
            case "long":
                return this == FLOAT || this == DOUBLE;
            case "float":
                return this == DOUBLE;
            default:
                return false;
        }
    }

    /**
     * Find the storable type for a TypeKind.
     *
     * @param kind A kind
     * @return A type, if the kind is a numeric primitive other than char
     */
    public static Optional<NumericType> forKind(TypeKind kind) {
        switch (kind) {
            case BYTE:
                return Optional.of(BYTE);
            case SHORT:
                return Optional.of(SHORT);
            case INT:
                return Optional.of(INT);
            case LONG:
                return Optional.of(LONG);
            case FLOAT:
                return Optional.of(FLOAT);
            case DOUBLE:
                return Optional.of(DOUBLE);
            default:
                return Optional.empty();
        }
    }

    static boolean isWholeNumber(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    @Override
    public String toString() {
        return this == UNSIGNED_LONG ? "unsigned long" : javaName;
    }
}
