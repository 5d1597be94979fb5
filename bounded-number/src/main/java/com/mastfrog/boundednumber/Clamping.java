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
package com.mastfrog.boundednumber;

/**
 * Saturating clamp operations used by generated bounded number classes.
 * None of these throw: a value below the minimum becomes the minimum, a value
 * above the maximum becomes the maximum, and NaN becomes the minimum. Results
 * are in bounds by the ordering of <code>Double.compare()</code> as well as
 * by <code>&lt;</code>, so a zero of the wrong sign never escapes a zero
 * bound.
 * <p>
 * Callers are responsible for passing <code>minimum &lt;= maximum</code>; the
 * annotation processor guarantees that for generated code.
 * </p>
 *
 * @author Tim Boudreau
 */
public final class Clamping {

    private Clamping() {
        throw new AssertionError();
    }

    /**
     * Clamp an int.
     *
     * @param value A value
     * @param minimum The minimum, inclusive
     * @param maximum The maximum, inclusive
     * @return The value, or the nearest bound
     */
    public static int clamp(int value, int minimum, int maximum) {
        return value < minimum ? minimum : value > maximum ? maximum : value;
    }

    /**
     * Clamp a long.
     *
     * @param value A value
     * @param minimum The minimum, inclusive
     * @param maximum The maximum, inclusive
     * @return The value, or the nearest bound
     */
    public static long clamp(long value, long minimum, long maximum) {
        return value < minimum ? minimum : value > maximum ? maximum : value;
    }

    /**
     * Clamp a float; NaN is clamped to the minimum, and a value numerically
     * equal to a bound becomes that bound, so -0.0 against a bound of 0.0
     * yields 0.0.
     *
     * @param value A value
     * @param minimum The minimum, inclusive
     * @param maximum The maximum, inclusive
     * @return The value, or the nearest bound
     */
    public static float clamp(float value, float minimum, float maximum) {
        if (value != value) {
            return minimum;
        }
        return value <= minimum ? minimum : value >= maximum ? maximum : value;
    }

    /**
     * Clamp a double; NaN is clamped to the minimum, and a value numerically
     * equal to a bound becomes that bound, so -0.0 against a bound of 0.0
     * yields 0.0.
     *
     * @param value A value
     * @param minimum The minimum, inclusive
     * @param maximum The maximum, inclusive
     * @return The value, or the nearest bound
     */
    public static double clamp(double value, double minimum, double maximum) {
        if (value != value) {
            return minimum;
        }
        return value <= minimum ? minimum : value >= maximum ? maximum : value;
    }

    /**
     * Clamp three longs, all of which are treated as unsigned 64-bit values.
     *
     * @param value A value
     * @param minimum The unsigned minimum, inclusive
     * @param maximum The unsigned maximum, inclusive
     * @return The value, or the nearest bound
     */
    public static long clampUnsigned(long value, long minimum, long maximum) {
        if (Long.compareUnsigned(value, minimum) < 0) {
            return minimum;
        }
        return Long.compareUnsigned(value, maximum) > 0 ? maximum : value;
    }

    /**
     * Convert a long, treated as an unsigned 64-bit value, to the nearest
     * double.
     *
     * @param value An unsigned value
     * @return A double
     */
    public static double unsignedToDouble(long value) {
        if (value >= 0) {
            return value;
        }
        // Halve, keeping the low bit sticky so the final rounding is correct
        return ((value >>> 1) | (value & 1)) * 2.0D;
    }

    /**
     * Convert a long, treated as an unsigned 64-bit value, to the nearest
     * float.
     *
     * @param value An unsigned value
     * @return A float
     */
    public static float unsignedToFloat(long value) {
        if (value >= 0) {
            return value;
        }
        return ((value >>> 1) | (value & 1)) * 2.0F;
    }
}
