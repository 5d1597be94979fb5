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

import static java.lang.annotation.ElementType.TYPE;
import java.lang.annotation.Retention;
import static java.lang.annotation.RetentionPolicy.CLASS;
import java.lang.annotation.Target;

/**
 * Annotation which can be applied to an interface with a single abstract,
 * no-argument method returning a primitive number, which will generate a final
 * class named <code>Bounded</code> + the interface name, in the same package,
 * implementing that interface over a single field of that primitive type whose
 * value is always clamped into the inclusive range
 * <code>[minimum, maximum]</code>.
 * <p>
 * The bounds are checked by the annotation processor when the interface is
 * compiled: if the storage type cannot represent them, or the minimum is
 * greater than the maximum, compilation fails. The generated class only has
 * constructors and <code>set</code> methods for argument types that can be
 * folded into the storage type without silently truncating a fraction
 * (integral storage accepts only integral arguments, floating point storage
 * accepts both), so passing, say, a <code>double</code> to an
 * <code>int</code>-backed type is a compile error rather than a runtime one.
 * </p>
 * <p>
 * Values outside the bounds are never rejected at runtime; they are saturated
 * to the nearest bound. For example:
 * </p>
 * <pre>
 * &#064;BoundedNumber(minimum = "-100", maximum = "0")
 * public interface Decibels {
 *     double decibels();
 * }
 * ...
 * BoundedDecibels db = new BoundedDecibels(12.5); // db.decibels() == 0.0
 * </pre>
 *
 * @author Tim Boudreau
 */
@Target(TYPE)
@Retention(CLASS)
public @interface BoundedNumber {

    /**
     * The minimum value, inclusive, as a Java numeric literal (e.g.
     * <code>"-100"</code>, <code>"0.5"</code>, <code>"1_000L"</code>,
     * <code>"0x7F"</code>) or one of the <code>MIN_VALUE</code> /
     * <code>MAX_VALUE</code> constants of <code>Byte</code>,
     * <code>Short</code>, <code>Integer</code> or <code>Long</code>, or
     * <code>Float.MAX_VALUE</code> / <code>Double.MAX_VALUE</code>.
     * A whole-number bound must be exactly representable by the storage type;
     * a floating point literal such as <code>"0.1"</code> or
     * <code>"1e300"</code> takes the nearest <code>float</code> or
     * <code>double</code>, as it would in source.
     *
     * @return A minimum
     */
    String minimum();

    /**
     * The maximum value, inclusive, in the same syntax as
     * <code>minimum()</code>.
     *
     * @return The maximum value
     */
    String maximum();

    /**
     * If non-empty, the name of a static factory method to generate which
     * takes a whole-number literal and interprets it as an unsigned 64-bit
     * value, e.g. <code>BoundedDecibelLevel.dbn(10)</code>. Since the method
     * only takes <code>long</code>, fractional arguments do not compile.
     *
     * @return A method name, or the empty string
     */
    String literal() default "";
}
