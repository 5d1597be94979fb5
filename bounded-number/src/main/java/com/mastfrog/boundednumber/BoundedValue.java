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
 * Common interface of all classes generated from interfaces annotated with
 * {@link BoundedNumber}, for code that wants to deal with bounded values
 * generically.
 *
 * @param <N> The boxed type of the storage primitive
 * @author Tim Boudreau
 */
public interface BoundedValue<N extends Number> {

    /**
     * The current value, boxed.
     *
     * @return The value, which is always between minimum() and maximum()
     * inclusive
     */
    N number();

    /**
     * The inclusive lower bound of this type.
     *
     * @return The minimum
     */
    N minimum();

    /**
     * The inclusive upper bound of this type.
     *
     * @return The maximum
     */
    N maximum();

    /**
     * The primitive type used to store the value, e.g.
     * <code>int.class</code>.
     *
     * @return A primitive type
     */
    Class<?> storageType();

    /**
     * Determine if the value is exactly the minimum.
     *
     * @return true if number() equals minimum()
     */
    default boolean isAtMinimum() {
        return number().equals(minimum());
    }

    /**
     * Determine if the value is exactly the maximum.
     *
     * @return true if number() equals maximum()
     */
    default boolean isAtMaximum() {
        return number().equals(maximum());
    }
}
