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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

/**
 * Exercises each way a generated class can order clamping and conversion,
 * with inputs chosen so that getting the order wrong produces a visibly
 * wrong answer.
 */
public class ClampOrderTest {

    @Test
    public void testNarrowIntegralStorage() {
        // (byte) 266 == 10
        assertEquals((byte) 90, new BoundedTilt(266L).degrees());
        assertEquals((byte) 90, new BoundedTilt(266).degrees());
        assertEquals((byte) -90, new BoundedTilt(-266).degrees());
        assertEquals((byte) 90, new BoundedTilt(Long.MAX_VALUE).degrees());
        assertEquals((byte) -90, new BoundedTilt(Integer.MIN_VALUE).degrees());
        assertEquals((byte) -90, new BoundedTilt((byte) -128).degrees());
        assertEquals((byte) 45, new BoundedTilt((short) 45).degrees());
        assertEquals((byte) 90, BoundedTilt.ofUnsigned(-1L).degrees());
        assertEquals((byte) 5, BoundedTilt.ofUnsigned(5).degrees());

        // (short) 65586 == 50
        assertEquals((short) 100, new BoundedPercentage(65_536 + 50).percent());
        assertEquals((short) 0, new BoundedPercentage((short) -1).percent());
        assertEquals((short) 100, BoundedPercentage.ofUnsigned(-1L).percent());
        assertEquals((short) 100, BoundedPercentage.ofUnsigned(1L << 48).percent());
    }

    @Test
    public void testBoundsAtTypeLimits() {
        assertEquals(Byte.MAX_VALUE, new BoundedFullByte(300).octet());
        assertEquals(Byte.MIN_VALUE, new BoundedFullByte(-300).octet());
        assertEquals((byte) 12, new BoundedFullByte((byte) 12).octet());
        assertEquals(Byte.MAX_VALUE, BoundedFullByte.ofUnsigned(-1L).octet());
        assertEquals(Byte.MAX_VALUE, BoundedFullByte.ofUnsigned(200).octet());

        assertEquals(Long.MIN_VALUE, new BoundedFullLong(Long.MIN_VALUE).get());
        assertEquals(Long.MAX_VALUE, new BoundedFullLong(Long.MAX_VALUE).get());
        assertEquals(-5L, new BoundedFullLong(-5).get());
        assertEquals(Long.MAX_VALUE, BoundedFullLong.ofUnsigned(-1L).get());
        assertEquals(Long.MAX_VALUE, BoundedFullLong.ofUnsigned(Long.MIN_VALUE).get());
        assertEquals(Long.MAX_VALUE, BoundedFullLong.ofUnsigned(Long.MAX_VALUE).get());
    }

    @Test
    public void testBoundsWiderThanTheInput() {
        assertEquals(10_000_000_000L, BoundedEpochSeconds.MAXIMUM);
        assertEquals(0L, new BoundedEpochSeconds(-5).seconds());
        assertEquals(Integer.MAX_VALUE, new BoundedEpochSeconds(Integer.MAX_VALUE).seconds());
        assertEquals(10_000_000_000L, new BoundedEpochSeconds(20_000_000_000L).seconds());
        assertEquals(9_999_999_999L, new BoundedEpochSeconds(9_999_999_999L).seconds());
        assertEquals(10_000_000_000L, BoundedEpochSeconds.ofUnsigned(-1L).seconds());
        assertEquals(0L, new BoundedEpochSeconds((short) -1).seconds());
    }

    @Test
    public void testUnsignedInputWithNegativeMinimum() {
        assertEquals(5, BoundedOffset.ofUnsigned(-1L).offset());
        assertEquals(5, BoundedOffset.ofUnsigned(Long.MIN_VALUE).offset());
        assertEquals(3, BoundedOffset.ofUnsigned(3).offset());
        assertEquals(0, BoundedOffset.ofUnsigned(0).offset());
        assertEquals(-5, new BoundedOffset(Long.MIN_VALUE).offset());
        assertEquals(5, new BoundedOffset((1L << 32) + 1).offset());
        assertEquals(-2, new BoundedOffset(-2L).offset());
    }

    @Test
    public void testSingleValuedRange() {
        assertEquals(7, new BoundedLucky(0).number7());
        assertEquals(7, new BoundedLucky(Long.MIN_VALUE).number7());
        assertEquals(7, new BoundedLucky(Integer.MAX_VALUE).number7());
        assertEquals(7, BoundedLucky.ofUnsigned(-1L).number7());
        assertEquals(7, new BoundedLucky(7).number7());
        BoundedLucky lucky = new BoundedLucky(1);
        assertTrue(lucky.isAtMinimum());
        assertTrue(lucky.isAtMaximum());
    }

    @Test
    public void testFloatStorage() {
        assertEquals(0.5F, new BoundedRatio(0.5).ratio());
        assertEquals(1F, new BoundedRatio(1e300).ratio());
        assertEquals(0F, new BoundedRatio(-1e300).ratio());
        assertEquals(1F, new BoundedRatio(1.00000001).ratio());
        assertEquals(0F, new BoundedRatio(Double.NaN).ratio());
        assertEquals(0F, new BoundedRatio(Float.NaN).ratio());
        assertEquals(1F, new BoundedRatio(Long.MAX_VALUE).ratio());
        assertEquals(0F, new BoundedRatio(-1).ratio());
        assertEquals(1F, BoundedRatio.ofUnsigned(-1L).ratio());
        assertEquals(0.25F, new BoundedRatio(0.25F).ratio());
    }

    @Test
    public void testNegativeZeroAtZeroMinimum() {
        BoundedRatio ratio = new BoundedRatio(-0.0F);
        assertEquals(0F, ratio.ratio());
        assertTrue(ratio.isAtMinimum(), ratio::toString);
        assertEquals(new BoundedRatio(0F), ratio);
        assertEquals(0, ratio.compareTo(new BoundedRatio(0)));
        assertEquals(0F, new BoundedRatio(-0.0).ratio());
        assertEquals(0.0, new BoundedDistance(-0.0).meters());
        assertEquals(0.0, new BoundedDistance(-0.0F).meters());
    }

    @Test
    public void testInexactBoundsWidenTheInput() {
        // 0.1F is slightly more than 0.1D
        assertEquals(0.1, new BoundedGain(0.1F).gain());
        assertEquals(-0.1, new BoundedGain(-0.1F).gain());
        assertEquals((double) 0.05F, new BoundedGain(0.05F).gain());
        assertEquals(0.1, new BoundedGain(1).gain());
        assertEquals(-0.1, new BoundedGain(Long.MIN_VALUE).gain());
        assertEquals(0.0, new BoundedGain(0).gain());
        assertEquals(0.1, BoundedGain.ofUnsigned(-1L).gain());
    }

    @Test
    public void testBoundsBeyondFloatRange() {
        assertEquals(1e300, BoundedMagnitude.MAXIMUM);
        assertEquals(-1e300, BoundedMagnitude.MINIMUM);
        assertEquals(1e300, new BoundedMagnitude(Float.POSITIVE_INFINITY).magnitude());
        assertEquals(-1e300, new BoundedMagnitude(Double.NEGATIVE_INFINITY).magnitude());
        assertEquals((double) Float.MAX_VALUE, new BoundedMagnitude(Float.MAX_VALUE).magnitude());
        assertEquals((double) Long.MAX_VALUE, new BoundedMagnitude(Long.MAX_VALUE).magnitude());
        assertEquals(3.5, new BoundedMagnitude(3.5F).magnitude());
    }

    @Test
    public void testFractionalBounds() {
        assertEquals(0.5, new BoundedHalfStep(Long.MAX_VALUE).steps());
        assertEquals(-100.5, new BoundedHalfStep(-200).steps());
        assertEquals(-100.5, new BoundedHalfStep(Integer.MIN_VALUE).steps());
        assertEquals(-100.0, new BoundedHalfStep((byte) -100).steps());
        assertEquals(0.0, new BoundedHalfStep(0L).steps());
        assertEquals(0.5, new BoundedHalfStep(1).steps());
        assertEquals(0.5, BoundedHalfStep.ofUnsigned(-1L).steps());
    }

    @Test
    public void testMaximumAboveLongRange() {
        assertEquals(1e19, BoundedDistance.ofUnsigned(-1L).meters());
        assertEquals(9.223372036854775808E18, BoundedDistance.ofUnsigned(Long.MIN_VALUE).meters());
        assertEquals(1234.0, BoundedDistance.ofUnsigned(1234).meters());
        assertEquals(0.0, new BoundedDistance(Long.MIN_VALUE).meters());
        assertEquals((double) Long.MAX_VALUE, new BoundedDistance(Long.MAX_VALUE).meters());
        assertEquals(1e19, new BoundedDistance(Double.MAX_VALUE).meters());
    }

    @Test
    public void testNestedInterface() {
        assertEquals(-40F, new BoundedTemperature((byte) -128).celsius());
        assertEquals(125F, new BoundedTemperature(1000).celsius());
        assertEquals(125F, new BoundedTemperature(1e300).celsius());
        assertEquals(-40F, new BoundedTemperature(-1e300).celsius());
        assertEquals(-40F, new BoundedTemperature(Long.MIN_VALUE).celsius());
        assertEquals(125F, BoundedTemperature.ofUnsigned(-1L).celsius());
        assertEquals(21.5F, new BoundedTemperature(21.5F).celsius());

        Sensors.Temperature temp = new BoundedTemperature(-5);
        assertTrue(temp.isFreezing());
        assertFalse(new BoundedTemperature(30).isFreezing());
        assertEquals("Temperature(125.0 in [-40.0, 125.0])", new BoundedTemperature(500).toString());
    }
}
