package io.medequiv.engine.encode;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class NumericTransformsTest {

    private final NumericTransforms transforms = new NumericTransforms(NumericTransforms.DEFAULT_BREAKPOINTS);

    @Test
    void testLogFeature() {
        assertEquals(Math.log(500.0), transforms.logFeature("quantity", 500.0), 1e-12);
        assertEquals(0.0, transforms.logFeature("quantity", 1.0), 1e-12);
    }

    @Test
    void testLogFeatureRejectsNonPositive() {
        InvalidQuantityException zero = assertThrows(InvalidQuantityException.class,
            () -> transforms.logFeature("quantity", 0.0));
        assertEquals("quantity", zero.field());
        assertEquals(0.0, zero.value());

        InvalidQuantityException negative = assertThrows(InvalidQuantityException.class,
            () -> transforms.logFeature("reference_quantity", -2.0));
        assertEquals("reference_quantity", negative.field());

        assertThrows(InvalidQuantityException.class, () -> transforms.logFeature("quantity", Double.NaN));
    }

    @Test
    void testRatioFeature() {
        assertEquals(50.0, transforms.ratioFeature(500.0, 10.0), 1e-12);
        assertThrows(InvalidQuantityException.class, () -> transforms.ratioFeature(500.0, 0.0));
        assertThrows(InvalidQuantityException.class, () -> transforms.ratioFeature(Double.POSITIVE_INFINITY, 1.0));
    }

    @Test
    void testBinBoundaries() {
        assertEquals(0, transforms.binFeature(0.5));
        assertEquals(0, transforms.binFeature(9.9));
        assertEquals(1, transforms.binFeature(10.0));
        assertEquals(1, transforms.binFeature(99.99));
        assertEquals(2, transforms.binFeature(100.0));
        assertEquals(2, transforms.binFeature(499.0));
        assertEquals(3, transforms.binFeature(500.0));
        assertEquals(3, transforms.binFeature(1_000_000.0));
    }

    @Test
    void testCustomBreakpoints() {
        NumericTransforms custom = new NumericTransforms(new double[]{1.0, 2.0});
        assertEquals(0, custom.binFeature(0.9));
        assertEquals(2, custom.binFeature(2.0));

        NumericTransforms none = new NumericTransforms(new double[0]);
        assertEquals(0, none.binFeature(1e9));
    }

    @Test
    void testInvalidBreakpoints() {
        assertThrows(IllegalArgumentException.class, () -> new NumericTransforms(new double[]{10.0, 10.0}));
        assertThrows(IllegalArgumentException.class, () -> new NumericTransforms(new double[]{100.0, 10.0}));
        assertThrows(IllegalArgumentException.class, () -> new NumericTransforms(new double[]{Double.NaN}));
        assertThrows(IllegalArgumentException.class, () -> new NumericTransforms(null));
    }

    @Test
    void testBreakpointsAreCopied() {
        double[] breakpoints = {1.0, 2.0};
        NumericTransforms copy = new NumericTransforms(breakpoints);
        breakpoints[0] = 5.0;
        assertEquals(1, copy.binFeature(1.5));
    }
}
