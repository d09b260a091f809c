/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.randomforest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class ComparisonOperatorTest {

    private static int bits(float value) {
        return Float.floatToRawIntBits(value);
    }

    @Test
    public void testLessThanOrEqualIncludesThreshold() {
        assertTrue(ComparisonOperator.LESS_THAN_OR_EQUAL.test(FeatureType.CONTINUOUS, bits(6f), bits(6f)));
        assertTrue(ComparisonOperator.LESS_THAN_OR_EQUAL.test(FeatureType.CONTINUOUS, bits(-3f), bits(6f)));
        assertFalse(ComparisonOperator.GREATER_THAN.test(FeatureType.CONTINUOUS, bits(6f), bits(6f)));
        assertTrue(ComparisonOperator.GREATER_THAN.test(FeatureType.CONTINUOUS, bits(6.5f), bits(6f)));
    }

    @Test
    public void testDiscreteOperators() {
        assertTrue(ComparisonOperator.EQUAL.test(FeatureType.DISCRETE, 2, 2));
        assertFalse(ComparisonOperator.EQUAL.test(FeatureType.DISCRETE, 1, 2));
        assertTrue(ComparisonOperator.NOT_EQUAL.test(FeatureType.DISCRETE, 1, 2));
    }

    @Test
    public void testTypeMismatch() {
        assertThrows(IllegalStateException.class,
                () -> ComparisonOperator.EQUAL.test(FeatureType.CONTINUOUS, bits(1f), bits(1f)));
        assertThrows(IllegalStateException.class,
                () -> ComparisonOperator.LESS_THAN_OR_EQUAL.test(FeatureType.DISCRETE, 1, 1));
    }

    @ParameterizedTest
    @EnumSource(ComparisonOperator.class)
    public void testSymbolAndComplement(ComparisonOperator operator) {
        assertEquals(operator, ComparisonOperator.fromSymbol(operator.getSymbol()));
        assertEquals(operator, operator.complement().complement());
        assertEquals(operator.getFeatureType(), operator.complement().getFeatureType());
    }

    @Test
    public void testUnknownSymbol() {
        assertThrows(IllegalArgumentException.class, () -> ComparisonOperator.fromSymbol("<"));
    }

    @Test
    public void testModelTypeForFeatureType() {
        assertEquals(ModelType.REGRESSION, ModelType.forFeatureType(FeatureType.CONTINUOUS));
        assertEquals(ModelType.CLASSIFICATION, ModelType.forFeatureType(FeatureType.DISCRETE));
        assertEquals(ComparisonOperator.EQUAL, ComparisonOperator.leftOperatorFor(FeatureType.DISCRETE));
    }
}
