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

package com.amazon.randomforest.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A single 32 bit feature value. The same bits are read either as a float
 * (continuous feature) or as a category index (discrete feature); the
 * {@link FeatureDescriptor} at the same position decides which reading
 * applies; the value itself carries no type tag.
 */
@Getter
@EqualsAndHashCode
public final class FeatureValue {

    public static final FeatureValue ZERO = new FeatureValue(0);

    private final int bits;

    private FeatureValue(int bits) {
        this.bits = bits;
    }

    public static FeatureValue continuous(float value) {
        return new FeatureValue(Float.floatToRawIntBits(value));
    }

    public static FeatureValue discrete(int categoryIndex) {
        return new FeatureValue(categoryIndex);
    }

    public static FeatureValue fromBits(int bits) {
        return new FeatureValue(bits);
    }

    public float getContinuousValue() {
        return Float.intBitsToFloat(bits);
    }

    public int getCategoryIndex() {
        return bits;
    }

    @Override
    public String toString() {
        return "FeatureValue(bits=" + bits + ", float=" + getContinuousValue() + ")";
    }
}
