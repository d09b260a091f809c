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

import static com.amazon.randomforest.CommonUtils.checkNotNull;
import static com.amazon.randomforest.CommonUtils.checkState;

import java.util.Arrays;

/**
 * One row of feature values, parallel to an {@link InstanceDefinition}. The
 * predicted feature occupies its column like every other feature. Instances
 * are immutable and are shared by reference between datasets.
 */
public final class Instance {

    private final int[] values;

    private Instance(int[] values) {
        this.values = values;
    }

    public static Instance of(FeatureValue... values) {
        checkNotNull(values, "values must not be null");
        int[] bits = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            bits[i] = values[i].getBits();
        }
        return new Instance(bits);
    }

    /**
     * @param bits raw 32 bit values; the array is copied
     * @return a new instance
     */
    public static Instance fromBits(int[] bits) {
        checkNotNull(bits, "bits must not be null");
        return new Instance(Arrays.copyOf(bits, bits.length));
    }

    public int getWidth() {
        return values.length;
    }

    public FeatureValue getValue(int featureIndex) {
        return FeatureValue.fromBits(getBits(featureIndex));
    }

    public int getBits(int featureIndex) {
        checkState(featureIndex >= 0 && featureIndex < values.length,
                "feature index " + featureIndex + " out of bounds for instance of width " + values.length);
        return values[featureIndex];
    }

    public float getContinuousValue(int featureIndex) {
        return Float.intBitsToFloat(getBits(featureIndex));
    }

    public int getCategoryIndex(int featureIndex) {
        return getBits(featureIndex);
    }

    @Override
    public String toString() {
        return "Instance" + Arrays.toString(values);
    }
}
