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

package com.amazon.randomforest.util;

import java.util.Random;

/**
 * Seeded pseudo random stream used for bootstrap draws, feature sub-sampling
 * and shuffles. The generator algorithm of {@link Random} is fixed by its
 * contract, so a given seed yields the same sequence on every platform.
 * Indices are drawn by reducing an unsigned 32 bit value modulo the bound.
 * <p>
 * Instances are not shared between threads; each training worker owns one.
 */
public class RandomSource {

    private final Random random;

    public RandomSource(long seed) {
        this.random = new Random(seed);
    }

    /**
     * @return the next unsigned 32 bit value of the stream
     */
    public long nextUnsigned() {
        return Integer.toUnsignedLong(random.nextInt());
    }

    /**
     * @param bound exclusive upper bound, must be positive
     * @return an index in {@code [0, bound)}
     */
    public int nextIndex(int bound) {
        return (int) (nextUnsigned() % bound);
    }

    /**
     * In place Fisher-Yates shuffle.
     *
     * @param values the array to shuffle
     */
    public void shuffle(int[] values) {
        for (int i = values.length - 1; i > 0; --i) {
            int j = nextIndex(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
