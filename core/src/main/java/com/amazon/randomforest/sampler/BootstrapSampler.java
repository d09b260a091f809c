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

package com.amazon.randomforest.sampler;

import static com.amazon.randomforest.CommonUtils.checkArgument;

import java.util.BitSet;

import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.util.RandomSource;

/**
 * Draws bootstrap samples: for a dataset of size N, N positions drawn uniformly
 * with replacement as {@code random % N}.
 */
public class BootstrapSampler {

    private BootstrapSampler() {
    }

    public static BootstrapSample sample(Dataset dataset, RandomSource random) {
        int size = dataset.size();
        checkArgument(size > 0, "cannot sample an empty dataset");
        int[] drawn = new int[size];
        BitSet inBag = new BitSet(size);
        for (int i = 0; i < size; i++) {
            drawn[i] = random.nextIndex(size);
            inBag.set(drawn[i]);
        }
        BitSet outOfBag = new BitSet(size);
        outOfBag.set(0, size);
        outOfBag.andNot(inBag);
        return new BootstrapSample(dataset.select(drawn), outOfBag, size);
    }
}
