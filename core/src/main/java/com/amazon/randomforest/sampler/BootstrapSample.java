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

import java.util.BitSet;

import com.amazon.randomforest.data.Dataset;

/**
 * A same-size sample drawn with replacement, together with the positions of the
 * source dataset that were never drawn.
 */
public class BootstrapSample {

    private final Dataset sample;
    private final BitSet outOfBag;
    private final int sourceSize;

    public BootstrapSample(Dataset sample, BitSet outOfBag, int sourceSize) {
        this.sample = sample;
        this.outOfBag = outOfBag;
        this.sourceSize = sourceSize;
    }

    public Dataset getSample() {
        return sample;
    }

    /**
     * @return a copy of the out-of-bag positions
     */
    public BitSet getOutOfBag() {
        return (BitSet) outOfBag.clone();
    }

    public boolean isOutOfBag(int index) {
        return outOfBag.get(index);
    }

    public int getOutOfBagCount() {
        return outOfBag.cardinality();
    }

    public int getSourceSize() {
        return sourceSize;
    }
}
