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

package com.amazon.randomforest.tree;

import static com.amazon.randomforest.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.util.OnlineStatistics;

/**
 * Produces the candidate splits of one feature for the instances present at a
 * node. The number of candidates does not grow with the number of instances.
 * <ul>
 * <li>Discrete: one {@code ==} candidate per category present, in ascending
 * index order. Nothing if a single category is present, and only the first
 * candidate if exactly two are present. The unknown category (index 0) is
 * skipped unless the feature preserves missing values.</li>
 * <li>Continuous: a {@code <=} candidate at the mean of the present values and,
 * when their sample standard deviation is positive, at
 * {@code mean + sd / 2} and {@code mean - sd / 2}.</li>
 * </ul>
 */
public class SplitCandidateGenerator {

    public List<Split> generate(int featureIndex, FeatureDescriptor descriptor, Dataset instances) {
        if (instances.isEmpty()) {
            return Collections.emptyList();
        }
        if (descriptor.isDiscrete()) {
            return generateDiscrete(featureIndex, descriptor, instances);
        }
        return generateContinuous(featureIndex, instances);
    }

    List<Split> generateDiscrete(int featureIndex, FeatureDescriptor descriptor, Dataset instances) {
        int categories = descriptor.getNumberOfCategories();
        BitSet present = new BitSet(categories);
        for (Instance instance : instances) {
            int category = instance.getCategoryIndex(featureIndex);
            checkState(category >= 0 && category < categories, "category index " + category
                    + " is out of range for feature " + descriptor.getName() + " at index " + featureIndex);
            present.set(category);
        }

        int distinct = present.cardinality();
        if (distinct < 2) {
            return Collections.emptyList();
        }

        List<Split> splits = new ArrayList<>();
        for (int category = present.nextSetBit(0); category >= 0; category = present.nextSetBit(category + 1)) {
            if (category == 0 && !descriptor.isPreserveMissing()) {
                continue;
            }
            splits.add(Split.discrete(featureIndex, category));
            // with two categories the second test is the mirror of the first
            if (distinct == 2) {
                break;
            }
        }
        return splits;
    }

    List<Split> generateContinuous(int featureIndex, Dataset instances) {
        OnlineStatistics statistics = new OnlineStatistics();
        for (Instance instance : instances) {
            statistics.update(instance.getContinuousValue(featureIndex));
        }

        double mean = statistics.getMean();
        double standardDeviation = statistics.getStandardDeviation();
        List<Split> splits = new ArrayList<>(3);
        splits.add(Split.continuous(featureIndex, (float) mean));
        if (standardDeviation > 0) {
            splits.add(Split.continuous(featureIndex, (float) (mean + standardDeviation / 2)));
            splits.add(Split.continuous(featureIndex, (float) (mean - standardDeviation / 2)));
        }
        return splits;
    }
}
