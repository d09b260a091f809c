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

package com.amazon.randomforest.executor;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.amazon.randomforest.tree.DecisionTree;
import com.amazon.randomforest.tree.FeatureImportance;

/**
 * Trees built by one worker, or by all workers once combined, with the
 * out-of-bag positions of each tree and the summed feature importance. A batch
 * that failed carries the reason and no trees.
 */
public class TreeBatch {

    private final List<DecisionTree> trees;
    private final List<BitSet> outOfBag;
    private final FeatureImportance[] importance;
    private final String failure;

    private TreeBatch(List<DecisionTree> trees, List<BitSet> outOfBag, FeatureImportance[] importance,
            String failure) {
        this.trees = trees;
        this.outOfBag = outOfBag;
        this.importance = importance;
        this.failure = failure;
    }

    static TreeBatch success(List<DecisionTree> trees, List<BitSet> outOfBag, FeatureImportance[] importance) {
        return new TreeBatch(Collections.unmodifiableList(trees), Collections.unmodifiableList(outOfBag),
                importance, null);
    }

    static TreeBatch failure(String reason) {
        return new TreeBatch(Collections.emptyList(), Collections.emptyList(), new FeatureImportance[0], reason);
    }

    /**
     * Concatenates batches in list order and sums their importance. The result
     * fails with the first failure found if any batch failed.
     *
     * @param batches        batches in worker order
     * @param numberOfFeatures width of the instance definition
     * @return the combined batch
     */
    public static TreeBatch combine(List<TreeBatch> batches, int numberOfFeatures) {
        List<DecisionTree> trees = new ArrayList<>();
        List<BitSet> outOfBag = new ArrayList<>();
        FeatureImportance[] importance = newImportance(numberOfFeatures);
        for (TreeBatch batch : batches) {
            if (batch.failure != null) {
                return failure(batch.failure);
            }
            trees.addAll(batch.trees);
            outOfBag.addAll(batch.outOfBag);
            for (int i = 0; i < numberOfFeatures; i++) {
                importance[i].merge(batch.importance[i]);
            }
        }
        return success(trees, outOfBag, importance);
    }

    static FeatureImportance[] newImportance(int numberOfFeatures) {
        FeatureImportance[] importance = new FeatureImportance[numberOfFeatures];
        for (int i = 0; i < numberOfFeatures; i++) {
            importance[i] = new FeatureImportance();
        }
        return importance;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    public List<DecisionTree> getTrees() {
        return trees;
    }

    /**
     * @return for each tree, in tree order, the dataset positions it did not see
     */
    public List<BitSet> getOutOfBag() {
        return outOfBag;
    }

    public FeatureImportance[] getImportance() {
        return importance;
    }
}
