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

import lombok.Getter;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.FeatureValue;

/**
 * A node of a {@link DecisionTree}: either a {@link LeafNode} holding a
 * prediction or a {@link SplitNode} owning exactly two children.
 */
@Getter
public abstract class Node {

    /**
     * the feature tested by a split, or the predicted feature for a leaf
     */
    private final int featureIndex;

    private final FeatureType featureType;

    /**
     * the split threshold, or the prediction for a leaf
     */
    private final FeatureValue value;

    protected Node(int featureIndex, FeatureType featureType, FeatureValue value) {
        this.featureIndex = featureIndex;
        this.featureType = featureType;
        this.value = value;
    }

    public abstract boolean isLeaf();
}
