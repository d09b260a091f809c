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

import java.util.Collections;
import java.util.List;

import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;

/**
 * Terminal node. The prediction is the mean (regression) or the mode category
 * (classification) of the training instances that reached the leaf. When a tree
 * is built with {@code retainLeafInstances}, the leaf also keeps those
 * instances until a consumer clears them.
 */
public class LeafNode extends Node {

    private List<Instance> retainedInstances;

    public LeafNode(int predictedFeatureIndex, FeatureType featureType, FeatureValue prediction) {
        this(predictedFeatureIndex, featureType, prediction, null);
    }

    public LeafNode(int predictedFeatureIndex, FeatureType featureType, FeatureValue prediction,
            List<Instance> retainedInstances) {
        super(predictedFeatureIndex, featureType, prediction);
        this.retainedInstances = retainedInstances == null ? null
                : Collections.unmodifiableList(retainedInstances);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    public FeatureValue getPrediction() {
        return getValue();
    }

    /**
     * @return the instances retained at this leaf, empty if none were retained or
     *         they were cleared
     */
    public List<Instance> getRetainedInstances() {
        return retainedInstances == null ? Collections.emptyList() : retainedInstances;
    }

    public boolean hasRetainedInstances() {
        return retainedInstances != null;
    }

    public void clearRetainedInstances() {
        retainedInstances = null;
    }
}
