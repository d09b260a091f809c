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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameters of a single tree build.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TreeBuildConfig {

    /**
     * Default maximum depth, 0 means unlimited.
     */
    public static final int DEFAULT_MAX_DEPTH = 0;

    public static final int DEFAULT_MIN_LEAF_INSTANCES = 1;

    /**
     * Default number of features considered per node, 0 means all.
     */
    public static final int DEFAULT_FEATURES_TO_CONSIDER_PER_NODE = 0;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final String DEFAULT_NAME = "tree";

    private final int predictedFeatureIndex;

    @Builder.Default
    private final int maxDepth = DEFAULT_MAX_DEPTH;

    @Builder.Default
    private final int minLeafInstances = DEFAULT_MIN_LEAF_INSTANCES;

    @Builder.Default
    private final int featuresToConsiderPerNode = DEFAULT_FEATURES_TO_CONSIDER_PER_NODE;

    /**
     * seed of the feature sub-sampling stream when the builder is not handed a
     * stream by its caller
     */
    @Builder.Default
    private final long randomSeed = DEFAULT_RANDOM_SEED;

    /**
     * keep the instances reaching each leaf, for residual fitting
     */
    @Builder.Default
    private final boolean retainLeafInstances = false;

    @Builder.Default
    private final String name = DEFAULT_NAME;
}
