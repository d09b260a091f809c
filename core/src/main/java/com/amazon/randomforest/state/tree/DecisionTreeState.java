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

package com.amazon.randomforest.state.tree;

import static com.amazon.randomforest.state.Version.V1_0;

import java.util.List;

import lombok.Data;

/**
 * A decision tree as a list of nodes numbered in pre-order, the root being 0.
 */
@Data
public class DecisionTreeState {

    private String version = V1_0;

    private String name;

    private int predictedFeatureIndex;

    private String modelType;

    private int nodeCount;

    private int leafCount;

    private List<NodeState> nodes;

    private double[] importanceScores;

    private int[] importanceCounts;
}
