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

import lombok.Data;

/**
 * One node of a serialized tree. Split nodes refer to their children by id;
 * the children of a leaf are null.
 */
@Data
public class NodeState {

    public static final String LEAF = "leaf";

    public static final String SPLIT = "split";

    private Integer id;

    private String nodeType;

    private int featureIndex;

    private String featureType;

    /**
     * the threshold of a split or the prediction of a leaf; a category index for
     * discrete features
     */
    private double featureValue;

    private String leftOperator;

    private Integer leftId;

    private String rightOperator;

    private Integer rightId;
}
