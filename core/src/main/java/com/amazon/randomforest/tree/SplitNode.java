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

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.randomforest.config.ComparisonOperator;
import com.amazon.randomforest.data.Instance;

/**
 * Internal node testing one feature against a threshold. Instances satisfying
 * the left operator descend left, all others descend right.
 */
@Getter
public class SplitNode extends Node {

    private final ComparisonOperator leftOperator;
    private final ComparisonOperator rightOperator;
    private final Node left;
    private final Node right;

    public SplitNode(Split split, Node left, Node right) {
        super(split.getFeatureIndex(), split.getFeatureType(), split.getThreshold());
        this.leftOperator = split.getLeftOperator();
        this.rightOperator = split.getRightOperator();
        this.left = checkNotNull(left, "left child must not be null");
        this.right = checkNotNull(right, "right child must not be null");
        checkArgument(left != right, "a split needs two distinct children");
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    public boolean goesLeft(Instance instance) {
        return leftOperator.test(getFeatureType(), instance.getBits(getFeatureIndex()), getValue().getBits());
    }

    public Node next(Instance instance) {
        return goesLeft(instance) ? left : right;
    }

    public Split getSplit() {
        return new Split(getFeatureIndex(), getFeatureType(), getValue(), leftOperator, rightOperator);
    }
}
