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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.randomforest.config.ComparisonOperator;
import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;

/**
 * A binary test on one feature. Continuous features use {@code <=} on the left
 * and {@code >} on the right; discrete features use {@code ==} and
 * {@code !=}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Split {

    private final int featureIndex;
    private final FeatureType featureType;
    private final FeatureValue threshold;
    private final ComparisonOperator leftOperator;
    private final ComparisonOperator rightOperator;

    public Split(int featureIndex, FeatureType featureType, FeatureValue threshold, ComparisonOperator leftOperator,
            ComparisonOperator rightOperator) {
        this.featureIndex = featureIndex;
        this.featureType = checkNotNull(featureType, "featureType must not be null");
        this.threshold = checkNotNull(threshold, "threshold must not be null");
        checkArgument(leftOperator.getFeatureType() == featureType && rightOperator == leftOperator.complement(),
                "operators " + leftOperator + "/" + rightOperator + " are not valid for a " + featureType
                        + " split");
        this.leftOperator = leftOperator;
        this.rightOperator = rightOperator;
    }

    public static Split continuous(int featureIndex, float threshold) {
        return new Split(featureIndex, FeatureType.CONTINUOUS, FeatureValue.continuous(threshold),
                ComparisonOperator.LESS_THAN_OR_EQUAL, ComparisonOperator.GREATER_THAN);
    }

    public static Split discrete(int featureIndex, int categoryIndex) {
        return new Split(featureIndex, FeatureType.DISCRETE, FeatureValue.discrete(categoryIndex),
                ComparisonOperator.EQUAL, ComparisonOperator.NOT_EQUAL);
    }

    public boolean goesLeft(Instance instance) {
        return leftOperator.test(featureType, instance.getBits(featureIndex), threshold.getBits());
    }
}
