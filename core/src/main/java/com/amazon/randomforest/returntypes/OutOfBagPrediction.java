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

package com.amazon.randomforest.returntypes;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.randomforest.data.FeatureValue;

/**
 * A prediction for a training instance made only by the trees that did not see
 * the instance in their bootstrap sample.
 */
@Getter
@AllArgsConstructor
public class OutOfBagPrediction {

    /**
     * position of the instance in the training dataset
     */
    private final int instanceIndex;

    /**
     * number of trees that voted
     */
    private final int numberOfTrees;

    private final FeatureValue actual;

    private final FeatureValue predicted;
}
