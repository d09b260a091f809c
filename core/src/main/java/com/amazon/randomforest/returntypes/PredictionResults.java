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

import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;

/**
 * Accumulates predictions against actual values of the predicted feature.
 */
public abstract class PredictionResults {

    private int numberOfInstances;

    /**
     * @param predictedFeature the descriptor of the predicted feature
     * @return classification results for a discrete feature, regression results
     *         otherwise
     */
    public static PredictionResults forFeature(FeatureDescriptor predictedFeature) {
        if (predictedFeature.isDiscrete()) {
            return new ClassificationResults(predictedFeature);
        }
        return new RegressionResults();
    }

    public abstract void add(FeatureValue actual, FeatureValue predicted);

    public int getNumberOfInstances() {
        return numberOfInstances;
    }

    protected void increment() {
        numberOfInstances += 1;
    }
}
