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

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkState;

import java.util.Locale;

import lombok.Getter;

import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;

/**
 * Accuracy and confusion counts of categorical predictions. Rows of the
 * confusion matrix are actual categories, columns are predicted categories.
 */
public class ClassificationResults extends PredictionResults {

    private final FeatureDescriptor predictedFeature;
    private final int[][] confusionMatrix;
    @Getter
    private int numberCorrect;

    public ClassificationResults(FeatureDescriptor predictedFeature) {
        checkArgument(predictedFeature.isDiscrete(), "classification results need a discrete predicted feature");
        this.predictedFeature = predictedFeature;
        int categories = predictedFeature.getNumberOfCategories();
        this.confusionMatrix = new int[categories][categories];
    }

    @Override
    public void add(FeatureValue actual, FeatureValue predicted) {
        add(actual.getCategoryIndex(), predicted.getCategoryIndex());
    }

    public void add(int actual, int predicted) {
        int categories = confusionMatrix.length;
        checkState(actual >= 0 && actual < categories, "actual category " + actual + " is out of range");
        checkState(predicted >= 0 && predicted < categories, "predicted category " + predicted + " is out of range");
        confusionMatrix[actual][predicted] += 1;
        increment();
        if (actual == predicted) {
            numberCorrect += 1;
        }
    }

    /**
     * @return percentage of correct predictions, 0 when nothing was collected
     */
    public double getAccuracy() {
        return getNumberOfInstances() > 0 ? 100.0 * numberCorrect / getNumberOfInstances() : 0.0;
    }

    public int getCount(int actual, int predicted) {
        return confusionMatrix[actual][predicted];
    }

    public int getCount(String actual, String predicted) {
        int actualIndex = predictedFeature.getCategoryIndex(actual);
        int predictedIndex = predictedFeature.getCategoryIndex(predicted);
        if (actualIndex < 0 || predictedIndex < 0) {
            return 0;
        }
        return confusionMatrix[actualIndex][predictedIndex];
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "instances: %d, correctly classified: %d (%.1f%%)", getNumberOfInstances(),
                numberCorrect, getAccuracy());
    }
}
