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

import java.util.Locale;

import com.amazon.randomforest.data.FeatureValue;

/**
 * Error metrics of numeric predictions. All metrics are 0 when nothing was
 * collected.
 */
public class RegressionResults extends PredictionResults {

    private double sumOfAbsoluteErrors;
    private double sumOfSquaredErrors;
    private double sumOfSquaredLogErrors;

    @Override
    public void add(FeatureValue actual, FeatureValue predicted) {
        add(actual.getContinuousValue(), predicted.getContinuousValue());
    }

    public void add(double actual, double predicted) {
        double diff = predicted - actual;
        sumOfAbsoluteErrors += Math.abs(diff);
        sumOfSquaredErrors += diff * diff;
        double logDiff = Math.log(predicted + 1.0) - Math.log(actual + 1.0);
        sumOfSquaredLogErrors += logDiff * logDiff;
        increment();
    }

    /**
     * @return mean absolute error
     */
    public double getMeanAbsoluteError() {
        return getNumberOfInstances() > 0 ? sumOfAbsoluteErrors / getNumberOfInstances() : 0.0;
    }

    /**
     * @return root mean squared error
     */
    public double getRootMeanSquaredError() {
        return getNumberOfInstances() > 0 ? Math.sqrt(sumOfSquaredErrors / getNumberOfInstances()) : 0.0;
    }

    /**
     * @return root mean squared error of {@code log(1 + value)}; NaN if a value is
     *         below -1
     */
    public double getRootMeanSquaredLogError() {
        return getNumberOfInstances() > 0 ? Math.sqrt(sumOfSquaredLogErrors / getNumberOfInstances()) : 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "instances: %d, MAE: %f, RMSE: %f, RMSLE: %f", getNumberOfInstances(),
                getMeanAbsoluteError(), getRootMeanSquaredError(), getRootMeanSquaredLogError());
    }
}
