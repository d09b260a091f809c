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

package com.amazon.randomforest.testutils;

import java.util.Random;

/**
 * Samples points uniformly from {@code [0, range)} in each dimension and sets
 * the target to a weighted sum of the coordinates plus normal noise.
 */
public class LinearRegressionTestData {

    private final double[] weights;
    private final double range;
    private final double noiseSigma;

    public LinearRegressionTestData(double[] weights, double range, double noiseSigma) {
        this.weights = weights;
        this.range = range;
        this.noiseSigma = noiseSigma;
    }

    public LinearRegressionTestData(double... weights) {
        this(weights, 10.0, 0.1);
    }

    public MultiDimDataWithTarget generateTestData(int numberOfRows, long seed) {
        double[][] data = new double[numberOfRows][weights.length];
        double[] targets = new double[numberOfRows];
        Random random = new Random(seed);
        NormalDistribution noise = new NormalDistribution(new Random(seed + 1));

        for (int i = 0; i < numberOfRows; i++) {
            double target = 0;
            for (int j = 0; j < weights.length; j++) {
                data[i][j] = random.nextDouble() * range;
                target += weights[j] * data[i][j];
            }
            targets[i] = target + noise.nextDouble(0, noiseSigma);
        }
        return new MultiDimDataWithTarget(data, targets);
    }
}
