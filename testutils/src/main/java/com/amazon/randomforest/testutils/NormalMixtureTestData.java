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
 * This class samples labeled points from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. Label 0 is drawn
 * from the base distribution and label 1 from the second distribution, which
 * is picked for a row with the given probability.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double otherMu;
    private final double otherSigma;
    private final double otherProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double otherMu, double otherSigma,
            double otherProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.otherMu = otherMu;
        this.otherSigma = otherSigma;
        this.otherProbability = otherProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 1.0, 0.5);
    }

    public NormalMixtureTestData(double baseMu, double otherMu) {
        this(baseMu, 1.0, otherMu, 1.0, 0.5);
    }

    public MultiDimDataWithLabel generateLabeledData(int numberOfRows, int numberOfColumns, long seed) {
        double[][] data = new double[numberOfRows][numberOfColumns];
        int[] labels = new int[numberOfRows];
        Random random = new Random(seed);
        NormalDistribution dist = new NormalDistribution(new Random(seed + 1));

        for (int i = 0; i < numberOfRows; i++) {
            if (random.nextDouble() < otherProbability) {
                labels[i] = 1;
                fillRow(data[i], dist, otherMu, otherSigma);
            } else {
                labels[i] = 0;
                fillRow(data[i], dist, baseMu, baseSigma);
            }
        }

        return new MultiDimDataWithLabel(data, labels);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }
}
