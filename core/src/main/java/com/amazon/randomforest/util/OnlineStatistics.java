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

package com.amazon.randomforest.util;

import lombok.Getter;

/**
 * Single pass mean and variance accumulator (Welford). The accumulated values
 * are identical regardless of platform because every update is a fixed
 * sequence of double operations.
 */
@Getter
public class OnlineStatistics {

    private long count;
    private double mean;
    /**
     * running sum of squared deviations from the current mean
     */
    private double sumOfSquaredDeviations;

    public void update(double value) {
        count += 1;
        double delta = value - mean;
        mean += delta / count;
        sumOfSquaredDeviations += delta * (value - mean);
    }

    /**
     * @return the sample standard deviation, 0 when fewer than two values were
     *         seen
     */
    public double getStandardDeviation() {
        if (count < 2) {
            return 0.0;
        }
        return Math.sqrt(sumOfSquaredDeviations / (count - 1));
    }
}
