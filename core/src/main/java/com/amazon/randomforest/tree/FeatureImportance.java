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

import lombok.Getter;

/**
 * Accumulated score reduction attributed to one feature.
 */
@Getter
public class FeatureImportance {

    private double sumScoreDelta;
    private int count;

    public FeatureImportance() {
    }

    public FeatureImportance(double sumScoreDelta, int count) {
        this.sumScoreDelta = sumScoreDelta;
        this.count = count;
    }

    public void add(double scoreDelta) {
        sumScoreDelta += scoreDelta;
        count += 1;
    }

    public void merge(FeatureImportance other) {
        sumScoreDelta += other.sumScoreDelta;
        count += other.count;
    }

    public FeatureImportance copy() {
        return new FeatureImportance(sumScoreDelta, count);
    }
}
