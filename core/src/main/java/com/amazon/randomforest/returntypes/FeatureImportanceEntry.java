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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Aggregated importance of one feature across a forest.
 */
@Getter
@AllArgsConstructor
public class FeatureImportanceEntry {

    private final int featureIndex;

    private final String featureName;

    /**
     * sum of the score reductions of all splits on this feature
     */
    private final double score;

    /**
     * number of split nodes on this feature
     */
    private final int count;

    /**
     * {@code 100 * score / max score}, 0 when no feature reduced the score
     */
    private final double normalizedScore;

    /**
     * @return text used to order and display the entry, e.g.
     *         {@code " 100.00 x (12 nodes, 0.25)"}
     */
    public String getLabel() {
        double average = count > 0 ? score / count : 0.0;
        return String.format(Locale.ROOT, "%7.2f %s (%d nodes, %.2f)", normalizedScore, featureName, count, average);
    }
}
