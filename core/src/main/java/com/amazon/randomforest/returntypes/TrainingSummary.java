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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;

/**
 * What a successful forest training produced besides the trees.
 */
@Getter
@Builder
public class TrainingSummary {

    private final int numberOfTrees;

    private final int numberOfWorkers;

    private final long elapsedMillis;

    /**
     * one entry per training instance that was out of bag for at least one tree,
     * in dataset order; empty when the estimate is disabled
     */
    @Builder.Default
    private final List<OutOfBagPrediction> outOfBagPredictions = Collections.emptyList();

    private final PredictionResults outOfBagResults;

    @Builder.Default
    private final List<FeatureImportanceEntry> featureImportance = Collections.emptyList();

    /**
     * @return the held-out error estimate, or {@code Optional.empty()} when the
     *         estimate is disabled
     */
    public Optional<PredictionResults> getOutOfBagResults() {
        return Optional.ofNullable(outOfBagResults);
    }
}
