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

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkState;
import static com.amazon.randomforest.CommonUtils.giniImpurity;

import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.util.OnlineStatistics;

/**
 * Scores an instance set under a candidate split.
 * <p>
 * For regression the score of a side is the sum of squared deviations of the
 * predicted feature from the side's mean, and the two sides are added. For
 * classification the score of a side is its Gini impurity, and the two sides
 * are averaged weighted by their sizes. Both are computed in a single pass over
 * the instances without materializing the partition.
 */
public class RegionScorer {

    private final ModelType modelType;
    private final int predictedFeatureIndex;
    private final int numberOfClasses;

    public RegionScorer(ModelType modelType, int predictedFeatureIndex, int numberOfClasses) {
        checkArgument(modelType == ModelType.REGRESSION || numberOfClasses > 0,
                "classification needs at least one class");
        this.modelType = modelType;
        this.predictedFeatureIndex = predictedFeatureIndex;
        this.numberOfClasses = numberOfClasses;
    }

    public static RegionScorer forDefinition(InstanceDefinition definition, int predictedFeatureIndex) {
        FeatureDescriptor predicted = definition.get(predictedFeatureIndex);
        return new RegionScorer(ModelType.forFeatureType(predicted.getFeatureType()), predictedFeatureIndex,
                predicted.getNumberOfCategories());
    }

    /**
     * Scores the whole set undivided. The combined and left components hold the
     * score of the set, the right component is 0.
     *
     * @param instances the instance set
     * @return the score
     */
    public RegionScore score(Dataset instances) {
        return score(instances, null);
    }

    /**
     * @param instances the instance set
     * @param split     the candidate, or null to score the set undivided
     * @return the score, all components 0 for an empty set
     */
    public RegionScore score(Dataset instances, Split split) {
        if (instances.isEmpty()) {
            return RegionScore.ZERO;
        }
        if (modelType == ModelType.REGRESSION) {
            return scoreRegression(instances, split);
        }
        return scoreClassification(instances, split);
    }

    private RegionScore scoreRegression(Dataset instances, Split split) {
        OnlineStatistics left = new OnlineStatistics();
        OnlineStatistics right = new OnlineStatistics();
        for (Instance instance : instances) {
            double value = instance.getContinuousValue(predictedFeatureIndex);
            if (split == null || split.goesLeft(instance)) {
                left.update(value);
            } else {
                right.update(value);
            }
        }
        double leftScore = left.getSumOfSquaredDeviations();
        double rightScore = right.getSumOfSquaredDeviations();
        return new RegionScore(leftScore + rightScore, leftScore, rightScore);
    }

    private RegionScore scoreClassification(Dataset instances, Split split) {
        int[] leftCounts = new int[numberOfClasses];
        int[] rightCounts = new int[numberOfClasses];
        int leftTotal = 0;
        int rightTotal = 0;
        for (Instance instance : instances) {
            int category = instance.getCategoryIndex(predictedFeatureIndex);
            checkState(category >= 0 && category < numberOfClasses,
                    "category index " + category + " of the predicted feature is out of range");
            if (split == null || split.goesLeft(instance)) {
                leftCounts[category] += 1;
                leftTotal += 1;
            } else {
                rightCounts[category] += 1;
                rightTotal += 1;
            }
        }
        double leftScore = giniImpurity(leftCounts, leftTotal);
        double rightScore = giniImpurity(rightCounts, rightTotal);
        int total = leftTotal + rightTotal;
        double combined = ((double) leftTotal / total) * leftScore + ((double) rightTotal / total) * rightScore;
        return new RegionScore(combined, leftScore, rightScore);
    }
}
