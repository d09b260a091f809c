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

import static com.amazon.randomforest.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;

public class RegionScorerTest {

    private static Dataset labeled(float[] x, int[] labels) {
        List<Instance> instances = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            instances.add(Instance.of(FeatureValue.continuous(x[i]), FeatureValue.discrete(labels[i])));
        }
        return new Dataset(instances);
    }

    private static Dataset targets(float[] x, float[] targets) {
        List<Instance> instances = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            instances.add(Instance.of(FeatureValue.continuous(x[i]), FeatureValue.continuous(targets[i])));
        }
        return new Dataset(instances);
    }

    @Test
    public void testGiniOfWholeSet() {
        RegionScorer scorer = new RegionScorer(ModelType.CLASSIFICATION, 1, 3);
        Dataset data = labeled(new float[] { 2, 2, 10, 10 }, new int[] { 1, 1, 2, 2 });

        RegionScore score = scorer.score(data);
        assertThat(score.getCombined(), closeTo(0.5, EPSILON));
        assertThat(score.getLeft(), closeTo(0.5, EPSILON));
        assertEquals(0.0, score.getRight());
    }

    @Test
    public void testGiniOfSplit() {
        RegionScorer scorer = new RegionScorer(ModelType.CLASSIFICATION, 1, 3);
        Dataset data = labeled(new float[] { 1, 2, 3, 4 }, new int[] { 1, 1, 1, 2 });

        RegionScore pure = scorer.score(data, Split.continuous(0, 3f));
        assertEquals(0.0, pure.getCombined());

        // left {1, 1}, right {1, 2}: 0.5 * 0 + 0.5 * 0.5
        RegionScore mixed = scorer.score(data, Split.continuous(0, 2f));
        assertThat(mixed.getLeft(), closeTo(0.0, EPSILON));
        assertThat(mixed.getRight(), closeTo(0.5, EPSILON));
        assertThat(mixed.getCombined(), closeTo(0.25, EPSILON));
    }

    @Test
    public void testSumOfSquaredDeviations() {
        RegionScorer scorer = new RegionScorer(ModelType.REGRESSION, 1, 0);
        Dataset data = targets(new float[] { 1, 2, 3, 4 }, new float[] { 1, 2, 3, 10 });

        assertThat(scorer.score(data).getCombined(), closeTo(50.0, EPSILON));

        RegionScore split = scorer.score(data, Split.continuous(0, 3f));
        assertThat(split.getLeft(), closeTo(2.0, EPSILON));
        assertThat(split.getRight(), closeTo(0.0, EPSILON));
        assertThat(split.getCombined(), closeTo(2.0, EPSILON));
    }

    @Test
    public void testEmptySet() {
        RegionScorer scorer = new RegionScorer(ModelType.REGRESSION, 1, 0);
        assertSame(RegionScore.ZERO, scorer.score(new Dataset(new ArrayList<>())));
    }

    @Test
    public void testCategoryOutOfRange() {
        RegionScorer scorer = new RegionScorer(ModelType.CLASSIFICATION, 0, 3);
        Dataset data = new Dataset(Arrays.asList(Instance.of(FeatureValue.discrete(5))));
        assertThrows(IllegalStateException.class, () -> scorer.score(data));
    }

    @Test
    public void testClassificationNeedsClasses() {
        assertThrows(IllegalArgumentException.class, () -> new RegionScorer(ModelType.CLASSIFICATION, 0, 0));
    }
}
