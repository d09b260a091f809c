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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;

public class SplitCandidateGeneratorTest {

    private SplitCandidateGenerator generator;
    private FeatureDescriptor colors;
    private FeatureDescriptor colorsPreservingMissing;

    @BeforeEach
    public void setUp() {
        generator = new SplitCandidateGenerator();
        List<String> categories = Arrays.asList(FeatureDescriptor.UNKNOWN_CATEGORY, "red", "green", "blue");
        colors = FeatureDescriptor.discrete("color", categories, new int[4], 0, false);
        colorsPreservingMissing = FeatureDescriptor.discrete("color", categories, new int[4], 0, true);
    }

    private static Dataset discrete(int... categories) {
        List<Instance> instances = new ArrayList<>();
        for (int category : categories) {
            instances.add(Instance.of(FeatureValue.discrete(category)));
        }
        return new Dataset(instances);
    }

    private static Dataset continuous(float... values) {
        List<Instance> instances = new ArrayList<>();
        for (float value : values) {
            instances.add(Instance.of(FeatureValue.continuous(value)));
        }
        return new Dataset(instances);
    }

    @Test
    public void testSingleCategoryHasNoCandidates() {
        assertThat(generator.generate(0, colors, discrete(2, 2, 2)), empty());
    }

    @Test
    public void testTwoCategoriesHaveOneCandidate() {
        assertThat(generator.generate(0, colors, discrete(3, 1, 3)), contains(Split.discrete(0, 1)));
    }

    @Test
    public void testManyCategoriesInIndexOrder() {
        assertThat(generator.generate(0, colors, discrete(3, 1, 2, 1)),
                contains(Split.discrete(0, 1), Split.discrete(0, 2), Split.discrete(0, 3)));
    }

    @Test
    public void testUnknownCategoryIsSkipped() {
        assertThat(generator.generate(0, colors, discrete(0, 1, 2)),
                contains(Split.discrete(0, 1), Split.discrete(0, 2)));
        assertThat(generator.generate(0, colors, discrete(0, 2)), contains(Split.discrete(0, 2)));
    }

    @Test
    public void testUnknownCategoryIsUsedWhenMissingIsPreserved() {
        assertThat(generator.generate(0, colorsPreservingMissing, discrete(0, 1, 2)),
                contains(Split.discrete(0, 0), Split.discrete(0, 1), Split.discrete(0, 2)));
        assertThat(generator.generate(0, colorsPreservingMissing, discrete(0, 2)), contains(Split.discrete(0, 0)));
    }

    @Test
    public void testCategoryOutOfRange() {
        assertThrows(IllegalStateException.class, () -> generator.generate(0, colors, discrete(1, 7)));
    }

    @Test
    public void testContinuousCandidates() {
        FeatureDescriptor x = FeatureDescriptor.continuous("x", 0f, 0f, 0, false);
        List<Split> splits = generator.generate(0, x, continuous(2f, 2f, 10f, 10f));

        double sd = Math.sqrt(64.0 / 3.0);
        assertThat(splits, contains(Split.continuous(0, 6f), Split.continuous(0, (float) (6.0 + sd / 2)),
                Split.continuous(0, (float) (6.0 - sd / 2))));
    }

    @Test
    public void testConstantContinuousFeature() {
        FeatureDescriptor x = FeatureDescriptor.continuous("x", 0f, 0f, 0, false);
        assertThat(generator.generate(0, x, continuous(4f, 4f, 4f)), contains(Split.continuous(0, 4f)));
    }

    @Test
    public void testEmptyInstanceSet() {
        assertEquals(0, generator.generate(0, colors, discrete()).size());
    }
}
