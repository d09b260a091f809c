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
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.randomforest.TestUtils;
import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.DatasetBuilder;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.data.TabularData;
import com.amazon.randomforest.returntypes.BuildResult;

public class DecisionTreeBuilderTest {

    private DecisionTreeBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new DecisionTreeBuilder();
    }

    private static TabularData twoClusters() {
        return new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS).addFeature("label", FeatureType.DISCRETE)
                .addRow("2", "A").addRow("2", "A").addRow("10", "B").addRow("10", "B").build();
    }

    private DecisionTree build(TabularData data, TreeBuildConfig config) {
        BuildResult<DecisionTree> result = builder.build(data.getDefinition(), data.getDataset(), config);
        assertTrue(result.isSuccess(), result.getMessage());
        return result.getValue().get();
    }

    @Test
    public void testSingleSplitBetweenClusters() {
        TabularData data = twoClusters();
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).build());

        assertEquals(3, tree.getNodeCount());
        assertEquals(2, tree.getLeafCount());
        assertEquals(1, tree.getDepth());

        SplitNode root = (SplitNode) tree.getRoot();
        assertEquals(Split.continuous(0, 6f), root.getSplit());

        int a = data.getDefinition().get(1).getCategoryIndex("A");
        int b = data.getDefinition().get(1).getCategoryIndex("B");
        List<LeafNode> leaves = tree.getLeaves();
        assertEquals(FeatureValue.discrete(a), leaves.get(0).getPrediction());
        assertEquals(FeatureValue.discrete(b), leaves.get(1).getPrediction());

        for (Instance instance : data.getDataset()) {
            assertEquals(instance.getValue(1), tree.evaluate(instance).get());
        }

        FeatureImportance[] importance = tree.getFeatureImportance();
        assertEquals(1, importance[0].getCount());
        assertThat(importance[0].getSumScoreDelta(), closeTo(0.5, EPSILON));
        assertEquals(0, importance[1].getCount());
    }

    @Test
    public void testSeparatedClustersWithDepthLimit() {
        TabularData data = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
                .addFeature("label", FeatureType.DISCRETE).addRow("1", "A").addRow("2", "A").addRow("10", "B")
                .addRow("11", "B").build();
        DecisionTree tree = build(data,
                TreeBuildConfig.builder().predictedFeatureIndex(1).maxDepth(2).minLeafInstances(1).build());

        assertEquals(3, tree.getNodeCount());
        assertEquals(2, tree.getLeafCount());
        Split split = ((SplitNode) tree.getRoot()).getSplit();
        assertEquals(0, split.getFeatureIndex());
        assertThat((double) split.getThreshold().getContinuousValue(), greaterThan(2.0));
        assertThat((double) split.getThreshold().getContinuousValue(), lessThan(10.0));

        int a = data.getDefinition().get(1).getCategoryIndex("A");
        int b = data.getDefinition().get(1).getCategoryIndex("B");
        List<LeafNode> leaves = tree.getLeaves();
        assertEquals(FeatureValue.discrete(a), leaves.get(0).getPrediction());
        assertEquals(FeatureValue.discrete(b), leaves.get(1).getPrediction());

        int correct = 0;
        for (Instance instance : data.getDataset()) {
            if (instance.getValue(1).equals(tree.evaluate(instance).get())) {
                correct++;
            }
        }
        assertEquals(4, correct);
    }

    @Test
    public void testSplitRejectedForLeafSizeStillCountsTowardImportance() {
        // the best split isolates the single B, leaving a leaf smaller than the minimum
        TabularData data = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
                .addFeature("label", FeatureType.DISCRETE).addRow("1", "A").addRow("2", "A").addRow("3", "A")
                .addRow("10", "B").build();
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).minLeafInstances(2).build());

        assertEquals(1, tree.getNodeCount());
        assertTrue(tree.getRoot().isLeaf());
        assertEquals(FeatureValue.discrete(data.getDefinition().get(1).getCategoryIndex("A")),
                ((LeafNode) tree.getRoot()).getPrediction());

        FeatureImportance importance = tree.getFeatureImportance()[0];
        assertEquals(1, importance.getCount());
        assertThat(importance.getSumScoreDelta(), closeTo(0.375, EPSILON));
    }

    @Test
    public void testDecisionPath() {
        TabularData data = twoClusters();
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).build());

        Instance low = data.getDataset().get(0);
        List<Node> path = tree.getDecisionPath(low);
        assertEquals(2, path.size());
        assertSame(tree.getRoot(), path.get(0));
        assertSame(tree.findLeaf(low), path.get(1));
        assertSame(((SplitNode) tree.getRoot()).getLeft(), path.get(1));
    }

    @Test
    public void testIdenticalTargetsGiveSingleLeaf() {
        TabularData data = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
                .addFeature("label", FeatureType.DISCRETE).addRow("1", "A").addRow("5", "A").addRow("9", "A")
                .build();
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).build());

        assertEquals(1, tree.getNodeCount());
        assertEquals(1, tree.getLeafCount());
        assertTrue(tree.getRoot().isLeaf());
        assertEquals(0, tree.getFeatureImportance()[0].getCount());
    }

    @Test
    public void testTwinLeavesCollapseDuringBuild() {
        // the split lowers the impurity but both sides still predict A
        DatasetBuilder dataBuilder = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
                .addFeature("label", FeatureType.DISCRETE);
        for (int i = 0; i < 4; i++) {
            dataBuilder.addRow("0", "A");
        }
        dataBuilder.addRow("10", "A").addRow("10", "A").addRow("10", "A").addRow("10", "B");
        TabularData data = dataBuilder.build();

        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).maxDepth(1).build());

        assertEquals(1, tree.getNodeCount());
        assertEquals(1, tree.getLeafCount());
        assertEquals(FeatureValue.discrete(data.getDefinition().get(1).getCategoryIndex("A")),
                ((LeafNode) tree.getRoot()).getPrediction());
        assertEquals(1, tree.getFeatureImportance()[0].getCount());
    }

    @Test
    public void testRegressionLeafIsMean() {
        TabularData data = new DatasetBuilder().addFeature("x", FeatureType.CONTINUOUS)
                .addFeature("y", FeatureType.CONTINUOUS).addRow("1", "1").addRow("2", "2").addRow("3", "3")
                .addRow("4", "10").build();
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(1).maxDepth(1).build());

        List<LeafNode> leaves = tree.getLeaves();
        assertEquals(2, leaves.size());
        // the cut at mean + sd / 2 isolates the outlier
        assertEquals(Split.continuous(0, (float) (2.5 + Math.sqrt(5.0 / 3.0) / 2)),
                ((SplitNode) tree.getRoot()).getSplit());
        assertEquals(2.0f, leaves.get(0).getPrediction().getContinuousValue());
        assertEquals(10.0f, leaves.get(1).getPrediction().getContinuousValue());
    }

    static Stream<Arguments> treeConfigurations() {
        return Stream.of(Arguments.of(0, 1), Arguments.of(3, 1), Arguments.of(0, 5), Arguments.of(2, 10));
    }

    @ParameterizedTest
    @MethodSource("treeConfigurations")
    public void testLeafInvariants(int maxDepth, int minLeafInstances) {
        TabularData data = TestUtils.labeledMixture(300, 3, 101L);
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(3).maxDepth(maxDepth)
                .minLeafInstances(minLeafInstances).retainLeafInstances(true).build());

        if (maxDepth > 0) {
            assertThat(tree.getDepth(), lessThanOrEqualTo(maxDepth));
        }
        List<LeafNode> leaves = tree.getLeaves();
        assertEquals(tree.getLeafCount(), leaves.size());
        assertEquals(2 * tree.getLeafCount() - 1, tree.getNodeCount());

        int total = 0;
        int numberOfCategories = data.getDefinition().get(3).getNumberOfCategories();
        for (LeafNode leaf : leaves) {
            List<Instance> retained = leaf.getRetainedInstances();
            assertThat(retained.size(), greaterThanOrEqualTo(minLeafInstances));
            total += retained.size();

            int[] counts = new int[numberOfCategories];
            for (Instance instance : retained) {
                counts[instance.getCategoryIndex(3)] += 1;
            }
            int mode = 0;
            for (int i = 1; i < counts.length; i++) {
                if (counts[i] > counts[mode]) {
                    mode = i;
                }
            }
            assertEquals(mode, leaf.getPrediction().getCategoryIndex());
        }
        assertEquals(data.getDataset().size(), total);
    }

    @Test
    public void testRegressionLeafInvariant() {
        TabularData data = TestUtils.linearTarget(200, 7L, 1.0, -2.0);
        DecisionTree tree = build(data, TreeBuildConfig.builder().predictedFeatureIndex(2).minLeafInstances(3)
                .retainLeafInstances(true).build());

        assertThat(tree.getLeafCount(), greaterThan(1));
        for (LeafNode leaf : tree.getLeaves()) {
            double sum = 0;
            for (Instance instance : leaf.getRetainedInstances()) {
                sum += instance.getContinuousValue(2);
            }
            assertEquals((float) (sum / leaf.getRetainedInstances().size()),
                    leaf.getPrediction().getContinuousValue());
        }
    }

    @Test
    public void testClearRetainedInstances() {
        TabularData data = twoClusters();
        DecisionTree tree = build(data,
                TreeBuildConfig.builder().predictedFeatureIndex(1).retainLeafInstances(true).build());
        assertTrue(tree.getLeaves().get(0).hasRetainedInstances());
        assertEquals(2, tree.getLeaves().get(0).getRetainedInstances().size());

        tree.clearRetainedInstances();
        for (LeafNode leaf : tree.getLeaves()) {
            assertFalse(leaf.hasRetainedInstances());
            assertTrue(leaf.getRetainedInstances().isEmpty());
        }
    }

    @Test
    public void testDeterministicBuild() {
        TabularData data = TestUtils.labeledMixture(200, 4, 5L);
        TreeBuildConfig config = TreeBuildConfig.builder().predictedFeatureIndex(4).featuresToConsiderPerNode(2)
                .randomSeed(13L).build();
        DecisionTree first = build(data, config);
        DecisionTree second = build(data, config);

        assertEquals(first.getNodeCount(), second.getNodeCount());
        assertEquals(first.getLeafCount(), second.getLeafCount());
        for (Instance instance : data.getDataset()) {
            assertEquals(first.getDecisionPath(instance).size(), second.getDecisionPath(instance).size());
            assertEquals(first.evaluate(instance), second.evaluate(instance));
        }
    }

    @Test
    public void testFeatureSubsetOnlyUsesChosenFeatures() {
        TabularData data = TestUtils.labeledMixture(200, 4, 5L);
        DecisionTree tree = build(data,
                TreeBuildConfig.builder().predictedFeatureIndex(4).featuresToConsiderPerNode(1).build());
        List<SplitNode> splits = new ArrayList<>();
        collectSplits(tree.getRoot(), splits);
        for (SplitNode split : splits) {
            assertTrue(split.getFeatureIndex() != 4);
        }
        assertThat(tree.getNodeCount(), greaterThan(1));
    }

    private static void collectSplits(Node node, List<SplitNode> splits) {
        if (!node.isLeaf()) {
            SplitNode split = (SplitNode) node;
            splits.add(split);
            collectSplits(split.getLeft(), splits);
            collectSplits(split.getRight(), splits);
        }
    }

    @Test
    public void testInvalidFeatureSubsetFallsBackToAllFeatures() {
        TabularData data = TestUtils.labeledMixture(100, 2, 3L);
        DecisionTree all = build(data, TreeBuildConfig.builder().predictedFeatureIndex(2).build());
        DecisionTree fallback = build(data,
                TreeBuildConfig.builder().predictedFeatureIndex(2).featuresToConsiderPerNode(5).build());
        assertEquals(all.getNodeCount(), fallback.getNodeCount());
    }

    @Test
    public void testInvalidInput() {
        TabularData data = twoClusters();
        InstanceDefinition definition = data.getDefinition();
        Dataset dataset = data.getDataset();
        TreeBuildConfig valid = TreeBuildConfig.builder().predictedFeatureIndex(1).build();

        assertFalse(builder.build(definition, new Dataset(new ArrayList<>()), valid).isSuccess());
        assertFalse(builder.build(new InstanceDefinition(new ArrayList<>()), dataset, valid).isSuccess());
        assertFalse(builder.build(definition, dataset, valid.toBuilder().predictedFeatureIndex(2).build())
                .isSuccess());
        assertFalse(builder.build(definition, dataset, valid.toBuilder().minLeafInstances(0).build()).isSuccess());
        assertFalse(builder.build(definition, dataset, valid.toBuilder().maxDepth(-1).build()).isSuccess());

        Dataset narrow = new Dataset(Arrays.asList(Instance.of(FeatureValue.continuous(1f))));
        BuildResult<DecisionTree> result = builder.build(definition, narrow, valid);
        assertFalse(result.isSuccess());
        assertFalse(result.getValue().isPresent());
        assertTrue(result.getMessage().contains("width"));
    }
}
