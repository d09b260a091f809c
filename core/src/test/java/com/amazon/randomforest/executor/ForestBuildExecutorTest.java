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

package com.amazon.randomforest.executor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.randomforest.TestUtils;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.TabularData;
import com.amazon.randomforest.returntypes.BuildResult;
import com.amazon.randomforest.tree.DecisionTree;
import com.amazon.randomforest.tree.DecisionTreeBuilder;
import com.amazon.randomforest.tree.FeatureImportance;
import com.amazon.randomforest.tree.TreeBuildConfig;

@ExtendWith(MockitoExtension.class)
public class ForestBuildExecutorTest {

    private static final int numberOfTrees = 7;
    private static final long seed = 2024L;

    private static TabularData data;
    private static TreeBuildConfig config;

    @Mock
    private DecisionTreeBuilder treeBuilder;

    @BeforeAll
    public static void oneTimeSetUp() {
        data = TestUtils.labeledMixture(150, 3, 31L);
        config = TreeBuildConfig.builder().predictedFeatureIndex(3).minLeafInstances(2).build();
    }

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(new SequentialForestBuildExecutor(new DecisionTreeBuilder()),
                    new ParallelForestBuildExecutor(1, new DecisionTreeBuilder()),
                    new ParallelForestBuildExecutor(3, new DecisionTreeBuilder())).map(Arguments::of);
        }
    }

    private static TreeBatch build(AbstractForestBuildExecutor executor) {
        return executor.buildTrees(data.getDefinition(), data.getDataset(), config, numberOfTrees, seed);
    }

    private static void assertSameForest(TreeBatch expected, TreeBatch actual) {
        assertEquals(expected.getTrees().size(), actual.getTrees().size());
        for (int t = 0; t < expected.getTrees().size(); t++) {
            DecisionTree first = expected.getTrees().get(t);
            DecisionTree second = actual.getTrees().get(t);
            assertEquals(first.getName(), second.getName());
            assertEquals(first.getNodeCount(), second.getNodeCount());
            assertEquals(expected.getOutOfBag().get(t), actual.getOutOfBag().get(t));
            for (Instance instance : data.getDataset()) {
                assertEquals(first.evaluate(instance), second.evaluate(instance));
            }
        }
    }

    @Test
    public void testPartition() {
        assertArrayEquals(new int[] { 4, 3, 3 }, AbstractForestBuildExecutor.partition(10, 3));
        assertArrayEquals(new int[] { 5 }, AbstractForestBuildExecutor.partition(5, 1));
        assertArrayEquals(new int[] { 1, 1 }, AbstractForestBuildExecutor.partition(2, 2));
        assertThrows(IllegalArgumentException.class, () -> AbstractForestBuildExecutor.partition(2, 3));
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testBuildTrees(AbstractForestBuildExecutor executor) {
        TreeBatch batch = build(executor);

        assertTrue(batch.isSuccess());
        assertEquals(numberOfTrees, batch.getTrees().size());
        assertEquals(numberOfTrees, batch.getOutOfBag().size());
        for (int t = 0; t < numberOfTrees; t++) {
            assertEquals("tree" + t, batch.getTrees().get(t).getName());
        }

        FeatureImportance[] expected = TreeBatch.newImportance(data.getDefinition().size());
        for (DecisionTree tree : batch.getTrees()) {
            FeatureImportance[] importance = tree.getFeatureImportance();
            for (int i = 0; i < expected.length; i++) {
                expected[i].merge(importance[i]);
            }
        }
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i].getCount(), batch.getImportance()[i].getCount());
            assertEquals(expected[i].getSumScoreDelta(), batch.getImportance()[i].getSumScoreDelta(), 1e-9);
        }
    }

    @Test
    public void testSingleWorkerMatchesSequential() {
        TreeBatch sequential = build(new SequentialForestBuildExecutor(new DecisionTreeBuilder()));
        TreeBatch parallel = build(new ParallelForestBuildExecutor(1, new DecisionTreeBuilder()));
        assertSameForest(sequential, parallel);
    }

    @Test
    public void testParallelBuildIsReproducible() {
        TreeBatch first = build(new ParallelForestBuildExecutor(3, new DecisionTreeBuilder()));
        TreeBatch second = build(new ParallelForestBuildExecutor(3, new DecisionTreeBuilder()));
        assertSameForest(first, second);
    }

    @Test
    public void testFailedTreeFailsBatch() {
        when(treeBuilder.build(any(), any(), any(), any())).thenReturn(BuildResult.failure("bad input"));

        TreeBatch batch = build(new ParallelForestBuildExecutor(2, treeBuilder));

        assertFalse(batch.isSuccess());
        assertTrue(batch.getFailure().get().contains("bad input"));
        assertTrue(batch.getTrees().isEmpty());
        // each worker stops at its first failure
        verify(treeBuilder, times(2)).build(any(), any(), any(), any());
    }

    @Test
    public void testWorkerExceptionIsRethrown() {
        when(treeBuilder.build(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> build(new ParallelForestBuildExecutor(3, treeBuilder)));
        assertThrows(IllegalStateException.class, () -> build(new SequentialForestBuildExecutor(treeBuilder)));
        verify(treeBuilder, times(4)).build(any(), any(), any(), any());
    }

    @Test
    public void testCombineKeepsWorkerOrder() {
        TreeBatch first = build(new SequentialForestBuildExecutor(new DecisionTreeBuilder()));
        TreeBatch combined = TreeBatch.combine(Arrays.asList(first, TreeBatch.failure("second failed"), first),
                data.getDefinition().size());
        assertEquals("second failed", combined.getFailure().get());

        List<TreeBatch> both = Arrays.asList(first, first);
        TreeBatch doubled = TreeBatch.combine(both, data.getDefinition().size());
        assertEquals(2 * numberOfTrees, doubled.getTrees().size());
        assertEquals(first.getTrees().get(0), doubled.getTrees().get(numberOfTrees));
    }
}
