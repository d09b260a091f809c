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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.randomforest.config.ComparisonOperator;
import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.FeatureDescriptor;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;

public class DecisionTreeTest {

    private InstanceDefinition definition;
    private LeafNode low;
    private LeafNode middle;
    private LeafNode high;
    private DecisionTree tree;

    @BeforeEach
    public void setUp() {
        definition = new InstanceDefinition(Arrays.asList(FeatureDescriptor.continuous("x", 0f, 1f, 0, false),
                FeatureDescriptor.discrete("c", Arrays.asList(FeatureDescriptor.UNKNOWN_CATEGORY, "p", "q"),
                        new int[3], 0, false),
                FeatureDescriptor.continuous("y", 0f, 1f, 0, false)));
        low = new LeafNode(2, FeatureType.CONTINUOUS, FeatureValue.continuous(-1f));
        middle = new LeafNode(2, FeatureType.CONTINUOUS, FeatureValue.continuous(0.5f));
        high = new LeafNode(2, FeatureType.CONTINUOUS, FeatureValue.continuous(3f));
        // x <= 1 ? low : (c == p ? middle : high)
        SplitNode right = new SplitNode(Split.discrete(1, 1), middle, high);
        SplitNode root = new SplitNode(Split.continuous(0, 1f), low, right);
        FeatureImportance[] importance = { new FeatureImportance(2.0, 1), new FeatureImportance(1.0, 1),
                new FeatureImportance() };
        tree = new DecisionTree(definition, 2, "t", root, 5, 3, importance);
    }

    private static Instance instance(float x, int c) {
        return Instance.of(FeatureValue.continuous(x), FeatureValue.discrete(c), FeatureValue.continuous(0f));
    }

    @Test
    public void testEvaluate() {
        assertEquals(ModelType.REGRESSION, tree.getModelType());
        assertEquals(-1f, tree.evaluate(instance(1f, 2)).get().getContinuousValue());
        assertEquals(0.5f, tree.evaluate(instance(1.5f, 1)).get().getContinuousValue());
        assertEquals(3f, tree.evaluate(instance(1.5f, 2)).get().getContinuousValue());
    }

    @Test
    public void testNarrowInstanceIsNotEvaluated() {
        Instance narrow = Instance.of(FeatureValue.continuous(0f), FeatureValue.discrete(1));
        assertFalse(tree.evaluate(narrow).isPresent());
    }

    @Test
    public void testEmptyTreePredictsZero() {
        DecisionTree empty = DecisionTree.empty(definition, 2);
        assertTrue(empty.isEmpty());
        assertEquals(FeatureValue.ZERO, empty.evaluate(instance(0f, 1)).get());
        assertTrue(empty.getLeaves().isEmpty());
        assertEquals(0, empty.getDepth());
        assertThrows(IllegalArgumentException.class, () -> empty.findLeaf(instance(0f, 1)));
    }

    @Test
    public void testLeavesLeftToRight() {
        List<LeafNode> leaves = tree.getLeaves();
        assertEquals(3, leaves.size());
        assertSame(low, leaves.get(0));
        assertSame(middle, leaves.get(1));
        assertSame(high, leaves.get(2));
        assertEquals(2, tree.getDepth());
    }

    @Test
    public void testDecisionPath() {
        List<Node> path = tree.getDecisionPath(instance(2f, 1));
        assertEquals(3, path.size());
        assertSame(tree.getRoot(), path.get(0));
        assertSame(middle, path.get(2));
        assertEquals(ComparisonOperator.EQUAL, ((SplitNode) path.get(1)).getLeftOperator());
    }

    @Test
    public void testFeatureImportanceIsCopied() {
        tree.getFeatureImportance()[0].add(10.0);
        assertEquals(2.0, tree.getFeatureImportance()[0].getSumScoreDelta());
        assertEquals(1, tree.getFeatureImportance()[0].getCount());
    }

    @Test
    public void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new DecisionTree(definition, 3, "t", low, 1, 1, new FeatureImportance[3]));
        assertThrows(IllegalArgumentException.class,
                () -> new DecisionTree(definition, 2, "t", low, 1, 1, new FeatureImportance[2]));
        assertThrows(IllegalArgumentException.class, () -> new SplitNode(Split.continuous(0, 1f), low, low));
    }
}
