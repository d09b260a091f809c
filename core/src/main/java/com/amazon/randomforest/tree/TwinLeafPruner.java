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

import static com.amazon.randomforest.CommonUtils.approximatelyEqual;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.Instance;

/**
 * Collapses a split whose two children are leaves with the same prediction into
 * a single leaf. Classification leaves must hold the same category index;
 * regression leaves must be within {@link #REGRESSION_TOLERANCE} of each other.
 * <p>
 * {@link DecisionTreeBuilder} applies the rule while it builds, so running the
 * pruner on a freshly built tree changes nothing.
 */
public class TwinLeafPruner {

    public static final double REGRESSION_TOLERANCE = 1e-8;

    private TwinLeafPruner() {
    }

    public static boolean areTwins(ModelType modelType, Node left, Node right) {
        if (!left.isLeaf() || !right.isLeaf()) {
            return false;
        }
        if (modelType == ModelType.CLASSIFICATION) {
            return left.getValue().getCategoryIndex() == right.getValue().getCategoryIndex();
        }
        return approximatelyEqual(left.getValue().getContinuousValue(), right.getValue().getContinuousValue(),
                REGRESSION_TOLERANCE);
    }

    /**
     * Prunes a tree bottom up, so a collapse that creates new twins is collapsed
     * as well in the same pass. The merged leaf keeps the prediction of the left
     * leaf and the retained instances of both.
     *
     * @param tree a tree
     * @return the pruned tree and the number of collapsed splits
     */
    public static Result prune(DecisionTree tree) {
        if (tree.isEmpty()) {
            return new Result(tree, 0);
        }
        int[] pruned = new int[1];
        Node root = prune(tree.getRoot(), tree.getModelType(), pruned);
        if (pruned[0] == 0) {
            return new Result(tree, 0);
        }
        DecisionTree result = new DecisionTree(tree.getDefinition(), tree.getPredictedFeatureIndex(), tree.getName(),
                root, tree.getNodeCount() - 2 * pruned[0], tree.getLeafCount() - pruned[0],
                tree.getFeatureImportance());
        return new Result(result, pruned[0]);
    }

    private static Node prune(Node node, ModelType modelType, int[] pruned) {
        if (node.isLeaf()) {
            return node;
        }
        SplitNode split = (SplitNode) node;
        Node left = prune(split.getLeft(), modelType, pruned);
        Node right = prune(split.getRight(), modelType, pruned);
        if (areTwins(modelType, left, right)) {
            pruned[0] += 1;
            return merge((LeafNode) left, (LeafNode) right);
        }
        if (left == split.getLeft() && right == split.getRight()) {
            return split;
        }
        return new SplitNode(split.getSplit(), left, right);
    }

    private static LeafNode merge(LeafNode left, LeafNode right) {
        List<Instance> retained = null;
        if (left.hasRetainedInstances() || right.hasRetainedInstances()) {
            retained = new ArrayList<>(left.getRetainedInstances());
            retained.addAll(right.getRetainedInstances());
        }
        return new LeafNode(left.getFeatureIndex(), left.getFeatureType(), left.getPrediction(), retained);
    }

    /**
     * A pruned tree and the number of splits collapsed into leaves.
     */
    @Getter
    public static class Result {
        private final DecisionTree tree;
        private final int prunedCount;

        Result(DecisionTree tree, int prunedCount) {
            this.tree = tree;
            this.prunedCount = prunedCount;
        }
    }
}
