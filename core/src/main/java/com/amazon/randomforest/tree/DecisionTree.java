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
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.Instance;
import com.amazon.randomforest.data.InstanceDefinition;

/**
 * A trained binary decision tree. Trees are produced by
 * {@link DecisionTreeBuilder} or restored from state, and are not modified
 * afterwards apart from clearing instances retained at the leaves.
 */
@Getter
public class DecisionTree {

    private static final Logger log = LoggerFactory.getLogger(DecisionTree.class);

    private final InstanceDefinition definition;

    private final int predictedFeatureIndex;

    /**
     * derived from the type of the predicted feature
     */
    private final ModelType modelType;

    private final String name;

    /**
     * null for a tree that was never trained
     */
    private final Node root;

    private final int nodeCount;

    private final int leafCount;

    private final FeatureImportance[] featureImportance;

    public DecisionTree(InstanceDefinition definition, int predictedFeatureIndex, String name, Node root,
            int nodeCount, int leafCount, FeatureImportance[] featureImportance) {
        this.definition = checkNotNull(definition, "definition must not be null");
        checkArgument(predictedFeatureIndex >= 0 && predictedFeatureIndex < definition.size(),
                "predictedFeatureIndex is out of range");
        checkArgument(featureImportance.length == definition.size(),
                "feature importance must have one entry per feature");
        this.predictedFeatureIndex = predictedFeatureIndex;
        this.modelType = ModelType.forFeatureType(definition.get(predictedFeatureIndex).getFeatureType());
        this.name = name;
        this.root = root;
        this.nodeCount = nodeCount;
        this.leafCount = leafCount;
        this.featureImportance = featureImportance;
    }

    /**
     * @param definition            the schema of the instances to predict
     * @param predictedFeatureIndex the predicted column
     * @return a tree without nodes; it predicts zero
     */
    public static DecisionTree empty(InstanceDefinition definition, int predictedFeatureIndex) {
        FeatureImportance[] importance = new FeatureImportance[definition.size()];
        for (int i = 0; i < importance.length; i++) {
            importance[i] = new FeatureImportance();
        }
        return new DecisionTree(definition, predictedFeatureIndex, TreeBuildConfig.DEFAULT_NAME, null, 0, 0,
                importance);
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Walks the tree with an instance.
     *
     * @param instance the instance to predict
     * @return the value of the leaf reached; a zero value for an empty tree; empty
     *         if the instance is narrower than the definition
     */
    public Optional<FeatureValue> evaluate(Instance instance) {
        if (instance.getWidth() < definition.size()) {
            log.error("instance of width {} cannot be evaluated against a definition of {} features",
                    instance.getWidth(), definition.size());
            return Optional.empty();
        }
        if (root == null) {
            log.warn("evaluating empty tree {}", name);
            return Optional.of(FeatureValue.ZERO);
        }
        return Optional.of(findLeaf(instance).getPrediction());
    }

    /**
     * @param instance an instance at least as wide as the definition
     * @return the leaf the instance reaches
     */
    public LeafNode findLeaf(Instance instance) {
        checkArgument(root != null, "tree has no nodes");
        Node node = root;
        while (!node.isLeaf()) {
            node = ((SplitNode) node).next(instance);
        }
        return (LeafNode) node;
    }

    /**
     * @param instance an instance at least as wide as the definition
     * @return the nodes visited from the root to the leaf, inclusive
     */
    public List<Node> getDecisionPath(Instance instance) {
        List<Node> path = new ArrayList<>();
        Node node = root;
        while (node != null) {
            path.add(node);
            node = node.isLeaf() ? null : ((SplitNode) node).next(instance);
        }
        return path;
    }

    /**
     * @return the leaves from left to right
     */
    public List<LeafNode> getLeaves() {
        List<LeafNode> leaves = new ArrayList<>();
        if (root == null) {
            return leaves;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isLeaf()) {
                leaves.add((LeafNode) node);
            } else {
                stack.push(((SplitNode) node).getRight());
                stack.push(((SplitNode) node).getLeft());
            }
        }
        return leaves;
    }

    /**
     * @return the number of edges on the longest root to leaf path, 0 for a single
     *         leaf or an empty tree
     */
    public int getDepth() {
        return depth(root);
    }

    private static int depth(Node node) {
        if (node == null || node.isLeaf()) {
            return 0;
        }
        SplitNode split = (SplitNode) node;
        return 1 + Math.max(depth(split.getLeft()), depth(split.getRight()));
    }

    /**
     * Drops the instances retained at every leaf.
     */
    public void clearRetainedInstances() {
        for (LeafNode leaf : getLeaves()) {
            leaf.clearRetainedInstances();
        }
    }

    /**
     * @return a copy of the per-feature importance, parallel to the definition
     */
    public FeatureImportance[] getFeatureImportance() {
        FeatureImportance[] copy = new FeatureImportance[featureImportance.length];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = featureImportance[i].copy();
        }
        return copy;
    }
}
