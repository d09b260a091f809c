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

package com.amazon.randomforest.state.tree;

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.randomforest.config.ComparisonOperator;
import com.amazon.randomforest.config.FeatureType;
import com.amazon.randomforest.data.FeatureValue;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.state.IContextualStateMapper;
import com.amazon.randomforest.state.Version;
import com.amazon.randomforest.tree.DecisionTree;
import com.amazon.randomforest.tree.FeatureImportance;
import com.amazon.randomforest.tree.LeafNode;
import com.amazon.randomforest.tree.Node;
import com.amazon.randomforest.tree.Split;
import com.amazon.randomforest.tree.SplitNode;

/**
 * Maps a {@link DecisionTree} to a {@link DecisionTreeState}. Node ids are
 * assigned in pre-order: the root is 0, a left child takes the next id before
 * its subtree is numbered and a right child takes the next id after the left
 * subtree. Rebuilding accepts the nodes in any order since children are looked
 * up by id.
 */
public class DecisionTreeMapper implements IContextualStateMapper<DecisionTree, DecisionTreeState, InstanceDefinition> {

    public static final int ROOT_ID = 0;

    @Override
    public DecisionTreeState toState(DecisionTree model) {
        DecisionTreeState state = new DecisionTreeState();
        state.setVersion(Version.V1_0);
        state.setName(model.getName());
        state.setPredictedFeatureIndex(model.getPredictedFeatureIndex());
        state.setModelType(model.getModelType().name());
        state.setNodeCount(model.getNodeCount());
        state.setLeafCount(model.getLeafCount());

        List<NodeState> nodes = new ArrayList<>(model.getNodeCount());
        if (model.getRoot() != null) {
            writeNode(model.getRoot(), ROOT_ID, new int[] { ROOT_ID }, nodes);
        }
        state.setNodes(nodes);

        FeatureImportance[] importance = model.getFeatureImportance();
        double[] scores = new double[importance.length];
        int[] counts = new int[importance.length];
        for (int i = 0; i < importance.length; i++) {
            scores[i] = importance[i].getSumScoreDelta();
            counts[i] = importance[i].getCount();
        }
        state.setImportanceScores(scores);
        state.setImportanceCounts(counts);
        return state;
    }

    private void writeNode(Node node, int id, int[] lastId, List<NodeState> nodes) {
        NodeState state = new NodeState();
        state.setId(id);
        state.setFeatureIndex(node.getFeatureIndex());
        state.setFeatureType(node.getFeatureType().name());
        state.setFeatureValue(node.getFeatureType() == FeatureType.CONTINUOUS ? node.getValue().getContinuousValue()
                : node.getValue().getCategoryIndex());
        nodes.add(state);

        if (node.isLeaf()) {
            state.setNodeType(NodeState.LEAF);
            return;
        }
        SplitNode split = (SplitNode) node;
        state.setNodeType(NodeState.SPLIT);
        state.setLeftOperator(split.getLeftOperator().getSymbol());
        state.setRightOperator(split.getRightOperator().getSymbol());
        int leftId = ++lastId[0];
        state.setLeftId(leftId);
        writeNode(split.getLeft(), leftId, lastId, nodes);
        int rightId = ++lastId[0];
        state.setRightId(rightId);
        writeNode(split.getRight(), rightId, lastId, nodes);
    }

    @Override
    public DecisionTree toModel(DecisionTreeState state, InstanceDefinition definition) {
        checkNotNull(definition, "definition must not be null");
        int predictedFeatureIndex = state.getPredictedFeatureIndex();
        checkArgument(predictedFeatureIndex >= 0 && predictedFeatureIndex < definition.size(),
                "predicted feature index " + predictedFeatureIndex + " is out of range");

        checkArgument(state.getImportanceScores() == null || state.getImportanceScores().length == definition.size(),
                "importance scores must have one entry per feature");
        checkArgument(state.getImportanceCounts() == null || state.getImportanceCounts().length == definition.size(),
                "importance counts must have one entry per feature");
        FeatureImportance[] importance = new FeatureImportance[definition.size()];
        for (int i = 0; i < importance.length; i++) {
            double score = state.getImportanceScores() == null ? 0.0 : state.getImportanceScores()[i];
            int count = state.getImportanceCounts() == null ? 0 : state.getImportanceCounts()[i];
            importance[i] = new FeatureImportance(score, count);
        }

        List<NodeState> nodes = state.getNodes();
        if (nodes == null || nodes.isEmpty()) {
            return new DecisionTree(definition, predictedFeatureIndex, state.getName(), null, 0, 0, importance);
        }

        Map<Integer, NodeState> byId = new HashMap<>();
        for (NodeState node : nodes) {
            checkArgument(node.getId() != null, "node without id");
            checkArgument(byId.put(node.getId(), node) == null, "duplicate node id " + node.getId());
        }
        int[] counts = new int[2];
        Node root = readNode(ROOT_ID, byId, new HashSet<>(), definition, predictedFeatureIndex, counts);
        checkArgument(counts[0] == nodes.size(), "tree state holds nodes not reachable from the root");
        return new DecisionTree(definition, predictedFeatureIndex, state.getName(), root, counts[0], counts[1],
                importance);
    }

    private Node readNode(Integer id, Map<Integer, NodeState> byId, Set<Integer> visited,
            InstanceDefinition definition, int predictedFeatureIndex, int[] counts) {
        checkArgument(id != null, "split node without child id");
        NodeState state = byId.get(id);
        checkArgument(state != null, "missing node " + id);
        checkArgument(visited.add(id), "node " + id + " is referenced more than once");
        checkArgument(state.getFeatureIndex() >= 0 && state.getFeatureIndex() < definition.size(),
                "feature index " + state.getFeatureIndex() + " of node " + id + " is out of range");
        checkArgument(state.getFeatureType() != null, "node " + id + " has no feature type");
        FeatureType featureType = FeatureType.valueOf(state.getFeatureType());
        checkArgument(featureType == definition.get(state.getFeatureIndex()).getFeatureType(),
                "feature type of node " + id + " does not match the definition");
        FeatureValue value = featureType == FeatureType.CONTINUOUS
                ? FeatureValue.continuous((float) state.getFeatureValue())
                : FeatureValue.discrete((int) state.getFeatureValue());
        counts[0] += 1;

        if (NodeState.LEAF.equals(state.getNodeType())) {
            checkArgument(state.getFeatureIndex() == predictedFeatureIndex,
                    "leaf " + id + " does not hold the predicted feature");
            counts[1] += 1;
            return new LeafNode(predictedFeatureIndex, featureType, value);
        }
        checkArgument(NodeState.SPLIT.equals(state.getNodeType()), "unknown node type " + state.getNodeType());
        checkArgument(state.getFeatureIndex() != predictedFeatureIndex,
                "split " + id + " tests the predicted feature");
        Split split = new Split(state.getFeatureIndex(), featureType, value,
                ComparisonOperator.fromSymbol(state.getLeftOperator()),
                ComparisonOperator.fromSymbol(state.getRightOperator()));
        Node left = readNode(state.getLeftId(), byId, visited, definition, predictedFeatureIndex, counts);
        Node right = readNode(state.getRightId(), byId, visited, definition, predictedFeatureIndex, counts);
        return new SplitNode(split, left, right);
    }
}
