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

package com.amazon.randomforest.state;

import static com.amazon.randomforest.CommonUtils.checkArgument;
import static com.amazon.randomforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.randomforest.RandomForest;
import com.amazon.randomforest.config.ModelType;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.state.data.InstanceDefinitionMapper;
import com.amazon.randomforest.state.tree.DecisionTreeMapper;
import com.amazon.randomforest.state.tree.DecisionTreeState;
import com.amazon.randomforest.tree.DecisionTree;

/**
 * A utility class for creating a {@link RandomForestState} instance from a
 * {@link RandomForest} instance and vice versa.
 */
@Getter
@Setter
public class RandomForestMapper implements IStateMapper<RandomForest, RandomForestState> {

    /**
     * If true, the trees are included in the state. The directory layout stores
     * the trees in files of their own and leaves this off.
     */
    private boolean saveTreeState = true;

    /**
     * If true, the instance definition is included in the state.
     */
    private boolean saveInstanceDefinition = true;

    @Override
    public RandomForestState toState(RandomForest model) {
        checkArgument(model.getDefinition() != null, "only a trained forest can be saved");
        RandomForestState state = new RandomForestState();
        state.setVersion(Version.V1_0);
        state.setModelType(model.getModelType().name());
        state.setPredictedFeatureIndex(model.getPredictedFeatureIndex());
        state.setNumberOfTrees(model.getNumberOfTrees());
        state.setRandomSeed(model.getRandomSeed());
        state.setParallelExecutionEnabled(model.isParallelExecutionEnabled());
        state.setThreadPoolSize(model.getThreadPoolSize());
        state.setMaxDepth(model.getMaxDepth());
        state.setMinLeafInstances(model.getMinLeafInstances());
        state.setFeaturesToConsiderPerNode(model.getFeaturesToConsiderPerNode());
        state.setOutOfBagEstimate(model.isOutOfBagEstimate());

        if (saveInstanceDefinition) {
            state.setInstanceDefinitionState(new InstanceDefinitionMapper().toState(model.getDefinition()));
        }
        if (saveTreeState) {
            DecisionTreeMapper treeMapper = new DecisionTreeMapper();
            List<DecisionTreeState> treeStates = new ArrayList<>(model.getTrees().size());
            for (DecisionTree tree : model.getTrees()) {
                treeStates.add(treeMapper.toState(tree));
            }
            state.setTreeStates(treeStates);
        }
        return state;
    }

    @Override
    public RandomForest toModel(RandomForestState state) {
        checkNotNull(state.getInstanceDefinitionState(), "forest state has no instance definition");
        return toModel(state, new InstanceDefinitionMapper().toModel(state.getInstanceDefinitionState()),
                state.getTreeStates());
    }

    /**
     * Rebuilds a forest whose definition and trees were stored apart from the
     * forest state.
     *
     * @param state      the forest configuration
     * @param definition the shared instance definition
     * @param treeStates the trees, in forest order
     * @return the forest
     */
    public RandomForest toModel(RandomForestState state, InstanceDefinition definition,
            List<DecisionTreeState> treeStates) {
        checkNotNull(treeStates, "forest state has no trees");
        checkArgument(treeStates.size() == state.getNumberOfTrees(),
                "forest state declares " + state.getNumberOfTrees() + " trees but holds " + treeStates.size());
        checkArgument(state.getPredictedFeatureIndex() < definition.size(), "predicted feature index is out of range");
        ModelType declared = ModelType.valueOf(state.getModelType());
        checkArgument(declared == ModelType.forFeatureType(
                definition.get(state.getPredictedFeatureIndex()).getFeatureType()),
                "model type does not match the predicted feature");

        RandomForest.Builder<?> builder = RandomForest.builder().predictedFeatureIndex(state.getPredictedFeatureIndex())
                .numberOfTrees(state.getNumberOfTrees()).randomSeed(state.getRandomSeed())
                .maxDepth(state.getMaxDepth()).minLeafInstances(state.getMinLeafInstances())
                .featuresToConsiderPerNode(state.getFeaturesToConsiderPerNode())
                .parallelExecutionEnabled(state.isParallelExecutionEnabled())
                .outOfBagEstimate(state.isOutOfBagEstimate());
        if (state.isParallelExecutionEnabled()) {
            builder.threadPoolSize(state.getThreadPoolSize());
        }

        DecisionTreeMapper treeMapper = new DecisionTreeMapper();
        List<DecisionTree> trees = new ArrayList<>(treeStates.size());
        for (DecisionTreeState treeState : treeStates) {
            trees.add(treeMapper.toModel(treeState, definition));
        }
        return new RandomForest(builder, definition, trees);
    }
}
