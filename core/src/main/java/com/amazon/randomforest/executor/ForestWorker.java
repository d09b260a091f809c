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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.Callable;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.randomforest.data.Dataset;
import com.amazon.randomforest.data.InstanceDefinition;
import com.amazon.randomforest.returntypes.BuildResult;
import com.amazon.randomforest.sampler.BootstrapSample;
import com.amazon.randomforest.sampler.BootstrapSampler;
import com.amazon.randomforest.tree.DecisionTree;
import com.amazon.randomforest.tree.DecisionTreeBuilder;
import com.amazon.randomforest.tree.FeatureImportance;
import com.amazon.randomforest.tree.TreeBuildConfig;
import com.amazon.randomforest.util.RandomSource;

/**
 * Builds one worker's share of a forest. The worker owns a random stream
 * seeded with {@code seed + workerIndex}; bootstrap draws and feature
 * sub-sampling for all of its trees advance that stream in tree order.
 */
@Getter
public class ForestWorker implements Callable<TreeBatch> {

    private static final Logger log = LoggerFactory.getLogger(ForestWorker.class);

    private final int workerIndex;
    private final int firstTreeIndex;
    private final int numberOfTrees;
    private final long seed;
    private final InstanceDefinition definition;
    private final Dataset dataset;
    private final TreeBuildConfig config;
    private final DecisionTreeBuilder treeBuilder;

    public ForestWorker(int workerIndex, int firstTreeIndex, int numberOfTrees, long seed,
            InstanceDefinition definition, Dataset dataset, TreeBuildConfig config, DecisionTreeBuilder treeBuilder) {
        this.workerIndex = workerIndex;
        this.firstTreeIndex = firstTreeIndex;
        this.numberOfTrees = numberOfTrees;
        this.seed = seed;
        this.definition = definition;
        this.dataset = dataset;
        this.config = config;
        this.treeBuilder = treeBuilder;
    }

    @Override
    public TreeBatch call() {
        RandomSource random = new RandomSource(seed + workerIndex);
        List<DecisionTree> trees = new ArrayList<>(numberOfTrees);
        List<BitSet> outOfBag = new ArrayList<>(numberOfTrees);
        FeatureImportance[] importance = TreeBatch.newImportance(definition.size());

        for (int i = 0; i < numberOfTrees; i++) {
            int treeIndex = firstTreeIndex + i;
            BootstrapSample sample = BootstrapSampler.sample(dataset, random);
            TreeBuildConfig treeConfig = config.toBuilder().name("tree" + treeIndex).build();
            BuildResult<DecisionTree> result = treeBuilder.build(definition, sample.getSample(), treeConfig, random);
            if (!result.isSuccess()) {
                log.error("worker {} failed to build tree {}: {}", workerIndex, treeIndex, result.getMessage());
                return TreeBatch.failure("failed to build tree " + treeIndex + ": " + result.getMessage());
            }
            DecisionTree tree = result.getValue().get();
            trees.add(tree);
            outOfBag.add(sample.getOutOfBag());
            FeatureImportance[] treeImportance = tree.getFeatureImportance();
            for (int f = 0; f < importance.length; f++) {
                importance[f].merge(treeImportance[f]);
            }
        }
        log.debug("worker {} built {} trees", workerIndex, numberOfTrees);
        return TreeBatch.success(trees, outOfBag, importance);
    }
}
